package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/**
 * Unresolved derivative {@code diff(f, v)} with respect to a labeled variable.
 * The result shape is the shape of {@code f} followed by the shape of
 * {@code v}.
 */
public final class VariableDerivative extends AbstractExpr {

    public VariableDerivative(Expr operand, Variable variable) {
        super(ExprKind.VARIABLE_DERIVATIVE, List.of(operand, variable),
                Signatures.concat(operand.shape(), variable.shape()),
                Signatures.unique(operand.freeIndices(), variable.freeIndices()),
                Signatures.mergeDims(List.of(operand, variable)));
    }

    public Expr operand() {
        return operands().get(0);
    }

    public Variable variable() {
        return (Variable) operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new VariableDerivative(newOperands.get(0), (Variable) newOperands.get(1));
    }

    @Override
    public String toString() {
        return "d[" + operand() + "]/d[" + variable() + "]";
    }
}
