package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** {@code condition ? trueValue : falseValue}. Both branches share one signature. */
public final class Conditional extends AbstractExpr {

    public Conditional(Expr condition, Expr trueValue, Expr falseValue) {
        super(ExprKind.CONDITIONAL, List.of(condition, trueValue, falseValue), trueValue.shape(),
                Signatures.unique(trueValue.freeIndices(), condition.freeIndices()),
                Signatures.mergeDims(List.of(condition, trueValue, falseValue)));
        if (!Condition.isCondition(condition))
            throw new IllegalArgumentException("Expecting a condition, got " + condition);
        Signatures.requireSameSignature(List.of(trueValue, falseValue), "Conditional");
    }

    public Expr condition() {
        return operands().get(0);
    }

    public Expr trueValue() {
        return operands().get(1);
    }

    public Expr falseValue() {
        return operands().get(2);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Conditional(newOperands.get(0), newOperands.get(1), newOperands.get(2));
    }

    @Override
    public String toString() {
        return "(" + condition() + ") ? " + trueValue() + " : " + falseValue();
    }
}
