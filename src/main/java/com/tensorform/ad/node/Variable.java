package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Label;

import java.util.List;

/**
 * A labeled sub-expression. The label, not the wrapped expression, identifies
 * the quantity when differentiating with respect to it.
 */
public final class Variable extends AbstractExpr {
    private final Label label;

    public Variable(Expr expression, Label label) {
        super(ExprKind.VARIABLE, List.of(expression), expression.shape(), expression.freeIndices(),
                expression.indexDimensions());
        this.label = label;
    }

    public Expr expression() {
        return operands().get(0);
    }

    public Label label() {
        return label;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Variable(newOperands.get(0), label);
    }

    @Override
    protected Object attributes() {
        return label;
    }

    @Override
    public String toString() {
        return "var[" + label + "]";
    }
}
