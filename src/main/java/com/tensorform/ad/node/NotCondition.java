package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** Boolean negation of a condition. */
public final class NotCondition extends AbstractExpr {

    public NotCondition(Expr condition) {
        super(ExprKind.NOT_CONDITION, List.of(condition), List.of(), condition.freeIndices(),
                condition.indexDimensions());
        if (!Condition.isCondition(condition))
            throw new IllegalArgumentException("Expecting a condition, got " + condition);
    }

    public Expr condition() {
        return operands().get(0);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new NotCondition(newOperands.get(0));
    }

    @Override
    public String toString() {
        return "!(" + condition() + ")";
    }
}
