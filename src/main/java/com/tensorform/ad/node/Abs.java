package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** Absolute value of a scalar. */
public final class Abs extends AbstractExpr {

    public Abs(Expr argument) {
        super(ExprKind.ABS, List.of(argument), List.of(), argument.freeIndices(), argument.indexDimensions());
        Signatures.requireScalar(argument, "Abs");
    }

    public Expr argument() {
        return operands().get(0);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Abs(newOperands.get(0));
    }

    @Override
    public String toString() {
        return "|" + argument() + "|";
    }
}
