package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** Scalar division {@code a / b}. */
public final class Division extends AbstractExpr {

    public Division(Expr numerator, Expr denominator) {
        super(ExprKind.DIVISION, List.of(numerator, denominator), List.of(),
                Signatures.mergeFree(List.of(numerator, denominator)),
                Signatures.mergeDims(List.of(numerator, denominator)));
        Signatures.requireScalar(numerator, "Division");
        Signatures.requireScalar(denominator, "Division");
    }

    public Expr numerator() {
        return operands().get(0);
    }

    public Expr denominator() {
        return operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Division(newOperands.get(0), newOperands.get(1));
    }

    @Override
    public String toString() {
        return "(" + numerator() + " / " + denominator() + ")";
    }
}
