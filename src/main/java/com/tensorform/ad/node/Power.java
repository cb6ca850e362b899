package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** Scalar power {@code base ** exponent}. */
public final class Power extends AbstractExpr {

    public Power(Expr base, Expr exponent) {
        super(ExprKind.POWER, List.of(base, exponent), List.of(), Signatures.mergeFree(List.of(base, exponent)),
                Signatures.mergeDims(List.of(base, exponent)));
        Signatures.requireScalar(base, "Power");
        Signatures.requireScalar(exponent, "Power");
    }

    public Expr base() {
        return operands().get(0);
    }

    public Expr exponent() {
        return operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Power(newOperands.get(0), newOperands.get(1));
    }

    @Override
    public String toString() {
        return base() + " ** " + exponent();
    }
}
