package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/**
 * A Bessel function {@code B_nu(x)} of the first or second kind, or its
 * modified variant. Operands are the order and the argument.
 */
public final class BesselFunction extends AbstractExpr {

    public enum BesselKind {
        J, Y, I, K
    }

    private final BesselKind function;

    public BesselFunction(BesselKind function, Expr order, Expr argument) {
        super(ExprKind.BESSEL_FUNCTION, List.of(order, argument), List.of(), argument.freeIndices(),
                argument.indexDimensions());
        if (!order.isTrueScalar())
            throw new IllegalArgumentException("Bessel order must be a scalar without free indices: " + order);
        Signatures.requireScalar(argument, "bessel_" + function);
        this.function = function;
    }

    public BesselKind function() {
        return function;
    }

    public Expr order() {
        return operands().get(0);
    }

    public Expr argument() {
        return operands().get(1);
    }

    /**
     * @return the order as an integer.
     * @throws IllegalStateException if the order is not an integer literal.
     */
    public int integerOrder() {
        Expr nu = order();
        if (nu instanceof Zero)
            return 0;
        if (nu instanceof ScalarValue s && s.isInteger())
            return (int) s.value();
        throw new IllegalStateException("Bessel order is not an integer literal: " + nu);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new BesselFunction(function, newOperands.get(0), newOperands.get(1));
    }

    @Override
    protected Object attributes() {
        return function;
    }

    @Override
    public String toString() {
        return "bessel_" + function + "(" + order() + ", " + argument() + ")";
    }
}
