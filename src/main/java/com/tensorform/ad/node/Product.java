package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Product of scalar operands. Free indices are merged; repeated indices are
 * not summed here, that is the job of an enclosing {@link IndexSum}.
 */
public final class Product extends AbstractExpr {

    public Product(List<Expr> factors) {
        super(ExprKind.PRODUCT, checked(factors), List.of(), Signatures.mergeFree(factors),
                Signatures.mergeDims(factors));
    }

    private static List<Expr> checked(List<Expr> factors) {
        if (factors.size() < 2)
            throw new IllegalArgumentException("Product needs at least two factors");
        for (Expr f : factors)
            Signatures.requireScalar(f, "Product");
        return factors;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Product(newOperands);
    }

    @Override
    public String toString() {
        return operands().stream().map(Object::toString).collect(Collectors.joining(" * "));
    }
}
