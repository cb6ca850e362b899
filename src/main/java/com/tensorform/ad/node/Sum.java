package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;
import java.util.stream.Collectors;

/** Sum of equally shaped operands with equal free-index sets. */
public final class Sum extends AbstractExpr {

    public Sum(List<Expr> terms) {
        super(ExprKind.SUM, terms, first(terms).shape(), first(terms).freeIndices(), Signatures.mergeDims(terms));
        Signatures.requireSameSignature(terms, "Sum");
    }

    private static Expr first(List<Expr> terms) {
        if (terms.size() < 2)
            throw new IllegalArgumentException("Sum needs at least two terms");
        return terms.get(0);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Sum(newOperands);
    }

    @Override
    public String toString() {
        return operands().stream().map(Object::toString).collect(Collectors.joining(" + ", "(", ")"));
    }
}
