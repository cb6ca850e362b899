package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.List;

/** Summation of an expression over one bound index. */
public final class IndexSum extends AbstractExpr {

    public IndexSum(Expr summand, MultiIndex index) {
        super(ExprKind.INDEX_SUM, List.of(summand, index), summand.shape(),
                Signatures.without(summand.freeIndices(), checked(summand, index)), summand.indexDimensions());
    }

    private static List<Index> checked(Expr summand, MultiIndex index) {
        if (index.size() != 1 || !(index.get(0) instanceof Index i))
            throw new IllegalArgumentException("IndexSum expects exactly one symbolic index, got " + index);
        if (!summand.freeIndices().contains(i))
            throw new IllegalArgumentException("Summation index " + i + " is not free in " + summand);
        return List.of(i);
    }

    public Expr summand() {
        return operands().get(0);
    }

    public MultiIndex indexOperand() {
        return (MultiIndex) operands().get(1);
    }

    public Index index() {
        return (Index) indexOperand().get(0);
    }

    public int dimension() {
        return summand().indexDimensions().get(index());
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new IndexSum(newOperands.get(0), (MultiIndex) newOperands.get(1));
    }

    @Override
    public String toString() {
        return "sum_{" + index() + "}(" + summand() + ")";
    }
}
