package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.List;
import java.util.Map;

/**
 * A leaf of the expression DAG.
 */
public abstract class Terminal extends AbstractExpr {

    protected Terminal(ExprKind kind, List<Integer> shape) {
        this(kind, shape, List.of(), Map.of());
    }

    protected Terminal(ExprKind kind, List<Integer> shape, List<Index> freeIndices,
            Map<Index, Integer> indexDimensions) {
        super(kind, List.of(), shape, freeIndices, indexDimensions);
    }

    @Override
    protected final Expr rebuild(List<Expr> newOperands) {
        throw new IllegalStateException("Terminal has no operands: " + this);
    }
}
