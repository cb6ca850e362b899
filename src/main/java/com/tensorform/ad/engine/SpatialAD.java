package com.tensorform.ad.engine;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.node.Constant;
import com.tensorform.ad.node.FormArgument;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.SpatialCoordinate;
import com.tensorform.ad.node.SpatialDerivative;

import java.util.List;
import java.util.Map;

/**
 * Derivative with respect to one component of the spatial coordinate.
 *
 * The component is either fixed or a symbolic index ranging over the spatial
 * dimension; in the latter case every derivative carries that index free.
 */
public class SpatialAD extends ForwardAD {
    private final IndexBase index;

    public SpatialAD(AdContext context, int spatialDimension, IndexBase index) {
        super(context, spatialDimension, List.of(), freeIndices(index), dimensions(index, spatialDimension));
        this.index = index;
    }

    private static List<Index> freeIndices(IndexBase index) {
        return index instanceof Index i ? List.of(i) : List.of();
    }

    private static Map<Index, Integer> dimensions(IndexBase index, int spatialDimension) {
        return index instanceof Index i ? Map.of(i, spatialDimension) : Map.of();
    }

    public IndexBase index() {
        return index;
    }

    @Override
    public String describeVariable() {
        return "x_" + index;
    }

    /** {@code dx_i/dx_k = delta_ik}, or {@code 1} in one dimension. */
    @Override
    protected Dual spatialCoordinate(SpatialCoordinate o) {
        if (o.isScalar()) {
            if (index instanceof Index i)
                return new Dual(o, new ScalarValue(1, List.of(i), Map.of(i, spatialDimension)));
            return new Dual(o, new ScalarValue(1));
        }
        Index r = new Index();
        Expr column = Exprs.asTensor(Exprs.indexed(Exprs.identity(spatialDimension), r, index), r);
        return new Dual(o, column);
    }

    @Override
    protected Dual constant(Constant o) {
        return terminal(o);
    }

    /**
     * Unknown fields get a deferred spatial derivative. A symbolic index used
     * here must not also be bound inside the expression; the index-sum rule
     * rejects that case.
     */
    @Override
    protected Dual formArgument(FormArgument o) {
        return new Dual(o, new SpatialDerivative(o, MultiIndex.of(index), spatialDimension));
    }
}
