package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unresolved derivative {@code f.dx(i)} with respect to one spatial coordinate
 * component. A symbolic index becomes free in the result, ranging over the
 * spatial dimension.
 */
public final class SpatialDerivative extends AbstractExpr {
    private final int spatialDimension;

    public SpatialDerivative(Expr operand, MultiIndex index, int spatialDimension) {
        super(ExprKind.SPATIAL_DERIVATIVE, List.of(operand, index), operand.shape(),
                Signatures.unique(operand.freeIndices(), index.symbolicIndices()),
                dims(operand, index, spatialDimension));
        this.spatialDimension = spatialDimension;
    }

    private static Map<Index, Integer> dims(Expr operand, MultiIndex index, int spatialDimension) {
        if (index.size() != 1)
            throw new IllegalArgumentException("Spatial derivative takes exactly one index, got " + index);
        if (spatialDimension <= 0)
            throw new IllegalArgumentException("Spatial dimension must be positive: " + spatialDimension);
        IndexBase b = index.get(0);
        Map<Index, Integer> dims = new LinkedHashMap<>(operand.indexDimensions());
        if (b instanceof Index i)
            Signatures.putAll(dims, Map.of(i, spatialDimension));
        else if (((FixedIndex) b).value() >= spatialDimension)
            throw new IndexOutOfBoundsException("Component " + b + " out of range for dimension "
                    + spatialDimension);
        return dims;
    }

    public Expr operand() {
        return operands().get(0);
    }

    public MultiIndex index() {
        return (MultiIndex) operands().get(1);
    }

    public int spatialDimension() {
        return spatialDimension;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new SpatialDerivative(newOperands.get(0), (MultiIndex) newOperands.get(1), spatialDimension);
    }

    @Override
    protected Object attributes() {
        return spatialDimension;
    }

    @Override
    public String toString() {
        return "d[" + operand() + "]/dx_" + index();
    }
}
