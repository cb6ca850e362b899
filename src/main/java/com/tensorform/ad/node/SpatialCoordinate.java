package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;

/**
 * The spatial coordinate vector {@code x}. Scalar in one dimension.
 */
public final class SpatialCoordinate extends Terminal {
    private final int dim;

    public SpatialCoordinate(int dim) {
        super(ExprKind.SPATIAL_COORDINATE, dim == 1 ? List.of() : List.of(dim));
        this.dim = dim;
    }

    public int dim() {
        return dim;
    }

    @Override
    protected Object attributes() {
        return dim;
    }

    @Override
    public String toString() {
        return "x";
    }
}
