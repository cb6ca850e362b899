package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** Outward unit normal of a facet. */
public final class FacetNormal extends Terminal {
    private final int dim;

    public FacetNormal(int dim) {
        super(ExprKind.FACET_NORMAL, List.of(dim));
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
        return "n";
    }
}
