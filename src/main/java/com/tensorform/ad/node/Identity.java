package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;
import java.util.Map;

/** The {@code dim x dim} identity matrix. */
public final class Identity extends ConstantValue {
    private final int dim;

    public Identity(int dim) {
        super(ExprKind.IDENTITY, List.of(dim, dim), List.of(), Map.of());
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
        return "I";
    }
}
