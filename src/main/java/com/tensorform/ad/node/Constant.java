package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** A spatially constant coefficient. */
public final class Constant extends Coefficient {

    public Constant(String name) {
        this(name, List.of());
    }

    public Constant(String name, List<Integer> shape) {
        super(ExprKind.CONSTANT, name, shape);
    }
}
