package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** A test or trial function; typically the direction of a Gateaux derivative. */
public final class Argument extends FormArgument {
    private final int number;

    public Argument(String name, int number, List<Integer> shape) {
        super(ExprKind.ARGUMENT, name, shape);
        this.number = number;
    }

    public int number() {
        return number;
    }
}
