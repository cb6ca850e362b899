package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** A coefficient field, the quantity Gateaux derivatives are taken with respect to. */
public class Coefficient extends FormArgument {

    public Coefficient(String name, List<Integer> shape) {
        this(ExprKind.COEFFICIENT, name, shape);
    }

    protected Coefficient(ExprKind kind, String name, List<Integer> shape) {
        super(kind, name, shape);
    }
}
