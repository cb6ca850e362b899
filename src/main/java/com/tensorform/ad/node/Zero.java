package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A typed zero tensor.
 *
 * The signature (shape, free indices, index dimensions) is part of the value:
 * two zeros with different signatures are different nodes.
 */
public final class Zero extends ConstantValue {

    public Zero() {
        this(List.of(), List.of(), Map.of());
    }

    public Zero(List<Integer> shape) {
        this(shape, List.of(), Map.of());
    }

    public Zero(List<Integer> shape, List<Index> freeIndices, Map<Index, Integer> indexDimensions) {
        super(ExprKind.ZERO, shape, freeIndices, indexDimensions);
    }

    @Override
    protected Object attributes() {
        return List.of(shape(), Set.copyOf(freeIndices()), indexDimensions());
    }

    @Override
    public String toString() {
        return "0";
    }
}
