package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.List;
import java.util.Map;

/**
 * A literal value: zero, a scalar number or the identity matrix.
 */
public abstract class ConstantValue extends Terminal {

    protected ConstantValue(ExprKind kind, List<Integer> shape, List<Index> freeIndices,
            Map<Index, Integer> indexDimensions) {
        super(kind, shape, freeIndices, indexDimensions);
    }
}
