package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A scalar literal. May carry free indices, in which case it is the same
 * number for every value of those indices.
 */
public final class ScalarValue extends ConstantValue {
    private final double value;

    public ScalarValue(double value) {
        this(value, List.of(), Map.of());
    }

    public ScalarValue(double value, List<Index> freeIndices, Map<Index, Integer> indexDimensions) {
        super(ExprKind.SCALAR_VALUE, List.of(), freeIndices, indexDimensions);
        if (value == 0.0)
            throw new IllegalArgumentException("Use Zero for a zero literal");
        this.value = value;
    }

    public double value() {
        return value;
    }

    public boolean isInteger() {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    /** True for a plain literal with no free indices equal to {@code v}. */
    public boolean isPlain(double v) {
        return value == v && freeIndices().isEmpty();
    }

    @Override
    protected Object attributes() {
        return List.of(value, Set.copyOf(freeIndices()));
    }

    @Override
    public String toString() {
        return isInteger() ? Long.toString((long) value) : Double.toString(value);
    }
}
