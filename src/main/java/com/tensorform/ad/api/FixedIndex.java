package com.tensorform.ad.api;

/**
 * A multi-index slot bound to one concrete component.
 */
public final class FixedIndex implements IndexBase {
    private final int value;

    private FixedIndex(int value) {
        this.value = value;
    }

    public static FixedIndex of(int value) {
        if (value < 0)
            throw new IllegalArgumentException("Fixed index must be non-negative: " + value);
        return new FixedIndex(value);
    }

    public int value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FixedIndex f && f.value == value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
