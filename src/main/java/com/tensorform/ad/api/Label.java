package com.tensorform.ad.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a labeled sub-expression.
 *
 * Two variables carrying the same label denote the same quantity regardless of
 * how their wrapped expressions are built. Equality is by identity.
 */
public final class Label {
    private static final AtomicLong COUNTER = new AtomicLong();

    private final long count;
    private final String name;

    public Label() {
        this(null);
    }

    public Label(String name) {
        this.count = COUNTER.incrementAndGet();
        this.name = name;
    }

    public long count() {
        return count;
    }

    @Override
    public String toString() {
        return name != null ? name : "var_" + count;
    }
}
