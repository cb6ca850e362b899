package com.tensorform.ad.api;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A symbolic tensor index.
 *
 * Indices are opaque identities: two indices are equal only if they are the
 * same object. The numeric id only serves rendering and stable ordering.
 */
public final class Index implements IndexBase, Comparable<Index> {
    private static final AtomicLong COUNTER = new AtomicLong();

    private final long id;

    public Index() {
        this.id = COUNTER.incrementAndGet();
    }

    public long id() {
        return id;
    }

    @Override
    public int compareTo(Index other) {
        return Long.compare(id, other.id);
    }

    @Override
    public String toString() {
        return "i_" + id;
    }
}
