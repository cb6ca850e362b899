package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An unknown or given field in a form: a coefficient or an argument.
 *
 * Each instance receives a process-unique count; equality is by count, so two
 * separately created fields with the same name are different fields.
 */
public abstract class FormArgument extends Terminal {
    private static final AtomicLong COUNTER = new AtomicLong();

    private final long count;
    private final String name;

    protected FormArgument(ExprKind kind, String name, List<Integer> shape) {
        super(kind, shape);
        this.count = COUNTER.incrementAndGet();
        this.name = name;
    }

    public long count() {
        return count;
    }

    public String name() {
        return name;
    }

    @Override
    protected Object attributes() {
        return count;
    }

    @Override
    public String toString() {
        return name != null ? name : "w_" + count;
    }
}
