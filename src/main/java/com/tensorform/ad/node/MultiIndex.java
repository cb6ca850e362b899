package com.tensorform.ad.node;

import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered sequence of index slots used as an operand of indexing, binding
 * and spatial-derivative nodes.
 *
 * A multi-index is not a tensor value: its shape and free indices are empty.
 * Owners compute the dimensions of the symbolic slots themselves.
 */
public final class MultiIndex extends Terminal {
    private final List<IndexBase> indices;

    public MultiIndex(List<? extends IndexBase> indices) {
        super(ExprKind.MULTI_INDEX, List.of());
        this.indices = List.copyOf(indices);
    }

    public static MultiIndex of(IndexBase... indices) {
        return new MultiIndex(List.of(indices));
    }

    public List<IndexBase> indices() {
        return indices;
    }

    public int size() {
        return indices.size();
    }

    public IndexBase get(int i) {
        return indices.get(i);
    }

    /** The symbolic slots, in order. */
    public List<Index> symbolicIndices() {
        List<Index> out = new ArrayList<>();
        for (IndexBase b : indices)
            if (b instanceof Index i)
                out.add(i);
        return out;
    }

    public boolean allFixed() {
        for (IndexBase b : indices)
            if (!(b instanceof FixedIndex))
                return false;
        return true;
    }

    @Override
    protected Object attributes() {
        return indices;
    }

    @Override
    public String toString() {
        return indices.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
