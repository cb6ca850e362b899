package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.Index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Shape and free-index bookkeeping shared by the node constructors.
 */
public final class Signatures {
    private Signatures() {
        // Utility class
    }

    /** Concatenates index lists, keeping the first occurrence of each index. */
    @SafeVarargs
    public static List<Index> unique(Collection<Index>... lists) {
        LinkedHashSet<Index> set = new LinkedHashSet<>();
        for (Collection<Index> l : lists)
            set.addAll(l);
        return List.copyOf(set);
    }

    /** Free indices of all operands, first occurrence order. */
    public static List<Index> mergeFree(List<? extends Expr> ops) {
        LinkedHashSet<Index> set = new LinkedHashSet<>();
        for (Expr e : ops)
            set.addAll(e.freeIndices());
        return List.copyOf(set);
    }

    /** Union of the operands' index dimensions. Conflicting dimensions are rejected. */
    public static Map<Index, Integer> mergeDims(List<? extends Expr> ops) {
        Map<Index, Integer> dims = new LinkedHashMap<>();
        for (Expr e : ops)
            putAll(dims, e.indexDimensions());
        return dims;
    }

    public static void putAll(Map<Index, Integer> target, Map<Index, Integer> source) {
        for (var entry : source.entrySet()) {
            Integer prev = target.putIfAbsent(entry.getKey(), entry.getValue());
            if (prev != null && !prev.equals(entry.getValue()))
                throw new IllegalArgumentException("Index " + entry.getKey() + " used with dimensions "
                        + prev + " and " + entry.getValue());
        }
    }

    /** Returns {@code all} without the entries of {@code removed}. */
    public static List<Index> without(List<Index> all, Collection<Index> removed) {
        List<Index> out = new ArrayList<>(all.size());
        for (Index i : all)
            if (!removed.contains(i))
                out.add(i);
        return out;
    }

    public static boolean sameIndexSet(Expr a, Expr b) {
        return new HashSet<>(a.freeIndices()).equals(new HashSet<>(b.freeIndices()));
    }

    public static List<Integer> concat(List<Integer> a, List<Integer> b) {
        List<Integer> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    public static void requireScalar(Expr e, String context) {
        if (!e.isScalar())
            throw new IllegalArgumentException(context + " expects a scalar operand, got shape " + e.shape()
                    + " for " + e);
    }

    public static void requireSameSignature(List<? extends Expr> ops, String context) {
        Expr first = ops.get(0);
        for (Expr e : ops) {
            if (!e.shape().equals(first.shape()))
                throw new IllegalArgumentException(context + " operands have mismatching shapes " + first.shape()
                        + " and " + e.shape());
            if (!sameIndexSet(first, e))
                throw new IllegalArgumentException(context + " operands have mismatching free indices "
                        + first.freeIndices() + " and " + e.freeIndices());
        }
    }
}
