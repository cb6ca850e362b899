package com.tensorform.ad.dsl;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.Signatures;
import com.tensorform.ad.node.Zero;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index bookkeeping used by the differentiation rules.
 *
 * Key Responsibilities:
 * 1. Fresh index creation and duplicate-free merging of index lists.
 * 2. Typed zeros of an exact signature.
 * 3. Conversion between a tensor and its component form: {@code A} becomes
 * {@code (A[ii], ii)} with fresh {@code ii}, and back.
 * 4. Substitution of indices inside an expression, used to resolve
 * component access into a bound tensor.
 */
public final class IndexAlgebra {
    private IndexAlgebra() {
        // Utility class
    }

    /** A scalar in component form together with the indices it is free in. */
    public record Scalarized(Expr scalar, List<Index> indices) {
    }

    public static List<Index> indices(int n) {
        List<Index> out = new ArrayList<>(n);
        for (int k = 0; k < n; k++)
            out.add(new Index());
        return out;
    }

    @SafeVarargs
    public static List<Index> uniqueIndices(Collection<Index>... lists) {
        return Signatures.unique(lists);
    }

    @SafeVarargs
    public static Map<Index, Integer> mergeDimensions(Map<Index, Integer>... maps) {
        Map<Index, Integer> out = new LinkedHashMap<>();
        for (Map<Index, Integer> m : maps)
            Signatures.putAll(out, m);
        return out;
    }

    public static Zero makeZero(List<Integer> shape, List<Index> freeIndices, Map<Index, Integer> dims) {
        return new Zero(shape, freeIndices, dims);
    }

    /** Dimensions of the given indices, looked up in {@code dims}. */
    public static List<Integer> dimensionsOf(List<Index> indices, Map<Index, Integer> dims) {
        List<Integer> out = new ArrayList<>(indices.size());
        for (Index i : indices) {
            Integer d = dims.get(i);
            if (d == null)
                throw new IllegalArgumentException("No dimension known for index " + i);
            out.add(d);
        }
        return out;
    }

    /**
     * Converts {@code a} to component form. A scalar is returned as is with no
     * indices.
     */
    public static Scalarized asScalar(Expr a) {
        if (a.isScalar())
            return new Scalarized(a, List.of());
        List<Index> ii = indices(a.rank());
        return new Scalarized(Exprs.indexed(a, ii), ii);
    }

    /** Inverse of {@link #asScalar(Expr)}; a no-op for an empty index list. */
    public static Expr asTensor(Expr scalar, List<Index> ii) {
        if (ii.isEmpty())
            return scalar;
        return Exprs.asTensor(scalar, ii);
    }

    public static List<Index> concat(List<Index> a, List<Index> b) {
        List<Index> out = new ArrayList<>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }

    /**
     * Replaces free occurrences of the mapped indices in {@code e}.
     *
     * Indices bound by a component tensor or an index sum inside {@code e} are
     * left alone. Nodes are rebuilt with construction-time folding, so
     * substituting fixed values resolves identities and list components.
     */
    public static Expr replaceIndices(Expr e, Map<Index, ? extends IndexBase> mapping) {
        if (mapping.isEmpty())
            return e;
        return new Replacer(mapping).apply(e, mapping);
    }

    private static final class Replacer {
        private final Map<Index, ? extends IndexBase> root;
        private final Map<Expr, Expr> cache = new IdentityHashMap<>();

        Replacer(Map<Index, ? extends IndexBase> root) {
            this.root = root;
        }

        Expr apply(Expr e, Map<Index, ? extends IndexBase> mapping) {
            Map<Index, IndexBase> active = new LinkedHashMap<>();
            for (Index i : e.freeIndices()) {
                IndexBase target = mapping.get(i);
                if (target != null)
                    active.put(i, target);
            }
            if (active.isEmpty())
                return e;

            // Only results computed under the full mapping are shareable
            boolean cacheable = active.size() == countRoot(e);
            if (cacheable) {
                Expr hit = cache.get(e);
                if (hit != null)
                    return hit;
            }

            Expr result = switch (e.kind()) {
                case ZERO -> new Zero(e.shape(), renamed(e, active), renamedDims(e, active));
                case SCALAR_VALUE -> new ScalarValue(((ScalarValue) e).value(), renamed(e, active),
                        renamedDims(e, active));
                default -> {
                    List<Expr> ops = new ArrayList<>(e.operands().size());
                    for (Expr op : e.operands())
                        ops.add(op instanceof MultiIndex mi ? substitute(mi, active) : apply(op, active));
                    yield Exprs.rebuild(e, ops);
                }
            };
            if (cacheable)
                cache.put(e, result);
            return result;
        }

        private int countRoot(Expr e) {
            int n = 0;
            for (Index i : e.freeIndices())
                if (root.containsKey(i))
                    n++;
            return n;
        }

        private static MultiIndex substitute(MultiIndex mi, Map<Index, IndexBase> active) {
            List<IndexBase> out = new ArrayList<>(mi.size());
            boolean changed = false;
            for (IndexBase b : mi.indices()) {
                IndexBase t = b instanceof Index i ? active.get(i) : null;
                out.add(t != null ? t : b);
                changed |= t != null;
            }
            return changed ? new MultiIndex(out) : mi;
        }

        private static List<Index> renamed(Expr e, Map<Index, IndexBase> active) {
            List<Index> out = new ArrayList<>();
            for (Index i : e.freeIndices()) {
                IndexBase t = active.getOrDefault(i, i);
                if (t instanceof Index j)
                    out.add(j);
            }
            return Signatures.unique(out);
        }

        private static Map<Index, Integer> renamedDims(Expr e, Map<Index, IndexBase> active) {
            Map<Index, Integer> out = new LinkedHashMap<>();
            for (var entry : e.indexDimensions().entrySet()) {
                IndexBase t = active.getOrDefault(entry.getKey(), entry.getKey());
                if (t instanceof Index j)
                    Signatures.putAll(out, Map.of(j, entry.getValue()));
                else if (((FixedIndex) t).value() >= entry.getValue())
                    throw new IndexOutOfBoundsException("Fixed index " + t + " out of range for dimension "
                            + entry.getValue());
            }
            return out;
        }
    }

    /** True if {@code e} is a structural zero. */
    public static boolean isZero(Expr e) {
        return e != null && e.kind() == ExprKind.ZERO;
    }
}
