package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for all expression nodes.
 *
 * Caches the shape, free indices and index dimensions computed by the concrete
 * constructor, and implements structural equality over kind, operands and the
 * node's own attributes.
 *
 * Subclassing:
 * Compute the signature in the constructor, implement {@link #rebuild(List)}
 * to create a sibling over new operands, and override {@link #attributes()} when
 * the node carries data besides its operands.
 */
public abstract class AbstractExpr implements Expr {
    private final ExprKind kind;
    private final List<Expr> operands;
    private final List<Integer> shape;
    private final List<Index> freeIndices;
    private final Map<Index, Integer> indexDimensions;

    private int hash;

    protected AbstractExpr(ExprKind kind, List<Expr> operands, List<Integer> shape, List<Index> freeIndices,
            Map<Index, Integer> indexDimensions) {
        this.kind = kind;
        this.operands = List.copyOf(operands);
        this.shape = List.copyOf(shape);
        this.freeIndices = List.copyOf(freeIndices);

        // Dimensions are kept for free indices only
        Map<Index, Integer> dims = new LinkedHashMap<>();
        for (Index i : this.freeIndices) {
            Integer d = indexDimensions.get(i);
            if (d == null)
                throw new IllegalArgumentException("Missing dimension for free index " + i + " in " + kind);
            dims.put(i, d);
        }
        this.indexDimensions = Collections.unmodifiableMap(dims);
        for (int d : this.shape)
            if (d <= 0)
                throw new IllegalArgumentException("Shape dimensions must be positive: " + this.shape);
    }

    @Override
    public final ExprKind kind() {
        return kind;
    }

    @Override
    public final List<Expr> operands() {
        return operands;
    }

    @Override
    public final List<Integer> shape() {
        return shape;
    }

    @Override
    public final List<Index> freeIndices() {
        return freeIndices;
    }

    @Override
    public final Map<Index, Integer> indexDimensions() {
        return indexDimensions;
    }

    @Override
    public final Expr reconstruct(List<Expr> newOperands) {
        if (newOperands.size() != operands.size())
            throw new IllegalArgumentException("Expecting " + operands.size() + " operands for " + kind + ", got "
                    + newOperands.size());
        for (int i = 0; i < operands.size(); i++)
            if (newOperands.get(i) != operands.get(i))
                return rebuild(newOperands);
        return this;
    }

    /** Creates a node of the same kind and attributes over the given operands. */
    protected abstract Expr rebuild(List<Expr> newOperands);

    /** Non-operand data participating in equality. */
    protected Object attributes() {
        return null;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        AbstractExpr other = (AbstractExpr) o;
        return kind == other.kind
                && hashCode() == other.hashCode()
                && Objects.equals(attributes(), other.attributes())
                && operands.equals(other.operands);
    }

    @Override
    public final int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(kind, operands, attributes());
            if (h == 0)
                h = 1;
            hash = h;
        }
        return h;
    }
}
