package com.tensorform.ad.api;

import java.util.List;
import java.util.Map;

/**
 * An immutable node in a tensor-valued expression DAG.
 *
 * Every node reports the same three pieces of type information:
 *
 * 1. Shape: the ordered tensor dimensions of the value ({@code []} for a
 * scalar).
 *
 * 2. Free indices: the symbolic indices appearing unbound inside the node.
 * Each contributes an implicit outer loop. The list is unique and its order is
 * deterministic, but correctness never depends on that order.
 *
 * 3. Index dimensions: for every free index, the range it loops over. The key
 * set is always a superset of the free indices.
 *
 * Sharing:
 * Nodes are never mutated. The same node object may be referenced from several
 * parents, so an expression is a DAG rather than a tree. Object identity is
 * what the differentiation caches key on; {@link #equals(Object)} is
 * structural.
 */
public interface Expr {

    /** The node kind, used for exhaustive rule dispatch. */
    ExprKind kind();

    /** The child nodes, in kind-specific order. Empty for terminals. */
    List<Expr> operands();

    /** Tensor shape; an empty list for scalars. */
    List<Integer> shape();

    /** Unbound symbolic indices, unique and in a deterministic order. */
    List<Index> freeIndices();

    /** Dimension of each free index. */
    Map<Index, Integer> indexDimensions();

    /**
     * Rebuilds a node of the same kind and attributes over new operands.
     *
     * @param operands the replacement operands, same arity as
     *                 {@link #operands()}.
     * @return {@code this} if every operand is the identical object, otherwise a
     *         new node.
     */
    Expr reconstruct(List<Expr> operands);

    default int rank() {
        return shape().size();
    }

    /** True when the shape is empty. Free indices are allowed. */
    default boolean isScalar() {
        return shape().isEmpty();
    }

    /** True when the shape is empty and there are no free indices. */
    default boolean isTrueScalar() {
        return shape().isEmpty() && freeIndices().isEmpty();
    }
}
