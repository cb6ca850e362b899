package com.tensorform.ad.engine;

import com.tensorform.ad.api.Expr;

/**
 * Result of visiting one node: the possibly rebuilt node and its derivative.
 *
 * The derivative is {@code null} for multi-indices and conditions, which have
 * no meaningful derivative and must never be consumed as one.
 */
public record Dual(Expr primal, Expr derivative) {
}
