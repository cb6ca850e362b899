package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Known partial derivatives of coefficients that depend on the coefficients a
 * Gateaux derivative is taken with respect to.
 *
 * An entry for coefficient {@code g} holds either one expression
 * {@code dg/dw} or one expression per direction. Each expression has the
 * shape of {@code g} followed by the shape of the matching direction.
 */
public final class CoefficientDerivativeMap {
    private static final CoefficientDerivativeMap EMPTY = new CoefficientDerivativeMap(Map.of());

    private final Map<Coefficient, List<Expr>> entries;

    private CoefficientDerivativeMap(Map<Coefficient, List<Expr>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static CoefficientDerivativeMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return the derivative expressions, or {@code null} if the coefficient is unknown. */
    public List<Expr> get(Coefficient coefficient) {
        return entries.get(coefficient);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Map<Coefficient, List<Expr>> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CoefficientDerivativeMap m && entries.equals(m.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {
        private final Map<Coefficient, List<Expr>> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(Coefficient coefficient, Expr... derivatives) {
            return put(coefficient, List.of(derivatives));
        }

        public Builder put(Coefficient coefficient, List<Expr> derivatives) {
            if (derivatives.isEmpty())
                throw new IllegalArgumentException("No derivatives given for " + coefficient);
            for (Expr d : derivatives) {
                if (d.shape().size() < coefficient.rank()
                        || !d.shape().subList(0, coefficient.rank()).equals(coefficient.shape()))
                    throw new IllegalArgumentException("Derivative " + d + " of shape " + d.shape()
                            + " does not start with the shape " + coefficient.shape() + " of " + coefficient);
            }
            entries.put(coefficient, List.copyOf(derivatives));
            return this;
        }

        public CoefficientDerivativeMap build() {
            return entries.isEmpty() ? EMPTY : new CoefficientDerivativeMap(new LinkedHashMap<>(entries));
        }
    }
}
