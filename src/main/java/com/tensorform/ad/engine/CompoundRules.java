package com.tensorform.ad.engine;

import static com.tensorform.ad.dsl.IndexAlgebra.isZero;

import com.tensorform.ad.api.DifferentiationException;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.MissingRuleException;
import com.tensorform.ad.api.PreconditionException;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.node.CompoundOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Differentiation rules for compound tensor operators.
 *
 * Two catalogues:
 * 1. Operators that commute with differentiation: transpose, trace,
 * deviatoric part, div, curl and grad apply unchanged to the derivative of
 * their operand; outer, inner and dot follow the product rule.
 * 2. Operators without a rule: cross product, determinant, cofactor and
 * inverse. These must be expanded into primitives before differentiation.
 *
 * The commuting rules require a differentiation variable without extra shape,
 * since the operators act on the leading axes of their operands.
 */
final class CompoundRules {
    private final ForwardAD ad;

    CompoundRules(ForwardAD ad) {
        this.ad = ad;
    }

    Dual apply(Expr o) {
        if (!ad.varShape().isEmpty())
            throw ad.fatal(new PreconditionException("Compound operator " + o.kind()
                    + " can only be differentiated with respect to a scalar variable, got shape " + ad.varShape()));
        return switch (o.kind()) {
            case TRANSPOSED, TRACE, DEVIATORIC, DIV, CURL -> commute(o);
            case GRAD -> grad(o);
            case OUTER, INNER, DOT -> productRule(o);
            default -> throw unsupported(o);
        };
    }

    private Dual commute(Expr o) {
        Dual a = ad.visit(o.operands().get(0));
        Expr o2 = o.reconstruct(List.of(a.primal()));
        if (isZero(a.derivative()))
            return new Dual(o2, ad.makeZeroDiff(o2));
        return new Dual(o2, o2.reconstruct(List.of(a.derivative())));
    }

    private Dual grad(Expr o) {
        Dual a = ad.visit(o.operands().get(0));
        Expr o2 = o.reconstruct(List.of(a.primal()));
        if (Exprs.isSpatiallyConstant(a.derivative()))
            return new Dual(o2, ad.makeZeroDiff(o2));
        return new Dual(o2, o2.reconstruct(List.of(a.derivative())));
    }

    // (a . b)' = a' . b + a . b' for outer, inner and dot
    private Dual productRule(Expr o) {
        Dual a = ad.visit(o.operands().get(0));
        Dual b = ad.visit(o.operands().get(1));
        Expr o2 = o.reconstruct(List.of(a.primal(), b.primal()));

        List<Expr> terms = new ArrayList<>(2);
        if (!isZero(a.derivative()))
            terms.add(new CompoundOperator(o.kind(), List.of(a.derivative(), b.primal())));
        if (!isZero(b.derivative()))
            terms.add(new CompoundOperator(o.kind(), List.of(a.primal(), b.derivative())));
        if (terms.isEmpty())
            return new Dual(o2, ad.makeZeroDiff(o2));
        return new Dual(o2, Exprs.sum(terms));
    }

    DifferentiationException unsupported(Expr o) {
        String what = switch (o.kind()) {
            case CROSS -> "cross product";
            case DETERMINANT -> "determinant";
            case COFACTOR -> "cofactor";
            case INVERSE -> "inverse";
            default -> o.kind().name().toLowerCase();
        };
        return ad.fatal(new MissingRuleException("Derivative of " + what
                + " not implemented, expand compound operators before differentiation."));
    }
}
