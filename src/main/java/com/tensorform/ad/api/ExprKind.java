package com.tensorform.ad.api;

/**
 * Closed catalogue of expression node kinds.
 *
 * The differentiation engine switches over this enum without a default branch,
 * so adding a kind without a rule fails the build.
 */
public enum ExprKind {
    // Terminals
    ZERO(true),
    SCALAR_VALUE(true),
    IDENTITY(true),
    SPATIAL_COORDINATE(true),
    FACET_NORMAL(true),
    CONSTANT(true),
    COEFFICIENT(true),
    ARGUMENT(true),
    MULTI_INDEX(true),

    // Labels and indexing
    VARIABLE(false),
    INDEXED(false),
    LIST_TENSOR(false),
    COMPONENT_TENSOR(false),
    INDEX_SUM(false),

    // Algebra
    SUM(false),
    PRODUCT(false),
    DIVISION(false),
    POWER(false),
    ABS(false),
    MATH_FUNCTION(false),
    BESSEL_FUNCTION(false),

    // Restrictions and conditionals
    RESTRICTED(false),
    CONDITION(false),
    NOT_CONDITION(false),
    CONDITIONAL(false),

    // Unresolved derivative markers
    SPATIAL_DERIVATIVE(false),
    VARIABLE_DERIVATIVE(false),
    COEFFICIENT_DERIVATIVE(false),

    // Compound tensor operators, normally expanded before differentiation
    TRANSPOSED(false),
    TRACE(false),
    DEVIATORIC(false),
    DIV(false),
    CURL(false),
    GRAD(false),
    OUTER(false),
    INNER(false),
    DOT(false),
    CROSS(false),
    DETERMINANT(false),
    COFACTOR(false),
    INVERSE(false);

    private final boolean terminal;

    ExprKind(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isCompound() {
        return ordinal() >= TRANSPOSED.ordinal();
    }
}
