package com.tensorform.ad.io;

import static com.tensorform.ad.io.JsonExpressionCompiler.getInt;
import static com.tensorform.ad.io.JsonExpressionCompiler.getShape;
import static com.tensorform.ad.io.JsonExpressionCompiler.getString;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.node.BesselFunction.BesselKind;
import com.tensorform.ad.node.CoefficientDerivativeMap;
import com.tensorform.ad.node.Condition.ConditionKind;
import com.tensorform.ad.node.MathFunction.MathKind;
import com.tensorform.ad.node.Restricted.Side;
import com.tensorform.ad.node.Variable;

import java.util.Arrays;
import java.util.List;

/**
 * Node types accepted in a JSON expression definition, each with its factory
 * and the number of inputs it takes ({@code -1} for any number).
 */
public enum ExprType {
    // --- Terminals ---
    SCALAR(0, (props, in, scope) -> Exprs.scalar(JsonExpressionCompiler.getDouble(props, "value", 0.0))),
    ZERO(0, (props, in, scope) -> Exprs.zero(getShape(props))),
    IDENTITY(0, (props, in, scope) -> Exprs.identity(getInt(props, "dim", scope.spatialDimension()))),
    SPATIAL_COORDINATE(0,
            (props, in, scope) -> Exprs.coordinate(getInt(props, "dim", scope.spatialDimension()))),
    FACET_NORMAL(0, (props, in, scope) -> Exprs.normal(getInt(props, "dim", scope.spatialDimension()))),
    COEFFICIENT(0, (props, in, scope) -> Exprs.coefficient(getString(props, "name", scope.nodeName()),
            getShape(props))),
    CONSTANT(0, (props, in, scope) -> Exprs.constant(getString(props, "name", scope.nodeName()),
            getShape(props))),
    ARGUMENT(0, (props, in, scope) -> Exprs.argument(getString(props, "name", scope.nodeName()),
            getInt(props, "number", 0), getShape(props))),

    // --- Indexing and tensors ---
    VARIABLE(1, (props, in, scope) -> Exprs.variable(in[0],
            scope.label(getString(props, "label", scope.nodeName())))),
    INDEXED(1, (props, in, scope) -> Exprs.indexed(in[0], scope.indexList(props, "indices"))),
    COMPONENT_TENSOR(1, (props, in, scope) -> Exprs.asTensor(in[0], scope.symbolicIndexList(props, "indices"))),
    INDEX_SUM(1, (props, in, scope) -> Exprs.indexSum(in[0], scope.symbolicIndex(props, "index"))),
    LIST_TENSOR(-1, (props, in, scope) -> Exprs.listTensor(Arrays.asList(in))),

    // --- Algebra ---
    SUM(-1, (props, in, scope) -> Exprs.sum(in)),
    PRODUCT(-1, (props, in, scope) -> Exprs.product(in)),
    MULTIPLY(2, (props, in, scope) -> Exprs.multiply(in[0], in[1])),
    DIVISION(2, (props, in, scope) -> Exprs.divide(in[0], in[1])),
    POWER(-1, (props, in, scope) -> in.length == 2 ? Exprs.power(in[0], in[1])
            : Exprs.power(in[0], JsonExpressionCompiler.getDouble(props, "exponent", 1.0))),
    ABS(1, (props, in, scope) -> Exprs.abs(in[0])),
    MATH_FUNCTION(1, (props, in, scope) -> Exprs.mathFunction(
            MathKind.fromSymbol(getString(props, "function", null)), in[0])),
    BESSEL_FUNCTION(1, (props, in, scope) -> Exprs.bessel(
            BesselKind.valueOf(getString(props, "function", "J").toUpperCase()),
            getInt(props, "order", 0), in[0])),
    RESTRICTED(1, (props, in, scope) -> Exprs.restricted(in[0],
            "-".equals(getString(props, "side", "+")) ? Side.MINUS : Side.PLUS)),

    // --- Conditions ---
    CONDITION(2, (props, in, scope) -> Exprs.condition(
            ConditionKind.valueOf(getString(props, "op", null).toUpperCase()), in[0], in[1])),
    NOT_CONDITION(1, (props, in, scope) -> Exprs.not(in[0])),
    CONDITIONAL(3, (props, in, scope) -> Exprs.conditional(in[0], in[1], in[2])),

    // --- Derivative markers ---
    SPATIAL_DERIVATIVE(1, (props, in, scope) -> Exprs.dx(in[0], scope.indexBase(props, "index"),
            getInt(props, "dim", scope.spatialDimension()))),
    VARIABLE_DERIVATIVE(2, (props, in, scope) -> {
        if (!(in[1] instanceof Variable v))
            throw new IllegalArgumentException("Second input of " + scope.nodeName() + " is not a variable");
        return Exprs.diff(in[0], v);
    }),
    COEFFICIENT_DERIVATIVE(1, (props, in, scope) -> {
        List<String> directions = JsonExpressionCompiler.getStringList(props, "directions");
        CoefficientDerivativeMap table = scope.derivativeTable(props, "derivatives");
        return Exprs.derivative(in[0], scope.coefficients(props, "coefficients"),
                directions.stream().map(scope::node).toList(), table);
    }),

    // --- Compound tensor operators ---
    TRANSPOSE(1, (props, in, scope) -> Exprs.transpose(in[0])),
    TRACE(1, (props, in, scope) -> Exprs.trace(in[0])),
    DEV(1, (props, in, scope) -> Exprs.dev(in[0])),
    DIV(1, (props, in, scope) -> Exprs.div(in[0])),
    CURL(1, (props, in, scope) -> Exprs.curl(in[0])),
    GRAD(1, (props, in, scope) -> Exprs.grad(in[0], getInt(props, "dim", scope.spatialDimension()))),
    OUTER(2, (props, in, scope) -> Exprs.outer(in[0], in[1])),
    INNER(2, (props, in, scope) -> Exprs.inner(in[0], in[1])),
    DOT(2, (props, in, scope) -> Exprs.dot(in[0], in[1])),
    CROSS(2, (props, in, scope) -> Exprs.cross(in[0], in[1])),
    DET(1, (props, in, scope) -> Exprs.det(in[0])),
    COFAC(1, (props, in, scope) -> Exprs.cofac(in[0])),
    INVERSE(1, (props, in, scope) -> Exprs.inverse(in[0]));

    private final int arity;
    private final JsonExpressionCompiler.ExprFactory factory;

    ExprType(int arity, JsonExpressionCompiler.ExprFactory factory) {
        this.arity = arity;
        this.factory = factory;
    }

    /** Number of inputs, or -1 for variadic types. */
    public int getArity() {
        return arity;
    }

    public JsonExpressionCompiler.ExprFactory getFactory() {
        return factory;
    }

    public static ExprType fromString(String text) {
        for (ExprType t : ExprType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown ExprType: " + text);
    }
}
