package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Unresolved Gateaux derivative of {@code f} with respect to the coefficients
 * {@code w_k} in the directions {@code v_k}.
 *
 * Only the differentiated expression is an operand. Coefficients, directions
 * and the partial-derivative table are fixed attributes of the marker.
 */
public final class CoefficientDerivative extends AbstractExpr {
    private final List<Coefficient> coefficients;
    private final List<Expr> directions;
    private final CoefficientDerivativeMap derivatives;

    public CoefficientDerivative(Expr operand, List<Coefficient> coefficients, List<Expr> directions,
            CoefficientDerivativeMap derivatives) {
        super(ExprKind.COEFFICIENT_DERIVATIVE, List.of(operand), operand.shape(), operand.freeIndices(),
                operand.indexDimensions());
        if (coefficients.isEmpty() || coefficients.size() != directions.size())
            throw new IllegalArgumentException("Expecting one direction per coefficient, got "
                    + coefficients.size() + " coefficients and " + directions.size() + " directions");
        for (int k = 0; k < coefficients.size(); k++) {
            Coefficient w = coefficients.get(k);
            Expr v = directions.get(k);
            if (!w.shape().equals(v.shape()) || !v.freeIndices().isEmpty())
                throw new IllegalArgumentException("Direction " + v + " does not match the shape " + w.shape()
                        + " of " + w);
        }
        this.coefficients = List.copyOf(coefficients);
        this.directions = List.copyOf(directions);
        this.derivatives = derivatives;
    }

    public Expr operand() {
        return operands().get(0);
    }

    public List<Coefficient> coefficients() {
        return coefficients;
    }

    public List<Expr> directions() {
        return directions;
    }

    public CoefficientDerivativeMap derivatives() {
        return derivatives;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new CoefficientDerivative(newOperands.get(0), coefficients, directions, derivatives);
    }

    @Override
    protected Object attributes() {
        return List.of(coefficients, directions, derivatives);
    }

    @Override
    public String toString() {
        String w = coefficients.stream().map(Object::toString).collect(Collectors.joining(", "));
        String v = directions.stream().map(Object::toString).collect(Collectors.joining(", "));
        return "d/d[" + w + "] (" + operand() + ")[" + v + "]";
    }
}
