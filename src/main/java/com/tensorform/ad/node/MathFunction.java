package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** An elementary function applied to a scalar. */
public final class MathFunction extends AbstractExpr {

    public enum MathKind {
        SQRT("sqrt"),
        EXP("exp"),
        LN("ln"),
        COS("cos"),
        SIN("sin"),
        TAN("tan"),
        ACOS("acos"),
        ASIN("asin"),
        ATAN("atan"),
        ERF("erf"),
        SIGN("sign");

        private final String symbol;

        MathKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static MathKind fromSymbol(String symbol) {
            for (MathKind k : values())
                if (k.symbol.equalsIgnoreCase(symbol))
                    return k;
            throw new IllegalArgumentException("Unknown math function: " + symbol);
        }
    }

    private final MathKind function;

    public MathFunction(MathKind function, Expr argument) {
        super(ExprKind.MATH_FUNCTION, List.of(argument), List.of(), argument.freeIndices(),
                argument.indexDimensions());
        Signatures.requireScalar(argument, function.symbol());
        this.function = function;
    }

    public MathKind function() {
        return function;
    }

    public Expr argument() {
        return operands().get(0);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new MathFunction(function, newOperands.get(0));
    }

    @Override
    protected Object attributes() {
        return function;
    }

    @Override
    public String toString() {
        return function.symbol() + "(" + argument() + ")";
    }
}
