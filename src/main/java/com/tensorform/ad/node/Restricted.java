package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/** The trace of an expression taken from one side of an interior facet. */
public final class Restricted extends AbstractExpr {

    public enum Side {
        PLUS("+"),
        MINUS("-");

        private final String symbol;

        Side(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Side side;

    public Restricted(Expr operand, Side side) {
        super(ExprKind.RESTRICTED, List.of(operand), operand.shape(), operand.freeIndices(),
                operand.indexDimensions());
        this.side = side;
    }

    public Expr operand() {
        return operands().get(0);
    }

    public Side side() {
        return side;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Restricted(newOperands.get(0), side);
    }

    @Override
    protected Object attributes() {
        return side;
    }

    @Override
    public String toString() {
        return "(" + operand() + ")('" + side.symbol() + "')";
    }
}
