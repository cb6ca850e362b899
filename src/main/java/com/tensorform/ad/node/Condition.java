package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.List;

/**
 * A binary condition: a comparison of two scalars, or a conjunction or
 * disjunction of two conditions. Only meaningful as the first operand of a
 * {@link Conditional}.
 */
public final class Condition extends AbstractExpr {

    public enum ConditionKind {
        EQ("=="),
        NE("!="),
        LE("<="),
        GE(">="),
        LT("<"),
        GT(">"),
        AND("&&"),
        OR("||");

        private final String symbol;

        ConditionKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    private final ConditionKind condition;

    public Condition(ConditionKind condition, Expr left, Expr right) {
        super(ExprKind.CONDITION, List.of(left, right), List.of(), Signatures.mergeFree(List.of(left, right)),
                Signatures.mergeDims(List.of(left, right)));
        if (condition.isLogical()) {
            if (!isCondition(left) || !isCondition(right))
                throw new IllegalArgumentException("Operands of " + condition.symbol() + " must be conditions");
        } else {
            Signatures.requireScalar(left, "Comparison");
            Signatures.requireScalar(right, "Comparison");
        }
        this.condition = condition;
    }

    static boolean isCondition(Expr e) {
        return e.kind() == ExprKind.CONDITION || e.kind() == ExprKind.NOT_CONDITION;
    }

    public ConditionKind condition() {
        return condition;
    }

    public Expr left() {
        return operands().get(0);
    }

    public Expr right() {
        return operands().get(1);
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new Condition(condition, newOperands.get(0), newOperands.get(1));
    }

    @Override
    protected Object attributes() {
        return condition;
    }

    @Override
    public String toString() {
        return left() + " " + condition.symbol() + " " + right();
    }
}
