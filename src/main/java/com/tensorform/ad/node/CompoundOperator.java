package com.tensorform.ad.node;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A tensor-algebra operator expressible in terms of indexing, products and
 * sums: transpose, trace, deviatoric part, div, curl, grad, outer, inner, dot,
 * cross, determinant, cofactor and inverse.
 *
 * These are normally expanded into primitives before differentiation.
 */
public final class CompoundOperator extends AbstractExpr {
    private final int gradientDimension;

    public CompoundOperator(ExprKind kind, List<Expr> operands) {
        this(kind, operands, 0);
    }

    /**
     * @param gradientDimension spatial dimension appended by {@link ExprKind#GRAD},
     *                          ignored by the other kinds.
     */
    public CompoundOperator(ExprKind kind, List<Expr> operands, int gradientDimension) {
        super(kind, operands, shape(kind, operands, gradientDimension), Signatures.mergeFree(operands),
                Signatures.mergeDims(operands));
        this.gradientDimension = kind == ExprKind.GRAD ? gradientDimension : 0;
    }

    private static List<Integer> shape(ExprKind kind, List<Expr> ops, int gradientDimension) {
        if (!kind.isCompound())
            throw new IllegalArgumentException(kind + " is not a compound operator");
        int arity = switch (kind) {
            case OUTER, INNER, DOT, CROSS -> 2;
            default -> 1;
        };
        if (ops.size() != arity)
            throw new IllegalArgumentException(kind + " takes " + arity + " operands, got " + ops.size());
        Expr a = ops.get(0);
        List<Integer> sa = a.shape();
        return switch (kind) {
            case TRANSPOSED -> {
                requireRank(kind, a, 2);
                yield List.of(sa.get(1), sa.get(0));
            }
            case TRACE -> {
                requireSquare(kind, a);
                yield List.of();
            }
            case DEVIATORIC, COFACTOR, INVERSE -> {
                requireSquare(kind, a);
                yield sa;
            }
            case DETERMINANT -> {
                if (!a.isScalar())
                    requireSquare(kind, a);
                yield List.of();
            }
            case DIV -> {
                if (a.isScalar())
                    throw new IllegalArgumentException("div of a scalar " + a);
                yield sa.subList(0, sa.size() - 1);
            }
            case CURL -> {
                if (sa.isEmpty())
                    yield List.of(2);
                if (sa.equals(List.of(2)))
                    yield List.of();
                if (sa.equals(List.of(3)))
                    yield List.of(3);
                throw new IllegalArgumentException("curl of shape " + sa);
            }
            case GRAD -> {
                if (gradientDimension <= 0)
                    throw new IllegalArgumentException("grad needs a positive spatial dimension");
                List<Integer> sh = new ArrayList<>(sa);
                sh.add(gradientDimension);
                yield sh;
            }
            case OUTER -> Signatures.concat(sa, ops.get(1).shape());
            case INNER -> {
                if (!sa.equals(ops.get(1).shape()))
                    throw new IllegalArgumentException("inner of shapes " + sa + " and " + ops.get(1).shape());
                yield List.of();
            }
            case DOT -> {
                List<Integer> sb = ops.get(1).shape();
                if (sa.isEmpty() || sb.isEmpty() || !sa.get(sa.size() - 1).equals(sb.get(0)))
                    throw new IllegalArgumentException("dot of shapes " + sa + " and " + sb);
                yield Signatures.concat(sa.subList(0, sa.size() - 1), sb.subList(1, sb.size()));
            }
            case CROSS -> {
                if (!sa.equals(List.of(3)) || !ops.get(1).shape().equals(List.of(3)))
                    throw new IllegalArgumentException("cross of shapes " + sa + " and " + ops.get(1).shape());
                yield List.of(3);
            }
            default -> throw new IllegalStateException("Unhandled compound kind " + kind);
        };
    }

    private static void requireRank(ExprKind kind, Expr a, int rank) {
        if (a.rank() != rank)
            throw new IllegalArgumentException(kind + " expects a rank-" + rank + " operand, got " + a.shape());
    }

    private static void requireSquare(ExprKind kind, Expr a) {
        requireRank(kind, a, 2);
        if (!a.shape().get(0).equals(a.shape().get(1)))
            throw new IllegalArgumentException(kind + " expects a square matrix, got " + a.shape());
    }

    public int gradientDimension() {
        return gradientDimension;
    }

    @Override
    protected Expr rebuild(List<Expr> newOperands) {
        return new CompoundOperator(kind(), newOperands, gradientDimension);
    }

    @Override
    protected Object attributes() {
        return gradientDimension;
    }

    @Override
    public String toString() {
        return kind().name().toLowerCase() + operands().stream().map(Object::toString)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
