package com.tensorform.ad.testing;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.node.ComponentTensor;
import com.tensorform.ad.node.Condition;
import com.tensorform.ad.node.Conditional;
import com.tensorform.ad.node.Division;
import com.tensorform.ad.node.FormArgument;
import com.tensorform.ad.node.IndexSum;
import com.tensorform.ad.node.Indexed;
import com.tensorform.ad.node.MathFunction;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.NotCondition;
import com.tensorform.ad.node.Power;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.Variable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric evaluation of expressions at one point, for checking symbolic
 * derivatives against finite differences.
 *
 * Form arguments are bound to flat row-major component arrays, the spatial
 * coordinate to a point. Free indices are bound through an environment map.
 */
public final class ExprEvaluator {
    private final double[] x;
    private final Map<Expr, double[]> values = new HashMap<>();

    public ExprEvaluator(double... x) {
        this.x = x.clone();
    }

    public ExprEvaluator bind(FormArgument f, double... components) {
        values.put(f, components.clone());
        return this;
    }

    /** A copy with the spatial coordinate moved by {@code h} along {@code axis}. */
    public ExprEvaluator shifted(int axis, double h) {
        double[] y = x.clone();
        y[axis] += h;
        ExprEvaluator copy = new ExprEvaluator(y);
        copy.values.putAll(values);
        return copy;
    }

    /** A copy with {@code f} moved by {@code h} times {@code direction}. */
    public ExprEvaluator perturbed(FormArgument f, double h, double... direction) {
        double[] v = values.get(f).clone();
        for (int k = 0; k < v.length; k++)
            v[k] += h * direction[k];
        ExprEvaluator copy = new ExprEvaluator(x);
        copy.values.putAll(values);
        copy.values.put(f, v);
        return copy;
    }

    public double scalar(Expr e) {
        return eval(e, new int[0], Map.of());
    }

    public double scalar(Expr e, Map<Index, Integer> env) {
        return eval(e, new int[0], env);
    }

    public double component(Expr e, int... comp) {
        return eval(e, comp, Map.of());
    }

    public double component(Expr e, Map<Index, Integer> env, int... comp) {
        return eval(e, comp, env);
    }

    private double eval(Expr e, int[] comp, Map<Index, Integer> env) {
        switch (e.kind()) {
            case ZERO:
                return 0.0;
            case SCALAR_VALUE:
                return ((ScalarValue) e).value();
            case IDENTITY:
                return comp[0] == comp[1] ? 1.0 : 0.0;
            case SPATIAL_COORDINATE:
                return e.isScalar() ? x[0] : x[comp[0]];
            case COEFFICIENT:
            case CONSTANT:
            case ARGUMENT: {
                double[] v = values.get(e);
                if (v == null)
                    throw new IllegalStateException("No value bound for " + e);
                return v[flat(e.shape(), comp)];
            }
            case VARIABLE:
                return eval(((Variable) e).expression(), comp, env);
            case INDEXED: {
                Indexed idx = (Indexed) e;
                int[] inner = resolve(idx.indices(), env);
                int[] all = new int[inner.length + comp.length];
                System.arraycopy(inner, 0, all, 0, inner.length);
                System.arraycopy(comp, 0, all, inner.length, comp.length);
                return eval(idx.tensor(), all, env);
            }
            case LIST_TENSOR: {
                int[] rest = new int[comp.length - 1];
                System.arraycopy(comp, 1, rest, 0, rest.length);
                return eval(e.operands().get(comp[0]), rest, env);
            }
            case COMPONENT_TENSOR: {
                ComponentTensor ct = (ComponentTensor) e;
                List<Index> ii = ct.indices().symbolicIndices();
                Map<Index, Integer> inner = new HashMap<>(env);
                for (int k = 0; k < ii.size(); k++)
                    inner.put(ii.get(k), comp[k]);
                int[] rest = new int[comp.length - ii.size()];
                System.arraycopy(comp, ii.size(), rest, 0, rest.length);
                return eval(ct.body(), rest, inner);
            }
            case INDEX_SUM: {
                IndexSum s = (IndexSum) e;
                Map<Index, Integer> inner = new HashMap<>(env);
                double total = 0.0;
                for (int k = 0; k < s.dimension(); k++) {
                    inner.put(s.index(), k);
                    total += eval(s.summand(), comp, inner);
                }
                return total;
            }
            case SUM: {
                double total = 0.0;
                for (Expr op : e.operands())
                    total += eval(op, comp, env);
                return total;
            }
            case PRODUCT: {
                double total = 1.0;
                for (Expr op : e.operands())
                    total *= eval(op, comp, env);
                return total;
            }
            case DIVISION: {
                Division d = (Division) e;
                return eval(d.numerator(), comp, env) / eval(d.denominator(), new int[0], env);
            }
            case POWER: {
                Power p = (Power) e;
                return Math.pow(eval(p.base(), comp, env), eval(p.exponent(), new int[0], env));
            }
            case ABS:
                return Math.abs(eval(e.operands().get(0), comp, env));
            case MATH_FUNCTION: {
                MathFunction m = (MathFunction) e;
                double a = eval(m.argument(), comp, env);
                return switch (m.function()) {
                    case SQRT -> Math.sqrt(a);
                    case EXP -> Math.exp(a);
                    case LN -> Math.log(a);
                    case COS -> Math.cos(a);
                    case SIN -> Math.sin(a);
                    case TAN -> Math.tan(a);
                    case ACOS -> Math.acos(a);
                    case ASIN -> Math.asin(a);
                    case ATAN -> Math.atan(a);
                    case ERF -> erf(a);
                    case SIGN -> Math.signum(a);
                };
            }
            case CONDITION: {
                Condition c = (Condition) e;
                double l = eval(c.left(), comp, env);
                double r = eval(c.right(), comp, env);
                boolean b = switch (c.condition()) {
                    case EQ -> l == r;
                    case NE -> l != r;
                    case LE -> l <= r;
                    case GE -> l >= r;
                    case LT -> l < r;
                    case GT -> l > r;
                    case AND -> l != 0 && r != 0;
                    case OR -> l != 0 || r != 0;
                };
                return b ? 1.0 : 0.0;
            }
            case NOT_CONDITION:
                return eval(((NotCondition) e).condition(), comp, env) != 0 ? 0.0 : 1.0;
            case CONDITIONAL: {
                Conditional c = (Conditional) e;
                return eval(c.condition(), new int[0], env) != 0 ? eval(c.trueValue(), comp, env)
                        : eval(c.falseValue(), comp, env);
            }
            case RESTRICTED:
                return eval(e.operands().get(0), comp, env);
            default:
                throw new UnsupportedOperationException("Cannot evaluate " + e.kind());
        }
    }

    private static int[] resolve(MultiIndex mi, Map<Index, Integer> env) {
        int[] out = new int[mi.size()];
        for (int k = 0; k < mi.size(); k++) {
            IndexBase b = mi.get(k);
            if (b instanceof FixedIndex f) {
                out[k] = f.value();
            } else {
                Integer v = env.get((Index) b);
                if (v == null)
                    throw new IllegalStateException("Unbound index " + b);
                out[k] = v;
            }
        }
        return out;
    }

    private static int flat(List<Integer> shape, int[] comp) {
        int k = 0;
        for (int d = 0; d < shape.size(); d++)
            k = k * shape.get(d) + comp[d];
        return k;
    }

    // Abramowitz and Stegun 7.1.26
    private static double erf(double z) {
        double t = 1.0 / (1.0 + 0.3275911 * Math.abs(z));
        double y = 1 - t * (0.254829592 + t * (-0.284496736 + t * (1.421413741
                + t * (-1.453152027 + t * 1.061405429)))) * Math.exp(-z * z);
        return z >= 0 ? y : -y;
    }
}
