package com.tensorform.ad.dsl;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.api.Label;
import com.tensorform.ad.node.Abs;
import com.tensorform.ad.node.Argument;
import com.tensorform.ad.node.BesselFunction;
import com.tensorform.ad.node.BesselFunction.BesselKind;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.CoefficientDerivative;
import com.tensorform.ad.node.CoefficientDerivativeMap;
import com.tensorform.ad.node.ComponentTensor;
import com.tensorform.ad.node.CompoundOperator;
import com.tensorform.ad.node.Condition;
import com.tensorform.ad.node.Condition.ConditionKind;
import com.tensorform.ad.node.Conditional;
import com.tensorform.ad.node.Constant;
import com.tensorform.ad.node.Division;
import com.tensorform.ad.node.FacetNormal;
import com.tensorform.ad.node.Identity;
import com.tensorform.ad.node.IndexSum;
import com.tensorform.ad.node.Indexed;
import com.tensorform.ad.node.ListTensor;
import com.tensorform.ad.node.MathFunction;
import com.tensorform.ad.node.MathFunction.MathKind;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.NotCondition;
import com.tensorform.ad.node.Power;
import com.tensorform.ad.node.Product;
import com.tensorform.ad.node.Restricted;
import com.tensorform.ad.node.Restricted.Side;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.Signatures;
import com.tensorform.ad.node.SpatialCoordinate;
import com.tensorform.ad.node.SpatialDerivative;
import com.tensorform.ad.node.Sum;
import com.tensorform.ad.node.Variable;
import com.tensorform.ad.node.VariableDerivative;
import com.tensorform.ad.node.Zero;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fluent construction API for expression DAGs.
 *
 * Builders apply a fixed set of local foldings while constructing:
 * zeros absorb products and vanish from sums, plain numeric literals are
 * combined, a literal factor of one is dropped, and component access into
 * identities, list tensors and component tensors is resolved where the
 * accessed component is known. No other rewriting takes place.
 *
 * Usage Example:
 *
 * <pre>{@code
 * SpatialCoordinate x = Exprs.coordinate(2);
 * Expr f = Exprs.sin(Exprs.component(x, 0));
 * Expr df = ForwardAdDriver.apply(Exprs.dx(f, Exprs.fixed(0), 2), 2); // cos(x[0])
 * }</pre>
 */
public final class Exprs {
    private Exprs() {
        // Utility class
    }

    // ---------------------------------------------------------------
    // Terminals and labels
    // ---------------------------------------------------------------

    /** A literal; zero becomes a {@link Zero}. */
    public static Expr scalar(double value) {
        return value == 0.0 ? new Zero() : new ScalarValue(value);
    }

    public static Zero zero(Integer... shape) {
        return new Zero(List.of(shape));
    }

    public static Identity identity(int dim) {
        return new Identity(dim);
    }

    public static SpatialCoordinate coordinate(int dim) {
        return new SpatialCoordinate(dim);
    }

    public static FacetNormal normal(int dim) {
        return new FacetNormal(dim);
    }

    public static Coefficient coefficient(String name, Integer... shape) {
        return new Coefficient(name, List.of(shape));
    }

    public static Constant constant(String name, Integer... shape) {
        return new Constant(name, List.of(shape));
    }

    public static Argument argument(String name, int number, Integer... shape) {
        return new Argument(name, number, List.of(shape));
    }

    public static Variable variable(Expr e) {
        return new Variable(e, new Label());
    }

    public static Variable variable(Expr e, Label label) {
        return new Variable(e, label);
    }

    public static Index index() {
        return new Index();
    }

    public static FixedIndex fixed(int value) {
        return FixedIndex.of(value);
    }

    // ---------------------------------------------------------------
    // Indexing and tensors
    // ---------------------------------------------------------------

    public static Expr indexed(Expr a, IndexBase... indices) {
        return indexed(a, new MultiIndex(List.of(indices)));
    }

    public static Expr indexed(Expr a, List<? extends IndexBase> indices) {
        return indexed(a, new MultiIndex(indices));
    }

    /** Component {@code a[c0, c1, ...]} with fixed indices. */
    public static Expr component(Expr a, int... values) {
        List<IndexBase> ii = new ArrayList<>(values.length);
        for (int v : values)
            ii.add(FixedIndex.of(v));
        return indexed(a, ii);
    }

    public static Expr indexed(Expr a, MultiIndex jj) {
        if (jj.size() == 0 && a.isScalar())
            return a;
        if (jj.size() != a.rank())
            throw new IllegalArgumentException("Indexing rank-" + a.rank() + " tensor " + a + " with "
                    + jj.size() + " indices");

        switch (a.kind()) {
            case ZERO -> {
                Map<Index, Integer> dims = new LinkedHashMap<>(a.indexDimensions());
                for (int k = 0; k < jj.size(); k++) {
                    int d = a.shape().get(k);
                    if (jj.get(k) instanceof Index i)
                        Signatures.putAll(dims, Map.of(i, d));
                    else if (((FixedIndex) jj.get(k)).value() >= d)
                        throw new IndexOutOfBoundsException("Fixed index " + jj.get(k) + " out of range for axis of size " + d);
                }
                return new Zero(List.of(), Signatures.unique(a.freeIndices(), jj.symbolicIndices()), dims);
            }
            case IDENTITY -> {
                if (jj.allFixed()) {
                    int d = ((Identity) a).dim();
                    int r = ((FixedIndex) jj.get(0)).value();
                    int c = ((FixedIndex) jj.get(1)).value();
                    if (r >= d || c >= d)
                        throw new IndexOutOfBoundsException("Component (" + r + ", " + c + ") of identity of size " + d);
                    return r == c ? new ScalarValue(1) : new Zero();
                }
            }
            case LIST_TENSOR -> {
                if (jj.get(0) instanceof FixedIndex f) {
                    if (f.value() >= a.operands().size())
                        throw new IndexOutOfBoundsException("Component " + f + " of list tensor of size "
                                + a.operands().size());
                    Expr component = a.operands().get(f.value());
                    return indexed(component, new MultiIndex(jj.indices().subList(1, jj.size())));
                }
            }
            case COMPONENT_TENSOR -> {
                ComponentTensor ct = (ComponentTensor) a;
                if (ct.indices().indices().equals(jj.indices()))
                    return ct.body();
                if (jj.allFixed()) {
                    Map<Index, IndexBase> mapping = new LinkedHashMap<>();
                    for (int k = 0; k < jj.size(); k++)
                        mapping.put((Index) ct.indices().get(k), jj.get(k));
                    return IndexAlgebra.replaceIndices(ct.body(), mapping);
                }
            }
            default -> {
            }
        }
        return new Indexed(a, jj);
    }

    public static Expr asTensor(Expr a, Index... indices) {
        return asTensor(a, List.of(indices));
    }

    /** Binds the given free indices of the scalar {@code a} as tensor axes. */
    public static Expr asTensor(Expr a, List<Index> indices) {
        if (indices.isEmpty())
            return a;
        if (a instanceof Zero) {
            for (Index i : indices)
                if (!a.freeIndices().contains(i))
                    throw new IllegalArgumentException("Index " + i + " is not free in " + a);
            return new Zero(IndexAlgebra.dimensionsOf(indices, a.indexDimensions()),
                    Signatures.without(a.freeIndices(), indices), a.indexDimensions());
        }
        if (a instanceof Indexed idx && idx.indices().indices().equals(indices)
                && Collections.disjoint(idx.tensor().freeIndices(), indices))
            return idx.tensor();
        return new ComponentTensor(a, new MultiIndex(indices));
    }

    public static Expr asVector(Expr... components) {
        return listTensor(List.of(components));
    }

    public static Expr listTensor(List<Expr> components) {
        boolean allZero = !components.isEmpty();
        for (Expr c : components)
            allZero &= c instanceof Zero;
        if (allZero) {
            List<Integer> sh = new ArrayList<>();
            sh.add(components.size());
            sh.addAll(components.get(0).shape());
            return new Zero(sh, Signatures.mergeFree(components), Signatures.mergeDims(components));
        }
        return new ListTensor(components);
    }

    public static Expr indexSum(Expr a, Index i) {
        if (a instanceof Zero)
            return new Zero(a.shape(), Signatures.without(a.freeIndices(), List.of(i)), a.indexDimensions());
        return new IndexSum(a, MultiIndex.of(i));
    }

    // ---------------------------------------------------------------
    // Algebra
    // ---------------------------------------------------------------

    public static Expr add(Expr a, Expr b) {
        return sum(List.of(a, b));
    }

    public static Expr subtract(Expr a, Expr b) {
        return sum(List.of(a, negate(b)));
    }

    public static Expr negate(Expr a) {
        return times(new ScalarValue(-1), a);
    }

    public static Expr sum(Expr... terms) {
        return sum(List.of(terms));
    }

    /**
     * N-ary sum. Zeros are dropped and plain literals combined; a combined
     * literal takes the free indices of the remaining terms.
     */
    public static Expr sum(List<Expr> terms) {
        if (terms.isEmpty())
            throw new IllegalArgumentException("Empty sum");
        List<Integer> shape = terms.get(0).shape();
        for (Expr t : terms)
            if (!t.shape().equals(shape))
                throw new IllegalArgumentException("Adding expressions of shapes " + shape + " and " + t.shape());

        List<Expr> rest = new ArrayList<>(terms.size());
        double constant = 0.0;
        int constants = 0;
        int constantPos = -1;
        ScalarValue firstConstant = null;
        for (Expr t : terms) {
            if (t instanceof Zero)
                continue;
            if (t instanceof ScalarValue s && s.freeIndices().isEmpty()) {
                constant += s.value();
                if (constants++ == 0) {
                    constantPos = rest.size();
                    firstConstant = s;
                }
                continue;
            }
            rest.add(t);
        }

        if (constants > 0 && constant != 0.0) {
            Expr c = constants == 1 ? firstConstant : new ScalarValue(constant);
            if (!rest.isEmpty() && !rest.get(0).freeIndices().isEmpty())
                c = new ScalarValue(constant, rest.get(0).freeIndices(), rest.get(0).indexDimensions());
            rest.add(constantPos, c);
        }

        if (rest.isEmpty())
            return new Zero(shape, Signatures.mergeFree(terms), Signatures.mergeDims(terms));
        if (rest.size() == 1)
            return rest.get(0);
        return new Sum(rest);
    }

    public static Expr product(Expr... factors) {
        return product(List.of(factors));
    }

    /**
     * Pointwise product of scalars. Shared free indices are not summed.
     */
    public static Expr product(List<Expr> factors) {
        if (factors.isEmpty())
            throw new IllegalArgumentException("Empty product");
        for (Expr f : factors)
            Signatures.requireScalar(f, "Product");
        for (Expr f : factors)
            if (f instanceof Zero)
                return new Zero(List.of(), Signatures.mergeFree(factors), Signatures.mergeDims(factors));

        List<Expr> rest = new ArrayList<>(factors.size());
        double constant = 1.0;
        int constants = 0;
        int constantPos = -1;
        ScalarValue firstConstant = null;
        for (Expr f : factors) {
            if (f instanceof ScalarValue s && s.freeIndices().isEmpty()) {
                constant *= s.value();
                if (constants++ == 0) {
                    constantPos = rest.size();
                    firstConstant = s;
                }
                continue;
            }
            rest.add(f);
        }
        if (constants > 0 && constant != 1.0)
            rest.add(constantPos, constants == 1 ? firstConstant : scalar(constant));
        if (rest.isEmpty())
            return scalar(constant);
        if (rest.size() == 1)
            return rest.get(0);
        return new Product(rest);
    }

    /**
     * Pointwise multiplication where at most one operand is a tensor, which is
     * then scaled componentwise. No implicit summation.
     */
    public static Expr times(Expr a, Expr b) {
        if (a.isScalar() && b.isScalar())
            return product(List.of(a, b));
        if (a.isScalar()) {
            IndexAlgebra.Scalarized s = IndexAlgebra.asScalar(b);
            return IndexAlgebra.asTensor(product(List.of(a, s.scalar())), s.indices());
        }
        if (b.isScalar()) {
            IndexAlgebra.Scalarized s = IndexAlgebra.asScalar(a);
            return IndexAlgebra.asTensor(product(List.of(s.scalar(), b)), s.indices());
        }
        throw new IllegalArgumentException("Pointwise multiplication of two tensors " + a + " and " + b);
    }

    /**
     * Algebraic multiplication with implicit summation over repeated free
     * indices. Scalar times tensor is componentwise; tensor times tensor
     * contracts the last axis of {@code a} with the first axis of {@code b}.
     */
    public static Expr multiply(Expr a, Expr b) {
        if (a.isScalar() && b.isScalar()) {
            Expr p = product(List.of(a, b));
            for (Index i : a.freeIndices())
                if (b.freeIndices().contains(i))
                    p = indexSum(p, i);
            return p;
        }
        if (a.isScalar()) {
            IndexAlgebra.Scalarized s = IndexAlgebra.asScalar(b);
            return IndexAlgebra.asTensor(multiply(a, s.scalar()), s.indices());
        }
        if (b.isScalar()) {
            IndexAlgebra.Scalarized s = IndexAlgebra.asScalar(a);
            return IndexAlgebra.asTensor(multiply(s.scalar(), b), s.indices());
        }
        int ra = a.rank();
        int rb = b.rank();
        if (!a.shape().get(ra - 1).equals(b.shape().get(0)))
            throw new IllegalArgumentException("Cannot contract shapes " + a.shape() + " and " + b.shape());
        List<Index> ii = IndexAlgebra.indices(ra - 1);
        Index k = new Index();
        List<Index> jj = IndexAlgebra.indices(rb - 1);
        List<IndexBase> ai = new ArrayList<>(ii);
        ai.add(k);
        List<IndexBase> bi = new ArrayList<>();
        bi.add(k);
        bi.addAll(jj);
        Expr p = multiply(indexed(a, ai), indexed(b, bi));
        return IndexAlgebra.asTensor(p, IndexAlgebra.concat(ii, jj));
    }

    /** Division by a scalar; a tensor numerator is divided componentwise. */
    public static Expr divide(Expr a, Expr b) {
        Signatures.requireScalar(b, "Division");
        if (b instanceof Zero)
            throw new ArithmeticException("Division by zero: " + a + " / " + b);
        if (a instanceof Zero)
            return new Zero(a.shape(), Signatures.unique(a.freeIndices(), b.freeIndices()),
                    Signatures.mergeDims(List.of(a, b)));
        if (b instanceof ScalarValue sb && sb.isPlain(1.0))
            return a;
        if (a instanceof ScalarValue sa && sa.freeIndices().isEmpty() && b instanceof ScalarValue sb
                && sb.freeIndices().isEmpty())
            return scalar(sa.value() / sb.value());
        if (!a.isScalar()) {
            IndexAlgebra.Scalarized s = IndexAlgebra.asScalar(a);
            return IndexAlgebra.asTensor(divide(s.scalar(), b), s.indices());
        }
        return new Division(a, b);
    }

    public static Expr power(Expr base, double exponent) {
        return power(base, scalar(exponent));
    }

    public static Expr power(Expr base, Expr exponent) {
        Signatures.requireScalar(base, "Power");
        Signatures.requireScalar(exponent, "Power");
        if (exponent instanceof Zero) {
            if (base.freeIndices().isEmpty())
                return new ScalarValue(1);
            return new ScalarValue(1, base.freeIndices(), base.indexDimensions());
        }
        if (isPlainLiteral(base) && exponent instanceof ScalarValue e && e.freeIndices().isEmpty()) {
            double r = Math.pow(literalValue(base), e.value());
            if (Double.isFinite(r))
                return scalar(r);
        }
        if (base instanceof Zero && exponent instanceof ScalarValue e && e.value() > 0)
            return new Zero(List.of(), Signatures.mergeFree(List.of(base, exponent)),
                    Signatures.mergeDims(List.of(base, exponent)));
        return new Power(base, exponent);
    }

    public static Expr abs(Expr f) {
        Signatures.requireScalar(f, "Abs");
        if (f instanceof Zero)
            return f;
        if (f instanceof ScalarValue s && s.freeIndices().isEmpty())
            return scalar(Math.abs(s.value()));
        return new Abs(f);
    }

    // ---------------------------------------------------------------
    // Elementary functions
    // ---------------------------------------------------------------

    public static Expr mathFunction(MathKind function, Expr f) {
        Signatures.requireScalar(f, function.symbol());
        if (isPlainLiteral(f)) {
            Double r = evaluate(function, literalValue(f));
            if (r != null && Double.isFinite(r))
                return scalar(r);
        }
        return new MathFunction(function, f);
    }

    private static Double evaluate(MathKind function, double x) {
        return switch (function) {
            case SQRT -> x >= 0 ? Math.sqrt(x) : null;
            case EXP -> Math.exp(x);
            case LN -> x > 0 ? Math.log(x) : null;
            case COS -> Math.cos(x);
            case SIN -> Math.sin(x);
            case TAN -> Math.tan(x);
            case ACOS -> Math.abs(x) <= 1 ? Math.acos(x) : null;
            case ASIN -> Math.abs(x) <= 1 ? Math.asin(x) : null;
            case ATAN -> Math.atan(x);
            case ERF -> x == 0 ? 0.0 : null;
            case SIGN -> Math.signum(x);
        };
    }

    public static Expr sqrt(Expr f) {
        return mathFunction(MathKind.SQRT, f);
    }

    public static Expr exp(Expr f) {
        return mathFunction(MathKind.EXP, f);
    }

    public static Expr ln(Expr f) {
        return mathFunction(MathKind.LN, f);
    }

    public static Expr cos(Expr f) {
        return mathFunction(MathKind.COS, f);
    }

    public static Expr sin(Expr f) {
        return mathFunction(MathKind.SIN, f);
    }

    public static Expr tan(Expr f) {
        return mathFunction(MathKind.TAN, f);
    }

    public static Expr acos(Expr f) {
        return mathFunction(MathKind.ACOS, f);
    }

    public static Expr asin(Expr f) {
        return mathFunction(MathKind.ASIN, f);
    }

    public static Expr atan(Expr f) {
        return mathFunction(MathKind.ATAN, f);
    }

    public static Expr erf(Expr f) {
        return mathFunction(MathKind.ERF, f);
    }

    public static Expr sign(Expr f) {
        return mathFunction(MathKind.SIGN, f);
    }

    public static Expr bessel(BesselKind kind, int order, Expr f) {
        return new BesselFunction(kind, scalar(order), f);
    }

    public static Expr besselJ(int order, Expr f) {
        return bessel(BesselKind.J, order, f);
    }

    public static Expr besselY(int order, Expr f) {
        return bessel(BesselKind.Y, order, f);
    }

    public static Expr besselI(int order, Expr f) {
        return bessel(BesselKind.I, order, f);
    }

    public static Expr besselK(int order, Expr f) {
        return bessel(BesselKind.K, order, f);
    }

    // ---------------------------------------------------------------
    // Restrictions and conditionals
    // ---------------------------------------------------------------

    public static Expr restricted(Expr f, Side side) {
        return new Restricted(f, side);
    }

    public static Expr plus(Expr f) {
        return restricted(f, Side.PLUS);
    }

    public static Expr minus(Expr f) {
        return restricted(f, Side.MINUS);
    }

    public static Expr condition(ConditionKind kind, Expr left, Expr right) {
        return new Condition(kind, left, right);
    }

    public static Expr eq(Expr l, Expr r) {
        return condition(ConditionKind.EQ, l, r);
    }

    public static Expr ne(Expr l, Expr r) {
        return condition(ConditionKind.NE, l, r);
    }

    public static Expr le(Expr l, Expr r) {
        return condition(ConditionKind.LE, l, r);
    }

    public static Expr ge(Expr l, Expr r) {
        return condition(ConditionKind.GE, l, r);
    }

    public static Expr lt(Expr l, Expr r) {
        return condition(ConditionKind.LT, l, r);
    }

    public static Expr gt(Expr l, Expr r) {
        return condition(ConditionKind.GT, l, r);
    }

    public static Expr and(Expr l, Expr r) {
        return condition(ConditionKind.AND, l, r);
    }

    public static Expr or(Expr l, Expr r) {
        return condition(ConditionKind.OR, l, r);
    }

    public static Expr not(Expr c) {
        return new NotCondition(c);
    }

    public static Expr conditional(Expr condition, Expr trueValue, Expr falseValue) {
        return new Conditional(condition, trueValue, falseValue);
    }

    // ---------------------------------------------------------------
    // Derivative markers
    // ---------------------------------------------------------------

    public static SpatialDerivative dx(Expr f, IndexBase index, int spatialDimension) {
        return new SpatialDerivative(f, MultiIndex.of(index), spatialDimension);
    }

    public static VariableDerivative diff(Expr f, Variable v) {
        return new VariableDerivative(f, v);
    }

    public static CoefficientDerivative derivative(Expr f, Coefficient w, Expr v) {
        return derivative(f, List.of(w), List.of(v), CoefficientDerivativeMap.empty());
    }

    public static CoefficientDerivative derivative(Expr f, List<Coefficient> coefficients, List<Expr> directions,
            CoefficientDerivativeMap derivatives) {
        return new CoefficientDerivative(f, coefficients, directions, derivatives);
    }

    // ---------------------------------------------------------------
    // Compound tensor operators
    // ---------------------------------------------------------------

    public static Expr transpose(Expr a) {
        return new CompoundOperator(ExprKind.TRANSPOSED, List.of(a));
    }

    public static Expr trace(Expr a) {
        return new CompoundOperator(ExprKind.TRACE, List.of(a));
    }

    public static Expr dev(Expr a) {
        return new CompoundOperator(ExprKind.DEVIATORIC, List.of(a));
    }

    public static Expr div(Expr a) {
        return new CompoundOperator(ExprKind.DIV, List.of(a));
    }

    public static Expr curl(Expr a) {
        return new CompoundOperator(ExprKind.CURL, List.of(a));
    }

    public static Expr grad(Expr a, int spatialDimension) {
        return new CompoundOperator(ExprKind.GRAD, List.of(a), spatialDimension);
    }

    public static Expr outer(Expr a, Expr b) {
        return new CompoundOperator(ExprKind.OUTER, List.of(a, b));
    }

    public static Expr inner(Expr a, Expr b) {
        return new CompoundOperator(ExprKind.INNER, List.of(a, b));
    }

    public static Expr dot(Expr a, Expr b) {
        return new CompoundOperator(ExprKind.DOT, List.of(a, b));
    }

    public static Expr cross(Expr a, Expr b) {
        return new CompoundOperator(ExprKind.CROSS, List.of(a, b));
    }

    public static Expr det(Expr a) {
        return new CompoundOperator(ExprKind.DETERMINANT, List.of(a));
    }

    public static Expr cofac(Expr a) {
        return new CompoundOperator(ExprKind.COFACTOR, List.of(a));
    }

    public static Expr inverse(Expr a) {
        return new CompoundOperator(ExprKind.INVERSE, List.of(a));
    }

    // ---------------------------------------------------------------
    // Reconstruction and queries
    // ---------------------------------------------------------------

    /**
     * Like {@link Expr#reconstruct(List)}, but routes the new operands through
     * the folding builders of this class.
     */
    public static Expr rebuild(Expr o, List<Expr> operands) {
        List<Expr> old = o.operands();
        boolean same = old.size() == operands.size();
        for (int k = 0; same && k < old.size(); k++)
            same = old.get(k) == operands.get(k);
        if (same)
            return o;

        return switch (o.kind()) {
            case INDEXED -> indexed(operands.get(0), (MultiIndex) operands.get(1));
            case COMPONENT_TENSOR -> asTensor(operands.get(0), ((MultiIndex) operands.get(1)).symbolicIndices());
            case INDEX_SUM -> indexSum(operands.get(0), (Index) ((MultiIndex) operands.get(1)).get(0));
            case LIST_TENSOR -> listTensor(operands);
            case SUM -> sum(operands);
            case PRODUCT -> product(operands);
            case DIVISION -> divide(operands.get(0), operands.get(1));
            case POWER -> power(operands.get(0), operands.get(1));
            case ABS -> abs(operands.get(0));
            case MATH_FUNCTION -> mathFunction(((MathFunction) o).function(), operands.get(0));
            default -> o.reconstruct(operands);
        };
    }

    /**
     * True if nothing reachable from {@code e} varies in space: no spatial
     * coordinate, facet normal, non-constant coefficient or argument.
     */
    public static boolean isSpatiallyConstant(Expr e) {
        Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(e);
        while (!stack.isEmpty()) {
            Expr n = stack.pop();
            if (!seen.add(n))
                continue;
            switch (n.kind()) {
                case SPATIAL_COORDINATE, FACET_NORMAL, COEFFICIENT, ARGUMENT -> {
                    return false;
                }
                default -> {
                    for (Expr op : n.operands())
                        stack.push(op);
                }
            }
        }
        return true;
    }

    private static boolean isPlainLiteral(Expr e) {
        return e.freeIndices().isEmpty() && e.isScalar() && (e instanceof Zero || e instanceof ScalarValue);
    }

    private static double literalValue(Expr e) {
        return e instanceof ScalarValue s ? s.value() : 0.0;
    }
}
