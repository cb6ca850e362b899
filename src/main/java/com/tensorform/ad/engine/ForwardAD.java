package com.tensorform.ad.engine;

import static com.tensorform.ad.dsl.Exprs.add;
import static com.tensorform.ad.dsl.Exprs.bessel;
import static com.tensorform.ad.dsl.Exprs.cos;
import static com.tensorform.ad.dsl.Exprs.divide;
import static com.tensorform.ad.dsl.Exprs.exp;
import static com.tensorform.ad.dsl.Exprs.ln;
import static com.tensorform.ad.dsl.Exprs.negate;
import static com.tensorform.ad.dsl.Exprs.scalar;
import static com.tensorform.ad.dsl.Exprs.sign;
import static com.tensorform.ad.dsl.Exprs.sin;
import static com.tensorform.ad.dsl.Exprs.sqrt;
import static com.tensorform.ad.dsl.Exprs.subtract;
import static com.tensorform.ad.dsl.Exprs.times;
import static com.tensorform.ad.dsl.IndexAlgebra.isZero;

import com.tensorform.ad.api.DifferentiationException;
import com.tensorform.ad.api.DifferentiationListener;
import com.tensorform.ad.api.DomainViolationException;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExpressionTooDeepException;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.api.IndexScopeCollisionException;
import com.tensorform.ad.api.InternalErrorException;
import com.tensorform.ad.api.Label;
import com.tensorform.ad.api.MissingRuleException;
import com.tensorform.ad.api.PreconditionException;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.dsl.IndexAlgebra;
import com.tensorform.ad.dsl.IndexAlgebra.Scalarized;
import com.tensorform.ad.node.Abs;
import com.tensorform.ad.node.Argument;
import com.tensorform.ad.node.BesselFunction;
import com.tensorform.ad.node.BesselFunction.BesselKind;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.ComponentTensor;
import com.tensorform.ad.node.Condition;
import com.tensorform.ad.node.Conditional;
import com.tensorform.ad.node.Constant;
import com.tensorform.ad.node.ConstantValue;
import com.tensorform.ad.node.Division;
import com.tensorform.ad.node.FacetNormal;
import com.tensorform.ad.node.FormArgument;
import com.tensorform.ad.node.IndexSum;
import com.tensorform.ad.node.Indexed;
import com.tensorform.ad.node.ListTensor;
import com.tensorform.ad.node.MathFunction;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.NotCondition;
import com.tensorform.ad.node.Power;
import com.tensorform.ad.node.Product;
import com.tensorform.ad.node.Restricted;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.Signatures;
import com.tensorform.ad.node.SpatialCoordinate;
import com.tensorform.ad.node.SpatialDerivative;
import com.tensorform.ad.node.Sum;
import com.tensorform.ad.node.Variable;
import com.tensorform.ad.node.Zero;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic forward-mode differentiation over an expression DAG.
 *
 * Every node is mapped to a {@link Dual} holding the (possibly rebuilt) node
 * and its derivative with respect to one differentiation variable. The
 * variable is characterized by an extra shape {@code E} and extra free
 * indices {@code X}: the derivative of a node of shape {@code S} with free
 * indices {@code F} has shape {@code S + E} and free indices {@code F u X}.
 *
 * Algorithm Details:
 * The visitor is a recursive descent memoized on node identity in the run's
 * {@link AdContext}. A node shared by several parents is differentiated once
 * per run. Dispatch is an exhaustive switch over
 * {@link com.tensorform.ad.api.ExprKind}; a kind without a rule does not
 * compile.
 *
 * Subclasses define the differentiation variable by overriding the terminal
 * hooks ({@link #spatialCoordinate}, {@link #coefficient},
 * {@link #formArgument}, ...) and, where labels matter, {@link #variable}.
 *
 * Error Handling:
 * Fatal conditions are reported through the run's
 * {@link com.tensorform.ad.api.DiagnosticSink} and abort the run with a
 * {@link DifferentiationException}. No partial result is returned.
 */
public abstract class ForwardAD {
    private static final Logger log = LogManager.getLogger(ForwardAD.class);

    private static final double TWO_OVER_SQRT_PI = 2.0 / Math.sqrt(Math.PI);

    protected final AdContext context;
    protected final int spatialDimension;

    private final List<Integer> varShape;
    private final List<Index> varFreeIndices;
    private final Map<Index, Integer> varIndexDimensions;
    private final CompoundRules compoundRules;

    protected ForwardAD(AdContext context, int spatialDimension, List<Integer> varShape,
            List<Index> varFreeIndices, Map<Index, Integer> varIndexDimensions) {
        for (Index i : varFreeIndices)
            if (!varIndexDimensions.containsKey(i))
                throw new IllegalArgumentException("Missing dimension for variable index " + i);
        this.context = context;
        this.spatialDimension = spatialDimension;
        this.varShape = List.copyOf(varShape);
        this.varFreeIndices = List.copyOf(varFreeIndices);
        this.varIndexDimensions = Map.copyOf(varIndexDimensions);
        this.compoundRules = new CompoundRules(this);
    }

    /** Human-readable description of the differentiation variable. */
    public abstract String describeVariable();

    public AdContext context() {
        return context;
    }

    public List<Integer> varShape() {
        return varShape;
    }

    public List<Index> varFreeIndices() {
        return varFreeIndices;
    }

    /**
     * Runs the differentiation of {@code f} and returns the derivative only.
     * Listener start and end callbacks bracket the run.
     *
     * @throws ExpressionTooDeepException if the nesting exceeds
     *         {@code maxDepth} or exhausts the thread stack first.
     */
    public Expr differentiate(Expr f) {
        DifferentiationListener l = context.listener();
        if (l != null)
            l.onRunStart(context.runId(), describeVariable());
        try {
            Expr derivative = visit(f).derivative();
            if (derivative == null)
                throw fatal(new InternalErrorException("Expression has no derivative: " + f));
            return derivative;
        } catch (StackOverflowError e) {
            // Stack is unwound here; safe to report
            throw fatal(new ExpressionTooDeepException("Expression nesting exhausted the thread stack below "
                    + "the maximum depth of " + context.options().getMaxDepth(), e));
        } finally {
            if (l != null)
                l.onRunEnd(context.runId(), context.rulesApplied(), context.cacheHits());
        }
    }

    /**
     * Differentiates one node, memoized on node identity for the whole run.
     *
     * @return the identical {@link Dual} instance on every call with the same
     *         node object.
     */
    public final Dual visit(Expr o) {
        DifferentiationListener l = context.listener();
        Dual hit = context.cache().get(o);
        if (hit != null) {
            context.cacheHit();
            if (l != null)
                l.onCacheHit(context.runId(), o);
            return hit;
        }

        if (context.enter() > context.options().getMaxDepth()) {
            context.exit();
            throw fatal(new ExpressionTooDeepException("Expression nesting exceeds the maximum depth of "
                    + context.options().getMaxDepth()));
        }
        long start = l != null ? System.nanoTime() : 0L;
        Dual result;
        try {
            result = dispatch(o);
        } finally {
            context.exit();
        }

        context.cache().put(o, result);
        context.ruleApplied();
        if (l != null)
            l.onRuleApplied(context.runId(), o, System.nanoTime() - start);
        return result;
    }

    private Dual dispatch(Expr o) {
        return switch (o.kind()) {
            case ZERO, SCALAR_VALUE, IDENTITY -> constantValue((ConstantValue) o);
            case SPATIAL_COORDINATE -> spatialCoordinate((SpatialCoordinate) o);
            case FACET_NORMAL -> facetNormal((FacetNormal) o);
            case CONSTANT -> constant((Constant) o);
            case COEFFICIENT -> coefficient((Coefficient) o);
            case ARGUMENT -> argument((Argument) o);
            case MULTI_INDEX -> multiIndex((MultiIndex) o);
            case VARIABLE -> variable((Variable) o);
            case INDEXED -> indexed((Indexed) o);
            case LIST_TENSOR -> listTensor((ListTensor) o);
            case COMPONENT_TENSOR -> componentTensor((ComponentTensor) o);
            case INDEX_SUM -> indexSum((IndexSum) o);
            case SUM -> sum((Sum) o);
            case PRODUCT -> product((Product) o);
            case DIVISION -> division((Division) o);
            case POWER -> power((Power) o);
            case ABS -> abs((Abs) o);
            case MATH_FUNCTION -> mathFunction((MathFunction) o);
            case BESSEL_FUNCTION -> besselFunction((BesselFunction) o);
            case RESTRICTED -> restricted((Restricted) o);
            case CONDITION -> condition((Condition) o);
            case NOT_CONDITION -> notCondition((NotCondition) o);
            case CONDITIONAL -> conditional((Conditional) o);
            case SPATIAL_DERIVATIVE -> spatialDerivative((SpatialDerivative) o);
            case VARIABLE_DERIVATIVE, COEFFICIENT_DERIVATIVE -> derivative(o);
            case TRANSPOSED, TRACE, DEVIATORIC, DIV, CURL, GRAD, OUTER, INNER, DOT -> compound(o);
            case CROSS, DETERMINANT, COFACTOR, INVERSE -> unsupportedCompound(o);
        };
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Reports a fatal condition to the sink and returns it for throwing:
     * {@code throw fatal(new ...)}.
     */
    protected final DifferentiationException fatal(DifferentiationException error) {
        log.debug("Differentiation run {} aborted: {}", context.runId(), error.getMessage());
        context.sink().fail(error);
        return error;
    }

    /**
     * A zero derivative for {@code o}: shape {@code S + E}, free indices
     * {@code F} extended by the variable's indices not already present.
     */
    protected Zero makeZeroDiff(Expr o) {
        List<Index> fi = new ArrayList<>(o.freeIndices());
        Map<Index, Integer> dims = new LinkedHashMap<>(o.indexDimensions());
        for (Index i : varFreeIndices) {
            if (!dims.containsKey(i)) {
                fi.add(i);
                dims.put(i, varIndexDimensions.get(i));
            }
        }
        return new Zero(Signatures.concat(o.shape(), varShape), fi, dims);
    }

    /**
     * The derivative of the differentiation variable with respect to itself:
     * {@code 1} for a scalar, otherwise the tensor
     * {@code delta(i0,j0) * delta(i1,j1) * ...} over axes
     * {@code (i0, i1, ..., j0, j1, ...)}.
     */
    protected Expr makeOnesDiff(Expr o) {
        if (!o.shape().equals(varShape))
            throw fatal(new PreconditionException("Shape " + o.shape() + " of " + o
                    + " does not match the differentiation variable shape " + varShape));

        List<Index> fi = new ArrayList<>(o.freeIndices());
        Map<Index, Integer> dims = new LinkedHashMap<>(o.indexDimensions());
        for (Index i : varFreeIndices) {
            if (!dims.containsKey(i)) {
                fi.add(i);
                dims.put(i, varIndexDimensions.get(i));
            }
        }
        ScalarValue one = new ScalarValue(1, fi, dims);
        if (varShape.isEmpty())
            return one;

        List<Expr> deltas = new ArrayList<>(varShape.size());
        List<Index> rows = new ArrayList<>(varShape.size());
        List<Index> cols = new ArrayList<>(varShape.size());
        for (int d : varShape) {
            Index i = new Index();
            Index j = new Index();
            deltas.add(Exprs.indexed(Exprs.identity(d), i, j));
            rows.add(i);
            cols.add(j);
        }
        Expr fp = Exprs.asTensor(Exprs.product(deltas), IndexAlgebra.concat(rows, cols));
        if (!fi.isEmpty())
            fp = times(fp, one);
        return fp;
    }

    protected final Dual cachedVariable(Label label) {
        return context.variableCache().get(label);
    }

    protected final Dual cacheVariable(Label label, Dual result) {
        context.variableCache().put(label, result);
        return result;
    }

    private List<Expr> primals(List<Dual> duals) {
        List<Expr> out = new ArrayList<>(duals.size());
        for (Dual d : duals)
            out.add(d.primal());
        return out;
    }

    private List<Dual> visitAll(List<Expr> operands) {
        List<Dual> out = new ArrayList<>(operands.size());
        for (Expr op : operands)
            out.add(visit(op));
        return out;
    }

    // ---------------------------------------------------------------
    // Terminals
    // ---------------------------------------------------------------

    /**
     * Terminals are independent of the differentiation variable unless a
     * subclass says otherwise.
     */
    protected Dual terminal(Expr o) {
        return new Dual(o, makeZeroDiff(o));
    }

    protected Dual constantValue(ConstantValue o) {
        return terminal(o);
    }

    protected Dual spatialCoordinate(SpatialCoordinate o) {
        return terminal(o);
    }

    protected Dual facetNormal(FacetNormal o) {
        return terminal(o);
    }

    protected Dual constant(Constant o) {
        return coefficient(o);
    }

    protected Dual coefficient(Coefficient o) {
        return formArgument(o);
    }

    protected Dual argument(Argument o) {
        return formArgument(o);
    }

    protected Dual formArgument(FormArgument o) {
        return terminal(o);
    }

    /** Multi-indices are passed through; their derivative must never be used. */
    protected Dual multiIndex(MultiIndex o) {
        return new Dual(o, null);
    }

    /**
     * A variable is a label: its derivative is the derivative of the labeled
     * expression, shared by every variable node carrying the same label.
     */
    protected Dual variable(Variable o) {
        Dual cached = cachedVariable(o.label());
        if (cached != null)
            return cached;
        Dual e = visit(o.expression());
        Expr v = o.reconstruct(List.of(e.primal()));
        return cacheVariable(o.label(), new Dual(v, e.derivative()));
    }

    // ---------------------------------------------------------------
    // Indexing and tensors
    // ---------------------------------------------------------------

    protected Dual indexed(Indexed o) {
        Dual a = visit(o.tensor());
        MultiIndex jj = o.indices();
        Expr o2 = o.reconstruct(List.of(a.primal(), jj));
        Expr ap = a.derivative();
        if (isZero(ap))
            return new Dual(o2, makeZeroDiff(o2));

        int extra = ap.rank() - jj.size();
        if (extra == 0)
            return new Dual(o2, Exprs.indexed(ap, jj));
        List<Index> ii = IndexAlgebra.indices(extra);
        List<IndexBase> all = new ArrayList<>(jj.indices());
        all.addAll(ii);
        return new Dual(o2, Exprs.asTensor(Exprs.indexed(ap, all), ii));
    }

    protected Dual listTensor(ListTensor o) {
        List<Dual> ops = visitAll(o.operands());
        Expr o2 = o.reconstruct(primals(ops));
        List<Expr> dops = new ArrayList<>(ops.size());
        for (Dual d : ops)
            dops.add(d.derivative());
        return new Dual(o2, Exprs.listTensor(dops));
    }

    protected Dual componentTensor(ComponentTensor o) {
        Dual a = visit(o.body());
        MultiIndex ii = o.indices();
        Expr o2 = o.reconstruct(List.of(a.primal(), ii));
        if (isZero(a.derivative()))
            return new Dual(o2, makeZeroDiff(o2));
        Scalarized s = IndexAlgebra.asScalar(a.derivative());
        return new Dual(o2, Exprs.asTensor(s.scalar(), IndexAlgebra.concat(ii.symbolicIndices(), s.indices())));
    }

    /**
     * Differentiation commutes with summation, unless the summation index is
     * also an index of the differentiation variable. In
     * {@code (v[i]*v[i]).dx(i)} moving the derivative inside the sum would
     * accumulate it, so that case is rejected.
     */
    protected Dual indexSum(IndexSum o) {
        Index i = o.index();
        if (varFreeIndices.contains(i))
            throw fatal(new IndexScopeCollisionException("Index scope collision on " + i + " in " + o
                    + ". The summation index is also the index of the differentiation variable, as in"
                    + " (v[i]*v[i]).dx(i). Use distinct indices for independent sub-expressions."));
        Dual a = visit(o.summand());
        Expr o2 = o.reconstruct(List.of(a.primal(), o.indexOperand()));
        return new Dual(o2, Exprs.indexSum(a.derivative(), i));
    }

    // ---------------------------------------------------------------
    // Algebra
    // ---------------------------------------------------------------

    protected Dual sum(Sum o) {
        List<Dual> ops = visitAll(o.operands());
        Expr o2 = o.reconstruct(primals(ops));
        List<Expr> dops = new ArrayList<>(ops.size());
        for (Dual d : ops)
            dops.add(d.derivative());
        return new Dual(o2, Exprs.sum(dops));
    }

    /**
     * Product rule over N factors. Each factor's derivative is taken in
     * component form, multiplied with the other factors and bound back over
     * its extra indices.
     */
    protected Dual product(Product o) {
        List<Dual> ops = visitAll(o.operands());
        List<Expr> factors = primals(ops);
        Expr o2 = o.reconstruct(factors);
        Expr fp = makeZeroDiff(o2);
        for (int k = 0; k < ops.size(); k++) {
            Scalarized dop = IndexAlgebra.asScalar(ops.get(k).derivative());
            List<Expr> term = new ArrayList<>(factors);
            term.set(k, dop.scalar());
            fp = add(fp, IndexAlgebra.asTensor(Exprs.product(term), dop.indices()));
        }
        return new Dual(o2, fp);
    }

    /** {@code (f/g)' = (f' - (f/g) g') / g}. */
    protected Dual division(Division o) {
        Dual a = visit(o.numerator());
        Dual b = visit(o.denominator());
        Expr f = a.primal();
        Expr g = b.primal();
        if (!f.isScalar())
            throw fatal(new PreconditionException("Not expecting a nonscalar numerator: " + f));
        if (!g.isTrueScalar())
            throw fatal(new PreconditionException("Not expecting a nonscalar denominator: " + g));
        Expr o2 = o.reconstruct(List.of(f, g));

        Scalarized so = IndexAlgebra.asScalar(o2);
        Scalarized sgp = IndexAlgebra.asScalar(b.derivative());
        Expr oGp = IndexAlgebra.asTensor(Exprs.product(so.scalar(), sgp.scalar()),
                IndexAlgebra.concat(so.indices(), sgp.indices()));
        return new Dual(o2, divide(subtract(a.derivative(), oGp), g));
    }

    /**
     * {@code (f^g)' = f^(g-1) (f' g + f ln(f) g')}. The node itself is
     * rewritten as {@code f * f^(g-1)} to share that sub-expression.
     */
    protected Dual power(Power o) {
        Dual a = visit(o.base());
        Dual b = visit(o.exponent());
        Expr f = a.primal();
        Expr g = b.primal();
        if (!f.isTrueScalar())
            throw fatal(new PreconditionException("Expecting a scalar base in f**g, got " + f));
        if (!g.isTrueScalar())
            throw fatal(new PreconditionException("Expecting a scalar exponent in f**g, got " + g));

        Expr fgm1 = Exprs.power(f, subtract(g, scalar(1)));
        Expr op = times(fgm1, add(times(a.derivative(), g), times(Exprs.product(f, ln(f)), b.derivative())));
        return new Dual(times(f, fgm1), op);
    }

    protected Dual abs(Abs o) {
        Dual a = visit(o.argument());
        Expr o2 = o.reconstruct(List.of(a.primal()));
        return new Dual(o2, times(sign(a.primal()), a.derivative()));
    }

    // ---------------------------------------------------------------
    // Elementary functions
    // ---------------------------------------------------------------

    protected Dual mathFunction(MathFunction o) {
        Dual a = visit(o.argument());
        Expr f = a.primal();
        Expr fp = a.derivative();
        Expr o2 = o.reconstruct(List.of(f));
        Expr op = switch (o.function()) {
            case SQRT -> divide(fp, times(scalar(2), o2));
            case EXP -> times(fp, o2);
            case LN -> {
                if (isZero(f))
                    throw fatal(new DomainViolationException("Division by zero: derivative of ln at " + f));
                yield divide(fp, f);
            }
            case COS -> negate(times(fp, sin(f)));
            case SIN -> times(fp, cos(f));
            case TAN -> divide(times(fp, scalar(2)), add(cos(times(scalar(2), f)), scalar(1)));
            case ACOS -> negate(divide(fp, sqrt(subtract(scalar(1), Exprs.power(f, 2)))));
            case ASIN -> divide(fp, sqrt(subtract(scalar(1), Exprs.power(f, 2))));
            case ATAN -> divide(fp, add(scalar(1), Exprs.power(f, 2)));
            case ERF -> times(fp, times(scalar(TWO_OVER_SQRT_PI), exp(negate(Exprs.power(f, 2)))));
            // Zero almost everywhere
            case SIGN -> makeZeroDiff(o2);
        };
        return new Dual(o2, op);
    }

    /**
     * Bessel functions of integer order. The order itself must not depend on
     * the differentiation variable.
     */
    protected Dual besselFunction(BesselFunction o) {
        Dual nu = visit(o.order());
        if (nu.derivative() != null && !isZero(nu.derivative()))
            throw fatal(new PreconditionException(
                    "Differentiation of a Bessel function with respect to its order is not supported: " + o));
        Dual x = visit(o.argument());
        Expr o2 = o.reconstruct(List.of(nu.primal(), x.primal()));

        int n;
        try {
            n = ((BesselFunction) o2).integerOrder();
        } catch (IllegalStateException e) {
            throw fatal(new PreconditionException(e.getMessage()));
        }
        Expr f = x.primal();
        BesselKind kind = o.function();
        Expr d = switch (kind) {
            case J, Y -> n == 0 ? negate(bessel(kind, 1, f))
                    : times(scalar(0.5), subtract(bessel(kind, n - 1, f), bessel(kind, n + 1, f)));
            case I -> n == 0 ? bessel(kind, 1, f)
                    : times(scalar(0.5), add(bessel(kind, n - 1, f), bessel(kind, n + 1, f)));
            case K -> n == 0 ? negate(bessel(kind, 1, f))
                    : times(scalar(-0.5), add(bessel(kind, n - 1, f), bessel(kind, n + 1, f)));
        };
        return new Dual(o2, times(x.derivative(), d));
    }

    // ---------------------------------------------------------------
    // Restrictions and conditionals
    // ---------------------------------------------------------------

    /** Restriction commutes with differentiation. */
    protected Dual restricted(Restricted o) {
        Dual a = visit(o.operand());
        Expr o2 = o.reconstruct(List.of(a.primal()));
        Expr fp = a.derivative();
        if (fp instanceof ConstantValue)
            return new Dual(o2, fp);
        return new Dual(o2, Exprs.restricted(fp, o.side()));
    }

    protected Dual condition(Condition o) {
        Dual l = visit(o.left());
        Dual r = visit(o.right());
        Expr o2 = o.reconstruct(List.of(l.primal(), r.primal()));
        if (dependsOnVariable(l) || dependsOnVariable(r))
            warnConditionDependence(o2);
        return new Dual(o2, null);
    }

    protected Dual notCondition(NotCondition o) {
        Dual c = visit(o.condition());
        Expr o2 = o.reconstruct(List.of(c.primal()));
        if (dependsOnVariable(c))
            warnConditionDependence(o2);
        return new Dual(o2, null);
    }

    private static boolean dependsOnVariable(Dual d) {
        return d.derivative() != null && !isZero(d.derivative());
    }

    private void warnConditionDependence(Expr condition) {
        context.sink().warn("Differentiating a conditional with a condition that depends on the"
                + " differentiation variable: " + condition);
    }

    /** Only the branch values are differentiated; the condition is reused as is. */
    protected Dual conditional(Conditional o) {
        Dual c = visit(o.condition());
        Dual t = visit(o.trueValue());
        Dual f = visit(o.falseValue());
        Expr o2 = o.reconstruct(List.of(c.primal(), t.primal(), f.primal()));
        if (isZero(t.derivative()) && isZero(f.derivative()))
            return new Dual(o2, makeZeroDiff(o2));
        Expr tp = isZero(t.derivative()) ? makeZeroDiff(t.primal()) : t.derivative();
        Expr fp = isZero(f.derivative()) ? makeZeroDiff(f.primal()) : f.derivative();
        return new Dual(o2, Exprs.conditional(c.primal(), tp, fp));
    }

    // ---------------------------------------------------------------
    // Derivative markers and compound operators
    // ---------------------------------------------------------------

    /**
     * A spatial derivative already pushed down to a terminal. Differentiation
     * commutes, so it is re-applied to the inner derivative unless that is
     * spatially constant.
     */
    protected Dual spatialDerivative(SpatialDerivative o) {
        Dual a = visit(o.operand());
        MultiIndex ii = o.index();
        Expr o2 = o.reconstruct(List.of(a.primal(), ii));
        Expr fp = a.derivative();
        if (Exprs.isSpatiallyConstant(fp)) {
            List<Index> fi = new ArrayList<>(fp.freeIndices());
            Map<Index, Integer> dims = new LinkedHashMap<>(fp.indexDimensions());
            if (ii.get(0) instanceof Index j && !dims.containsKey(j)) {
                fi.add(j);
                dims.put(j, o.spatialDimension());
            }
            return new Dual(o2, new Zero(fp.shape(), fi, dims));
        }
        return new Dual(o2, new SpatialDerivative(fp, ii, o.spatialDimension()));
    }

    protected Dual derivative(Expr o) {
        throw fatal(new InternalErrorException("Unresolved " + o.kind() + " inside a differentiated expression"
                + " should never occur: " + o));
    }

    /**
     * Compound operators that commute with differentiation. Handled only when
     * enabled in the options; otherwise they must be expanded upstream.
     */
    protected Dual compound(Expr o) {
        if (!context.options().isCompoundRules())
            throw fatal(new MissingRuleException("No differentiation rule for " + o.kind()
                    + ", expand compound operators before differentiation: " + o));
        return compoundRules.apply(o);
    }

    protected Dual unsupportedCompound(Expr o) {
        throw compoundRules.unsupported(o);
    }
}
