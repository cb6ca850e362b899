package com.tensorform.ad.engine;

import com.tensorform.ad.api.DomainViolationException;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.ExpressionTooDeepException;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.api.InternalErrorException;
import com.tensorform.ad.api.MissingRuleException;
import com.tensorform.ad.api.PreconditionException;
import com.tensorform.ad.io.AdOptions;
import com.tensorform.ad.node.BesselFunction;
import com.tensorform.ad.node.BesselFunction.BesselKind;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.Division;
import com.tensorform.ad.node.Power;
import com.tensorform.ad.node.Restricted;
import com.tensorform.ad.node.SpatialCoordinate;
import com.tensorform.ad.node.Variable;
import com.tensorform.ad.node.Zero;
import com.tensorform.ad.testing.ExprEvaluator;
import com.tensorform.ad.util.AdStatsListener;
import com.tensorform.ad.util.RecordingDiagnosticSink;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.tensorform.ad.dsl.Exprs.*;
import static org.junit.Assert.*;

public class ForwardADRulesTest {
    private RecordingDiagnosticSink sink;
    private AdOptions options;
    private AdStatsListener stats;
    private SpatialCoordinate x;
    private Expr x0;
    private Expr x1;

    @Before
    public void setUp() {
        sink = new RecordingDiagnosticSink();
        options = AdOptions.defaults();
        stats = new AdStatsListener();
        x = coordinate(2);
        x0 = component(x, 0);
        x1 = component(x, 1);
    }

    private SpatialAD ad(IndexBase index) {
        return new SpatialAD(new AdContext(options, sink, stats), 2, index);
    }

    private SpatialAD ad() {
        return ad(FixedIndex.of(0));
    }

    // ---------------------------------------------------------------
    // Memoization
    // ---------------------------------------------------------------

    @Test
    public void testSharedNodeDifferentiatedOnce() {
        Expr shared = sin(product(x0, x1));
        Expr f = sum(product(shared, shared), cos(shared), exp(shared));
        ad().differentiate(f);

        assertEquals(1, stats.maxApplicationsPerNode());
        assertEquals(1, stats.applications(shared));
        assertTrue(stats.lastCacheHits() >= 3);
        assertEquals(1, stats.totalRuns());
    }

    @Test
    public void testVisitReturnsIdenticalResult() {
        SpatialAD ad = ad();
        Expr f = sin(x0);
        Dual first = ad.visit(f);
        assertSame(first, ad.visit(f));
        assertEquals(1, ad.context().cacheHits());
    }

    @Test
    public void testStructurallyEqualNodesAreVisitedSeparately() {
        Expr a = sin(x0);
        Expr b = sin(x0);
        assertEquals(a, b);
        ad().differentiate(sum(a, b));
        assertEquals(1, stats.applications(a));
        assertEquals(1, stats.applications(b));
        assertEquals(2, stats.count(ExprKind.MATH_FUNCTION));
    }

    // ---------------------------------------------------------------
    // Shapes
    // ---------------------------------------------------------------

    @Test
    public void testDerivativeShapeAndIndices() {
        Index i = new Index();
        Expr f = asVector(product(x0, x1), sin(x1));
        Expr df = ad(i).differentiate(f);
        assertEquals(f.shape(), df.shape());
        assertEquals(List.of(i), df.freeIndices());

        ExprEvaluator at = new ExprEvaluator(0.5, 2.0);
        assertEquals(2.0, at.component(df, Map.of(i, 0), 0), 1e-12);
        assertEquals(Math.cos(2.0), at.component(df, Map.of(i, 1), 1), 1e-12);
        assertEquals(0.0, at.component(df, Map.of(i, 0), 1), 1e-12);
    }

    @Test
    public void testZeroDerivativeCarriesVariableIndex() {
        Index i = new Index();
        Expr df = ad(i).differentiate(constant("c", 2));
        assertTrue(df instanceof Zero);
        assertEquals(List.of(2), df.shape());
        assertEquals(List.of(i), df.freeIndices());
    }

    @Test
    public void testComponentTensorDerivative() {
        Index j = new Index();
        Expr f = asTensor(product(indexed(x, j), x0), j);
        Expr df = ad().differentiate(f);
        assertEquals(List.of(2), df.shape());

        ExprEvaluator at = new ExprEvaluator(3.0, 5.0);
        // d(x_j x_0)/dx_0 = delta_j0 x_0 + x_j
        assertEquals(6.0, at.component(df, 0), 1e-12);
        assertEquals(5.0, at.component(df, 1), 1e-12);
    }

    // ---------------------------------------------------------------
    // Algebra and elementary functions
    // ---------------------------------------------------------------

    @Test
    public void testQuotientRule() {
        Expr df = ad().differentiate(divide(x1, x0));
        ExprEvaluator at = new ExprEvaluator(2.0, 3.0);
        assertEquals(-3.0 / 4.0, at.scalar(df), 1e-12);
    }

    @Test
    public void testPowerWithVariableExponent() {
        // d(x1^x0)/dx0 = x1^x0 ln(x1)
        Expr df = ad().differentiate(power(x1, x0));
        ExprEvaluator at = new ExprEvaluator(1.5, 2.5);
        assertEquals(Math.pow(2.5, 1.5) * Math.log(2.5), at.scalar(df), 1e-9);
    }

    @Test
    public void testPowerRewritesPrimal() {
        Dual d = ad().visit(power(x0, 3));
        assertEquals(ExprKind.PRODUCT, d.primal().kind());
        assertEquals(3.0 * 4.0, new ExprEvaluator(2.0, 0.0).scalar(d.derivative()), 1e-12);
    }

    @Test
    public void testElementaryFunctions() {
        ExprEvaluator at = new ExprEvaluator(0.3, 0.0);
        double v = 0.3;
        assertEquals(0.5 / Math.sqrt(v), at.scalar(ad().differentiate(sqrt(x0))), 1e-12);
        assertEquals(1.0 / v, at.scalar(ad().differentiate(ln(x0))), 1e-12);
        assertEquals(-Math.sin(v), at.scalar(ad().differentiate(cos(x0))), 1e-12);
        assertEquals(1.0 / (Math.cos(v) * Math.cos(v)), at.scalar(ad().differentiate(tan(x0))), 1e-12);
        assertEquals(-1.0 / Math.sqrt(1 - v * v), at.scalar(ad().differentiate(acos(x0))), 1e-12);
        assertEquals(1.0 / Math.sqrt(1 - v * v), at.scalar(ad().differentiate(asin(x0))), 1e-12);
        assertEquals(1.0 / (1 + v * v), at.scalar(ad().differentiate(atan(x0))), 1e-12);
        assertEquals(2.0 / Math.sqrt(Math.PI) * Math.exp(-v * v), at.scalar(ad().differentiate(erf(x0))), 1e-12);
    }

    @Test
    public void testAbsSecondDerivativeVanishes() {
        Expr df = ad().differentiate(abs(x0));
        assertEquals(sign(x0), df);
        assertTrue(ad().differentiate(df) instanceof Zero);
    }

    @Test(expected = DomainViolationException.class)
    public void testLnOfZero() {
        ad().differentiate(ln(zero()));
    }

    @Test(expected = PreconditionException.class)
    public void testDivisionByIndexedDenominator() {
        Index i = new Index();
        ad().differentiate(new Division(x0, indexed(x, i)));
    }

    @Test(expected = PreconditionException.class)
    public void testPowerOfIndexedBase() {
        Index i = new Index();
        ad().differentiate(new Power(indexed(x, i), scalar(2)));
    }

    // ---------------------------------------------------------------
    // Bessel functions
    // ---------------------------------------------------------------

    @Test
    public void testBesselOrderZero() {
        assertEquals(negate(besselJ(1, x0)), ad().differentiate(besselJ(0, x0)));
        assertEquals(besselI(1, x0), ad().differentiate(besselI(0, x0)));
    }

    @Test
    public void testBesselRecurrence() {
        Expr df = ad().differentiate(besselY(2, x0));
        assertEquals(times(scalar(0.5), subtract(besselY(1, x0), besselY(3, x0))), df);

        Expr dk = ad().differentiate(besselK(1, x0));
        assertEquals(times(scalar(-0.5), add(besselK(0, x0), besselK(2, x0))), dk);
    }

    @Test(expected = PreconditionException.class)
    public void testBesselOrderMustBeConstant() {
        ad().differentiate(new BesselFunction(BesselKind.J, x0, x1));
    }

    @Test(expected = PreconditionException.class)
    public void testBesselOrderMustBeInteger() {
        ad().differentiate(new BesselFunction(BesselKind.J, scalar(0.5), x1));
    }

    // ---------------------------------------------------------------
    // Restrictions and conditionals
    // ---------------------------------------------------------------

    @Test
    public void testRestriction() {
        assertEquals(scalar(1), ad().differentiate(plus(x0)));

        Coefficient u = coefficient("u");
        Expr du = ad().differentiate(minus(u));
        assertTrue(du instanceof Restricted);
        assertEquals(Restricted.Side.MINUS, ((Restricted) du).side());
    }

    @Test
    public void testConditionOnVariableWarns() {
        Expr f = conditional(lt(x0, scalar(0.5)), x0, scalar(2));
        Expr df = ad().differentiate(f);

        assertEquals(1, sink.warnings().size());
        assertTrue(sink.errors().isEmpty());
        assertEquals(1.0, new ExprEvaluator(0.3, 0).scalar(df), 0.0);
        assertEquals(0.0, new ExprEvaluator(0.8, 0).scalar(df), 0.0);
    }

    @Test
    public void testIndependentConditionIsSilent() {
        Expr f = conditional(not(lt(constant("c"), scalar(0))), x0, x1);
        Expr df = ad().differentiate(f);
        assertTrue(sink.isClean());
        assertEquals(ExprKind.CONDITIONAL, df.kind());
    }

    @Test
    public void testConditionalWithConstantBranchesIsZero() {
        Expr f = conditional(gt(x0, scalar(0)), scalar(1), scalar(3));
        assertTrue(ad().differentiate(f) instanceof Zero);
    }

    // ---------------------------------------------------------------
    // Markers, compounds and limits
    // ---------------------------------------------------------------

    @Test(expected = InternalErrorException.class)
    public void testNestedMarkerIsInternalError() {
        Coefficient g = coefficient("g");
        ad().differentiate(sum(x0, diff(g, variable(g))));
    }

    @Test(expected = MissingRuleException.class)
    public void testCompoundOperatorsDisabledByDefault() {
        ad().differentiate(trace(outer(x, x)));
    }

    @Test
    public void testCommutingCompoundOperator() {
        options.setCompoundRules(true);
        Coefficient a = coefficient("A", 2, 2);
        Expr df = ad().differentiate(transpose(a));
        assertEquals(transpose(dx(a, FixedIndex.of(0), 2)), df);

        assertTrue(ad().differentiate(transpose(constant("C", 2, 2))) instanceof Zero);
    }

    @Test
    public void testCompoundProductRule() {
        options.setCompoundRules(true);
        Coefficient c = constant("c", 2);
        Expr df = ad().differentiate(inner(x, c));
        // Only the first factor depends on x
        assertEquals(ExprKind.INNER, df.kind());
        assertEquals(List.of(2), df.operands().get(0).shape());
        assertSame(c, df.operands().get(1));

        Coefficient u = coefficient("u", 2);
        Expr both = ad().differentiate(dot(u, x));
        assertEquals(ExprKind.SUM, both.kind());
        assertEquals(2, both.operands().size());
    }

    @Test
    public void testUnsupportedCompoundAlwaysFails() {
        options.setCompoundRules(true);
        Coefficient u = coefficient("u", 3);
        Coefficient w = coefficient("w", 3);
        for (Expr e : List.of(cross(u, w), det(coefficient("M", 2, 2)), inverse(coefficient("M", 2, 2)))) {
            try {
                new SpatialAD(new AdContext(options, sink, null), 3, FixedIndex.of(0)).differentiate(e);
                fail("Expected MissingRuleException for " + e.kind());
            } catch (MissingRuleException expected) {
                assertTrue(expected.getMessage().contains("expand compound operators"));
            }
        }
        assertEquals(3, sink.errors().size());
    }

    @Test(expected = PreconditionException.class)
    public void testCompoundRulesNeedScalarVariable() {
        options.setCompoundRules(true);
        Variable v = variable(coefficient("u", 2));
        new VariableAD(new AdContext(options, sink, null), 2, v).differentiate(trace(outer(v, v)));
    }

    @Test
    public void testMaximumDepth() {
        options.setMaxDepth(3);
        try {
            ad().differentiate(sin(sin(sin(sin(x0)))));
            fail("Expected ExpressionTooDeepException");
        } catch (ExpressionTooDeepException e) {
            assertTrue(e.getMessage().contains("3"));
            assertEquals(1, sink.errors().size());
        }
    }

    @Test
    public void testDeepChainUnderDefaultOptions() {
        Expr f = x0;
        for (int k = 0; k < 9000; k++)
            f = sin(f);
        try {
            ad().differentiate(f);
            fail("Expected ExpressionTooDeepException");
        } catch (ExpressionTooDeepException e) {
            assertTrue(e.getMessage().contains(String.valueOf(AdOptions.defaults().getMaxDepth())));
            assertEquals(1, sink.errors().size());
            assertSame(e, sink.errors().get(0));
        }
    }

    @Test
    public void testStackExhaustionIsReportedAsTooDeep() throws InterruptedException {
        options.setMaxDepth(Integer.MAX_VALUE);
        Expr f = x0;
        for (int k = 0; k < 100_000; k++)
            f = sin(f);
        Expr deep = f;
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread worker = new Thread(null, () -> {
            try {
                ad().differentiate(deep);
            } catch (Throwable t) {
                thrown.set(t);
            }
        }, "small-stack", 256 * 1024);
        worker.start();
        worker.join();

        assertTrue(String.valueOf(thrown.get()), thrown.get() instanceof ExpressionTooDeepException);
        assertTrue(thrown.get().getCause() instanceof StackOverflowError);
        assertEquals(1, sink.errors().size());
    }
}
