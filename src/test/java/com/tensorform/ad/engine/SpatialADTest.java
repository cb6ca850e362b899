package com.tensorform.ad.engine;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.api.IndexScopeCollisionException;
import com.tensorform.ad.dsl.Exprs;
import com.tensorform.ad.io.AdOptions;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.MultiIndex;
import com.tensorform.ad.node.ScalarValue;
import com.tensorform.ad.node.SpatialCoordinate;
import com.tensorform.ad.node.SpatialDerivative;
import com.tensorform.ad.node.Zero;
import com.tensorform.ad.testing.ExprEvaluator;
import com.tensorform.ad.util.RecordingDiagnosticSink;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static com.tensorform.ad.dsl.Exprs.*;
import static org.junit.Assert.*;

public class SpatialADTest {
    private static final double H = 1e-6;
    private static final double TOL = 1e-6;

    private RecordingDiagnosticSink sink;
    private SpatialCoordinate x;
    private Expr x0;
    private Expr x1;

    @Before
    public void setUp() {
        sink = new RecordingDiagnosticSink();
        x = coordinate(2);
        x0 = component(x, 0);
        x1 = component(x, 1);
    }

    private SpatialAD ad(int dim, IndexBase index) {
        return new SpatialAD(new AdContext(AdOptions.defaults(), sink, null), dim, index);
    }

    private double centralDifference(Expr f, ExprEvaluator at, int axis) {
        return (at.shifted(axis, H).scalar(f) - at.shifted(axis, -H).scalar(f)) / (2 * H);
    }

    @Test
    public void testSinOfFirstComponent() {
        Expr df = ad(2, FixedIndex.of(0)).differentiate(sin(x0));
        assertEquals(cos(x0), df);
        assertTrue(sink.isClean());
    }

    @Test
    public void testProductOfComponents() {
        Expr f = product(x0, x1);
        assertEquals(x1, ad(2, FixedIndex.of(0)).differentiate(f));
        assertEquals(x0, ad(2, FixedIndex.of(1)).differentiate(f));
    }

    @Test
    public void testCoordinateComponentDerivatives() {
        assertEquals(scalar(1), ad(2, FixedIndex.of(0)).differentiate(x0));
        Expr cross = ad(2, FixedIndex.of(1)).differentiate(x0);
        assertTrue(cross instanceof Zero);
    }

    @Test
    public void testScalarCoordinate() {
        SpatialCoordinate x = coordinate(1);
        assertEquals(new ScalarValue(1), ad(1, FixedIndex.of(0)).differentiate(x));

        Index i = new Index();
        Expr dx = ad(1, i).differentiate(x);
        assertEquals(List.of(i), dx.freeIndices());
        assertEquals(1.0, new ExprEvaluator(0.5).scalar(dx, Map.of(i, 0)), 0.0);
    }

    @Test
    public void testSymbolicIndexIsFreeInResult() {
        Index i = new Index();
        Expr df = ad(2, i).differentiate(product(x0, x1));
        assertEquals(List.of(i), df.freeIndices());
        assertEquals(Integer.valueOf(2), df.indexDimensions().get(i));

        ExprEvaluator at = new ExprEvaluator(0.3, 0.7);
        assertEquals(0.7, at.scalar(df, Map.of(i, 0)), 1e-12);
        assertEquals(0.3, at.scalar(df, Map.of(i, 1)), 1e-12);
    }

    @Test
    public void testGradientOfCoordinateIsIdentityColumn() {
        Expr dx = ad(3, FixedIndex.of(1)).differentiate(coordinate(3));
        assertEquals(List.of(3), dx.shape());
        ExprEvaluator at = new ExprEvaluator(1, 2, 3);
        assertEquals(0.0, at.component(dx, 0), 0.0);
        assertEquals(1.0, at.component(dx, 1), 0.0);
        assertEquals(0.0, at.component(dx, 2), 0.0);
    }

    @Test
    public void testConstantsAreIndependent() {
        Expr c = constant("c");
        Expr dc = ad(2, FixedIndex.of(0)).differentiate(c);
        assertTrue(dc instanceof Zero);

        Expr dn = ad(2, FixedIndex.of(0)).differentiate(component(normal(2), 1));
        assertTrue(dn instanceof Zero);
    }

    @Test
    public void testCoefficientGetsDeferredDerivative() {
        Coefficient u = coefficient("u");
        Expr du = ad(2, FixedIndex.of(1)).differentiate(u);
        assertEquals(new SpatialDerivative(u, MultiIndex.of(FixedIndex.of(1)), 2), du);
    }

    @Test
    public void testDeferredDerivativeOfSpatialDerivative() {
        Coefficient u = coefficient("u");
        Expr second = ad(2, FixedIndex.of(0)).differentiate(dx(u, FixedIndex.of(1), 2));
        assertEquals(dx(dx(u, FixedIndex.of(0), 2), FixedIndex.of(1), 2), second);

        Index j = new Index();
        Expr ofConstant = ad(2, FixedIndex.of(0)).differentiate(dx(x0, j, 2));
        assertTrue(ofConstant instanceof Zero);
        assertTrue(ofConstant.freeIndices().contains(j));
    }

    @Test(expected = IndexScopeCollisionException.class)
    public void testSummationIndexCollision() {
        Coefficient v = coefficient("v", 3);
        Index i = new Index();
        Expr vi = indexed(v, i);
        ad(3, i).differentiate(indexSum(product(vi, vi), i));
    }

    @Test
    public void testCollisionIsReportedToSink() {
        Coefficient v = coefficient("v", 3);
        Index i = new Index();
        Expr vi = indexed(v, i);
        try {
            ad(3, i).differentiate(indexSum(product(vi, vi), i));
            fail("Expected IndexScopeCollisionException");
        } catch (IndexScopeCollisionException e) {
            assertEquals(1, sink.errors().size());
            assertSame(e, sink.errors().get(0));
        }
    }

    @Test
    public void testAgainstFiniteDifferences() {
        Expr f = sum(
                product(sin(x0), exp(x1)),
                divide(power(x0, 3), sum(x1, scalar(2))),
                sqrt(sum(product(x0, x0), scalar(1))),
                atan(product(x0, x1)));
        ExprEvaluator at = new ExprEvaluator(0.4, 0.9);
        for (int axis = 0; axis < 2; axis++) {
            Expr df = ad(2, FixedIndex.of(axis)).differentiate(f);
            assertEquals("axis " + axis, centralDifference(f, at, axis), at.scalar(df), TOL);
        }
    }

    @Test
    public void testIndexSumAgainstFiniteDifferences() {
        // |x|^2 summed over components
        Index k = new Index();
        Expr xk = indexed(x, k);
        Expr f = Exprs.indexSum(product(xk, xk), k);
        ExprEvaluator at = new ExprEvaluator(0.25, -1.5);
        for (int axis = 0; axis < 2; axis++) {
            Expr df = ad(2, FixedIndex.of(axis)).differentiate(f);
            assertEquals(centralDifference(f, at, axis), at.scalar(df), TOL);
        }
    }
}
