package com.tensorform.ad.engine;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.Label;
import com.tensorform.ad.api.PreconditionException;
import com.tensorform.ad.io.AdOptions;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.Variable;
import com.tensorform.ad.node.Zero;
import com.tensorform.ad.testing.ExprEvaluator;
import com.tensorform.ad.util.RecordingDiagnosticSink;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static com.tensorform.ad.dsl.Exprs.*;
import static org.junit.Assert.*;

public class VariableADTest {
    private RecordingDiagnosticSink sink;
    private Coefficient g;

    @Before
    public void setUp() {
        sink = new RecordingDiagnosticSink();
        g = coefficient("g");
    }

    private Expr differentiate(Expr f, Variable v) {
        return new VariableAD(new AdContext(AdOptions.defaults(), sink, null), 3, v).differentiate(f);
    }

    @Test
    public void testSquareOfVariable() {
        Variable v = variable(exp(g), new Label("v"));
        Expr dv = differentiate(power(v, 2), v);

        assertEquals(product(power(v, 1), scalar(2)), dv);
        ExprEvaluator at = new ExprEvaluator().bind(g, 0.3);
        assertEquals(2 * Math.exp(0.3), at.scalar(dv), 1e-12);
    }

    @Test
    public void testVariableWithRespectToItself() {
        Variable v = variable(sin(g));
        assertEquals(scalar(1), differentiate(v, v));
    }

    @Test
    public void testVariablesMatchByLabel() {
        Label label = new Label("shared");
        Variable a = variable(exp(g), label);
        Variable b = variable(exp(g), label);
        assertNotSame(a, b);

        assertEquals(scalar(2), differentiate(sum(a, b), a));
    }

    @Test
    public void testOtherVariablesAreTransparent() {
        Variable v = variable(g, new Label("v"));
        Variable w = variable(sin(g), new Label("w"));
        assertEquals(w, differentiate(product(v, w), v));
    }

    @Test
    public void testWrappedExpressionIsNotTheVariable() {
        // Only the label counts: g inside v is an unrelated terminal
        Variable v = variable(g);
        Expr d = differentiate(product(g, g), v);
        assertTrue(d instanceof Zero);
        assertTrue(sink.isClean());
    }

    @Test
    public void testTensorVariableGivesIdentity() {
        Variable v = variable(coefficient("u", 2));
        Expr dv = differentiate(v, v);
        assertEquals(List.of(2, 2), dv.shape());
        assertEquals(identity(2), dv);
    }

    @Test
    public void testDerivativeShapeAppendsVariableShape() {
        Variable v = variable(coefficient("u", 3));
        Expr dv = differentiate(product(g, component(v, 1)), v);
        assertEquals(List.of(3), dv.shape());

        ExprEvaluator at = new ExprEvaluator().bind(g, 4.0).bind((Coefficient) v.expression(), 1, 2, 3);
        assertEquals(0.0, at.component(dv, 0), 0.0);
        assertEquals(4.0, at.component(dv, 1), 0.0);
        assertEquals(0.0, at.component(dv, 2), 0.0);
    }

    @Test
    public void testLabelResultsAreCachedPerRun() {
        Label label = new Label();
        Variable a = variable(exp(g), label);
        Variable b = variable(cos(g), label);
        Variable w = variable(g);
        VariableAD ad = new VariableAD(new AdContext(AdOptions.defaults(), sink, null), 3, w);

        // b carries a's label, so it is served from the label cache
        Dual first = ad.visit(a);
        Dual second = ad.visit(b);
        assertSame(first, second);
    }

    @Test(expected = PreconditionException.class)
    public void testOnesRejectsMismatchedShape() {
        Variable v = variable(coefficient("u", 2));
        VariableAD ad = new VariableAD(new AdContext(AdOptions.defaults(), sink, null), 3, v);
        ad.makeOnesDiff(g);
    }
}
