package com.tensorform.ad.io;

import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.ExprKind;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.io.JsonExpressionCompiler.CompiledExpression;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.CoefficientDerivative;
import com.tensorform.ad.node.IndexSum;
import com.tensorform.ad.node.Indexed;
import com.tensorform.ad.node.SpatialDerivative;
import com.tensorform.ad.node.Variable;
import com.tensorform.ad.node.VariableDerivative;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class JsonExpressionCompilerTest {
    private JsonExpressionCompiler compiler;

    @Before
    public void setUp() {
        compiler = new JsonExpressionCompiler();
    }

    private static String wrap(String nodes) {
        return "{\"expression\": {\"name\": \"t\", \"spatialDimension\": 2, \"nodes\": [" + nodes + "]}}";
    }

    @Test
    public void testCompileOutOfOrderDefinition() {
        CompiledExpression c = compiler.compile(JsonExpressionCompiler.parseResource("expressions/sin_x0.json"));

        assertEquals("sin_x0", c.name());
        assertEquals(2, c.spatialDimension());
        assertEquals(List.of("df", "f", "x0", "x"), c.originalOrder());
        assertEquals("SPATIAL_DERIVATIVE", c.logicalTypes().get("df"));

        assertTrue(c.root() instanceof SpatialDerivative);
        assertSame(c.node("f"), c.root().operands().get(0));
        assertSame(c.node("x"), ((Indexed) c.node("x0")).tensor());
    }

    @Test
    public void testDefaultRootIsLastNode() {
        CompiledExpression c = compiler.compile(JsonExpressionCompiler.parseResource("expressions/gateaux.json"));
        assertSame(c.node("df"), c.root());
        CoefficientDerivative cd = (CoefficientDerivative) c.root();
        assertSame(c.node("u"), cd.coefficients().get(0));
        assertSame(c.node("phi"), cd.directions().get(0));
        assertTrue(cd.derivatives().isEmpty());
    }

    @Test
    public void testIndicesAreSharedByName() {
        CompiledExpression c = compiler.compile(JsonExpressionCompiler.parseResource("expressions/gateaux.json"));
        Index i = c.indices().get("i");
        assertNotNull(i);
        assertEquals(i, ((IndexSum) c.node("f")).index());
        assertEquals(List.of(i), c.node("u_i").freeIndices());
        assertTrue(c.node("f").freeIndices().isEmpty());
    }

    @Test
    public void testVariableLabelsAreSharedByName() {
        CompiledExpression c = compiler.compileJson(wrap(
                "{\"name\": \"g\", \"type\": \"coefficient\"},"
                        + "{\"name\": \"a\", \"type\": \"variable\", \"inputs\": [\"g\"], \"properties\": {\"label\": \"L\"}},"
                        + "{\"name\": \"b\", \"type\": \"variable\", \"inputs\": [\"g\"], \"properties\": {\"label\": \"L\"}},"
                        + "{\"name\": \"s\", \"type\": \"sum\", \"inputs\": [\"a\", \"b\"]},"
                        + "{\"name\": \"ds\", \"type\": \"variable_derivative\", \"inputs\": [\"s\", \"a\"]}"));
        assertSame(((Variable) c.node("a")).label(), ((Variable) c.node("b")).label());
        assertSame(c.node("a"), ((VariableDerivative) c.root()).variable());
    }

    @Test
    public void testPowerWithExponentProperty() {
        CompiledExpression c = compiler.compile(
                JsonExpressionCompiler.parseResource("expressions/variable_square.json"));
        Expr f = c.node("f");
        assertEquals(ExprKind.POWER, f.kind());
        assertSame(c.node("v"), f.operands().get(0));
    }

    @Test
    public void testCoefficientDerivativeTable() {
        CompiledExpression c = compiler.compileJson(wrap(
                "{\"name\": \"u\", \"type\": \"coefficient\", \"properties\": {\"shape\": [2]}},"
                        + "{\"name\": \"g\", \"type\": \"coefficient\"},"
                        + "{\"name\": \"dgdu\", \"type\": \"coefficient\", \"properties\": {\"shape\": [2]}},"
                        + "{\"name\": \"v\", \"type\": \"argument\", \"properties\": {\"shape\": [2]}},"
                        + "{\"name\": \"dg\", \"type\": \"coefficient_derivative\", \"inputs\": [\"g\"],"
                        + " \"properties\": {\"coefficients\": [\"u\"], \"directions\": [\"v\"],"
                        + " \"derivatives\": {\"g\": [\"dgdu\"]}}}"));
        CoefficientDerivative cd = (CoefficientDerivative) c.root();
        assertEquals(List.of(c.node("dgdu")), cd.derivatives().get((Coefficient) c.node("g")));
    }

    @Test
    public void testCycleDetection() {
        try {
            compiler.compile(JsonExpressionCompiler.parseResource("expressions/cycle.json"));
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("Unresolved nodes: a, b"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testMissingDependency() {
        compiler.compileJson(wrap("{\"name\": \"a\", \"type\": \"abs\", \"inputs\": [\"nope\"]}"));
    }

    @Test
    public void testUnknownType() {
        try {
            compiler.compileJson(wrap("{\"name\": \"a\", \"type\": \"laplacian\"}"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Unknown ExprType"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNames() {
        compiler.compileJson(wrap("{\"name\": \"a\", \"type\": \"scalar\", \"properties\": {\"value\": 1}},"
                + "{\"name\": \"a\", \"type\": \"scalar\", \"properties\": {\"value\": 2}}"));
    }

    @Test
    public void testArityChecked() {
        try {
            compiler.compileJson(wrap("{\"name\": \"x\", \"type\": \"spatial_coordinate\"},"
                    + "{\"name\": \"d\", \"type\": \"division\", \"inputs\": [\"x\"]}"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("expects 2 inputs"));
        }
    }

    @Test
    public void testFactoryErrorsNameTheNode() {
        try {
            compiler.compileJson(wrap("{\"name\": \"v\", \"type\": \"coefficient\", \"properties\": {\"shape\": [3]}},"
                    + "{\"name\": \"bad\", \"type\": \"index_sum\", \"inputs\": [\"v\"], \"properties\": {\"index\": \"i\"}}"));
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("Cannot build node bad"));
        }
    }

    @Test
    public void testMissingExpressionKey() {
        try {
            JsonExpressionCompiler.parse("{\"nodes\": []}");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("expression"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeLookup() {
        compiler.compile(JsonExpressionCompiler.parseResource("expressions/sin_x0.json")).node("nope");
    }
}
