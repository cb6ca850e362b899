package com.tensorform.ad.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tensorform.ad.api.Expr;
import com.tensorform.ad.api.FixedIndex;
import com.tensorform.ad.api.Index;
import com.tensorform.ad.api.IndexBase;
import com.tensorform.ad.api.Label;
import com.tensorform.ad.node.Coefficient;
import com.tensorform.ad.node.CoefficientDerivativeMap;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link ExpressionDefinition} into an expression DAG.
 *
 * <p>
 * Nodes reference their inputs by name, so a name used by several nodes
 * becomes a single shared node object. Symbolic indices and variable labels
 * are also declared by name and shared across the whole definition: every
 * occurrence of {@code "i"} in an {@code indices} property is the same
 * {@link Index}.
 *
 * <p>
 * Nodes may be listed in any order; they are instantiated once all of their
 * dependencies exist. A definition that cannot be resolved (cycle or unknown
 * input name) is rejected with an {@link IllegalStateException}.
 */
@Log4j2
public final class JsonExpressionCompiler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Parses a JSON string into an {@link ExpressionDefinition}. */
    public static ExpressionDefinition parse(String json) {
        try {
            ExpressionDefinition def = MAPPER.readValue(json, ExpressionDefinition.class);
            if (def.getExpression() == null)
                throw new IllegalArgumentException("Missing 'expression' key");
            return def;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid expression definition: " + e.getOriginalMessage(), e);
        }
    }

    public static ExpressionDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     */
    public static ExpressionDefinition parseResource(String resource) {
        try (InputStream in = JsonExpressionCompiler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Compiles the definition into an expression DAG.
     *
     * @param def The expression definition.
     * @return the root node together with the name lookup maps.
     */
    public CompiledExpression compile(ExpressionDefinition def) {
        ExpressionDefinition.ExpressionInfo info = def.getExpression();
        List<ExpressionDefinition.NodeDef> nodeDefs = info.getNodes() != null ? info.getNodes() : List.of();
        if (nodeDefs.isEmpty())
            throw new IllegalArgumentException("Expression '" + info.getName() + "' has no nodes");

        List<String> originalOrder = nodeDefs.stream()
                .map(ExpressionDefinition.NodeDef::getName)
                .toList();

        // 1. Validate names and types up front
        Map<String, String> logicalTypes = new LinkedHashMap<>(nodeDefs.size() * 2);
        for (ExpressionDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name in expression '" + info.getName() + "'");
            ExprType type = ExprType.fromString(nd.getType());
            if (logicalTypes.put(nd.getName(), type.name()) != null)
                throw new IllegalArgumentException("Duplicate node name: " + nd.getName());
        }

        Scope scope = new Scope(info.getSpatialDimension());

        // 2. Instantiate nodes via iterative dependency resolution
        Deque<ExpressionDefinition.NodeDef> pending = new ArrayDeque<>(nodeDefs);
        int prevPendingSize = -1;

        while (!pending.isEmpty()) {
            if (pending.size() == prevPendingSize) {
                String unresolved = pending.stream()
                        .map(ExpressionDefinition.NodeDef::getName)
                        .collect(Collectors.joining(", "));
                throw new IllegalStateException(
                        "Cycle or missing dependency detected. Unresolved nodes: " + unresolved);
            }
            prevPendingSize = pending.size();

            Iterator<ExpressionDefinition.NodeDef> iter = pending.iterator();
            while (iter.hasNext()) {
                ExpressionDefinition.NodeDef nd = iter.next();
                ExprType type = ExprType.fromString(nd.getType());

                // Skip if any dependency hasn't been created yet
                if (!scope.nodes.keySet().containsAll(dependencies(nd, type)))
                    continue;

                List<String> inputs = nd.getInputs() != null ? nd.getInputs() : List.of();
                if (type.getArity() >= 0 && inputs.size() != type.getArity()) {
                    throw new IllegalArgumentException("Node " + nd.getName() + " of type " + type + " expects "
                            + type.getArity() + " inputs, got " + inputs.size());
                }
                if (type == ExprType.POWER && (inputs.isEmpty() || inputs.size() > 2))
                    throw new IllegalArgumentException(
                            "Node " + nd.getName() + " of type POWER expects 1 or 2 inputs");

                Expr[] deps = new Expr[inputs.size()];
                for (int i = 0; i < deps.length; i++)
                    deps[i] = scope.nodes.get(inputs.get(i));

                scope.nodeName = nd.getName();
                Expr node;
                try {
                    node = type.getFactory().create(
                            nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap(), deps, scope);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Cannot build node " + nd.getName() + ": " + e.getMessage(), e);
                }
                scope.nodes.put(nd.getName(), node);
                iter.remove();
            }
        }

        String rootName = info.getRoot() != null ? info.getRoot() : originalOrder.get(originalOrder.size() - 1);
        Expr root = scope.nodes.get(rootName);
        if (root == null)
            throw new IllegalArgumentException("Unknown root node: " + rootName);
        log.debug("Compiled expression '{}' with {} nodes, root '{}'", info.getName(), scope.nodes.size(), rootName);

        return new CompiledExpression(info.getName(), info.getSpatialDimension(), root,
                Collections.unmodifiableMap(scope.nodes),
                Collections.unmodifiableMap(logicalTypes),
                Collections.unmodifiableMap(scope.indices),
                originalOrder);
    }

    /** Parses and compiles in one step. */
    public CompiledExpression compileJson(String json) {
        return compile(parse(json));
    }

    /** Names of nodes that must exist before {@code nd} can be created. */
    private static Set<String> dependencies(ExpressionDefinition.NodeDef nd, ExprType type) {
        Set<String> deps = new LinkedHashSet<>();
        if (nd.getInputs() != null)
            deps.addAll(nd.getInputs());
        if (type == ExprType.COEFFICIENT_DERIVATIVE && nd.getProperties() != null) {
            Map<String, Object> props = nd.getProperties();
            deps.addAll(getStringList(props, "coefficients"));
            deps.addAll(getStringList(props, "directions"));
            if (props.get("derivatives") instanceof Map<?, ?> table) {
                for (var entry : table.entrySet()) {
                    deps.add(entry.getKey().toString());
                    deps.addAll(asStringList(entry.getValue()));
                }
            }
        }
        return deps;
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
    }

    /** A string property; a {@code null} default makes the property mandatory. */
    static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        if (v == null) {
            if (def == null)
                throw new IllegalArgumentException("Missing property '" + key + "'");
            return def;
        }
        return v.toString();
    }

    static Integer[] getShape(Map<String, Object> props) {
        Object v = props.get("shape");
        if (v == null)
            return new Integer[0];
        if (!(v instanceof List<?> list))
            throw new IllegalArgumentException("'shape' must be a list of dimensions");
        Integer[] shape = new Integer[list.size()];
        for (int i = 0; i < shape.length; i++)
            shape[i] = list.get(i) instanceof Number n ? n.intValue() : Integer.parseInt(list.get(i).toString());
        return shape;
    }

    static List<String> getStringList(Map<String, Object> props, String key) {
        return asStringList(props.get(key));
    }

    private static List<String> asStringList(Object v) {
        if (v == null)
            return List.of();
        if (v instanceof List<?> list)
            return list.stream().map(Object::toString).toList();
        return List.of(v.toString());
    }

    /** Factory for creating expression nodes from JSON definitions. */
    @FunctionalInterface
    public interface ExprFactory {
        Expr create(Map<String, Object> properties, Expr[] inputs, Scope scope);
    }

    /**
     * Names shared across one compilation: nodes, symbolic indices and
     * variable labels.
     */
    public static final class Scope {
        private final int spatialDimension;
        private final Map<String, Expr> nodes = new LinkedHashMap<>();
        private final Map<String, Index> indices = new LinkedHashMap<>();
        private final Map<String, Label> labels = new HashMap<>();
        private String nodeName;

        Scope(int spatialDimension) {
            if (spatialDimension <= 0)
                throw new IllegalArgumentException("spatialDimension must be positive: " + spatialDimension);
            this.spatialDimension = spatialDimension;
        }

        public int spatialDimension() {
            return spatialDimension;
        }

        /** Name of the node being built. */
        public String nodeName() {
            return nodeName;
        }

        public Expr node(String name) {
            Expr e = nodes.get(name);
            if (e == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return e;
        }

        public Index index(String name) {
            return indices.computeIfAbsent(name, k -> new Index());
        }

        public Label label(String name) {
            return labels.computeIfAbsent(name, Label::new);
        }

        /** A fixed index for a number, a named symbolic index otherwise. */
        public IndexBase indexBase(Map<String, Object> props, String key) {
            Object v = props.get(key);
            if (v == null)
                throw new IllegalArgumentException("Missing property '" + key + "'");
            return toIndexBase(v);
        }

        public List<IndexBase> indexList(Map<String, Object> props, String key) {
            Object v = props.get(key);
            if (v == null)
                return List.of();
            if (!(v instanceof List<?> list))
                return List.of(toIndexBase(v));
            List<IndexBase> out = new ArrayList<>(list.size());
            for (Object o : list)
                out.add(toIndexBase(o));
            return out;
        }

        public Index symbolicIndex(Map<String, Object> props, String key) {
            if (indexBase(props, key) instanceof Index i)
                return i;
            throw new IllegalArgumentException("Property '" + key + "' must name a symbolic index");
        }

        public List<Index> symbolicIndexList(Map<String, Object> props, String key) {
            List<Index> out = new ArrayList<>();
            for (IndexBase b : indexList(props, key)) {
                if (!(b instanceof Index i))
                    throw new IllegalArgumentException("Property '" + key + "' must name symbolic indices only");
                out.add(i);
            }
            return out;
        }

        public List<Coefficient> coefficients(Map<String, Object> props, String key) {
            List<Coefficient> out = new ArrayList<>();
            for (String name : getStringList(props, key))
                out.add(coefficient(name));
            return out;
        }

        /**
         * Reads {@code {"g": ["dg_dw1", "dg_dw2"], ...}}: coefficient name to
         * the names of its partial derivatives.
         */
        public CoefficientDerivativeMap derivativeTable(Map<String, Object> props, String key) {
            Object v = props.get(key);
            if (v == null)
                return CoefficientDerivativeMap.empty();
            if (!(v instanceof Map<?, ?> table))
                throw new IllegalArgumentException("Property '" + key + "' must be an object");
            CoefficientDerivativeMap.Builder builder = CoefficientDerivativeMap.builder();
            for (var entry : table.entrySet()) {
                List<Expr> partials = asStringList(entry.getValue()).stream().map(this::node).toList();
                builder.put(coefficient(entry.getKey().toString()), partials);
            }
            return builder.build();
        }

        private Coefficient coefficient(String name) {
            if (node(name) instanceof Coefficient c)
                return c;
            throw new IllegalArgumentException("Node " + name + " is not a coefficient");
        }

        private IndexBase toIndexBase(Object v) {
            if (v instanceof Number n)
                return FixedIndex.of(n.intValue());
            return index(v.toString());
        }
    }

    /** The result of compilation: the root node and name lookups. */
    public record CompiledExpression(
            String name, int spatialDimension, Expr root,
            Map<String, Expr> nodesByName, Map<String, String> logicalTypes,
            Map<String, Index> indices, List<String> originalOrder) {

        /**
         * @throws IllegalArgumentException if no node has that name.
         */
        public Expr node(String name) {
            Expr e = nodesByName.get(name);
            if (e == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return e;
        }
    }
}
