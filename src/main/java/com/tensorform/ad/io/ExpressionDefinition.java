package com.tensorform.ad.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an expression DAG.
 *
 * <pre>{@code
 * { "expression": { "name": "f", "spatialDimension": 2, "root": "df",
 *     "nodes": [ { "name": "x", "type": "spatial_coordinate" },
 *                { "name": "x0", "type": "indexed", "inputs": ["x"],
 *                  "properties": { "indices": [0] } }, ... ] } }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExpressionDefinition {
    private ExpressionInfo expression;

    /** Meta-information and the node list. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ExpressionInfo {
        private String name, root;
        private int spatialDimension = 3;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node; inputs are referenced by node name. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private List<String> inputs;
        private Map<String, Object> properties;
    }
}
