package com.pgm.xdsl.codegen;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/**
 * POJO representation of a parsed influence diagram, written by
 * {@link JsonModelGenerator}.
 */
@Data
@JsonPropertyOrder({ "nodes", "arcs", "weights" })
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ModelDocument {
    private List<NodeDoc> nodes;
    private List<ArcDoc> arcs;
    private Map<String, Double> weights;

    /** A single node with its tables. */
    @Data
    @JsonPropertyOrder({ "id", "kind", "states", "parents", "probabilities", "utilities" })
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDoc {
        private String id, kind;
        private List<String> states, parents;
        private List<Double> probabilities, utilities;
    }

    /** A directed arc between two node ids. */
    @Data
    @JsonPropertyOrder({ "parent", "child" })
    public static final class ArcDoc {
        private String parent, child;
    }
}
