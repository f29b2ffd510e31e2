package com.pgm.xdsl.model;

import com.pgm.xdsl.api.NodeKind;

import java.util.List;

/**
 * One node of the influence diagram.
 *
 * @param handle arena index assigned when the node was added
 * @param id     document id, reused verbatim as generated identifier
 * @param kind   chance, decision or utility
 * @param states state labels in document order; empty for utility nodes
 */
public record NodeDefinition(int handle, String id, NodeKind kind, List<String> states) {

    public NodeDefinition {
        states = List.copyOf(states);
    }

    /** Number of values the node's variable takes. Utility nodes hold a single slot. */
    public int cardinality() {
        return kind == NodeKind.UTILITY ? 1 : states.size();
    }
}
