package com.pgm.xdsl.io;

import com.pgm.xdsl.api.NodeKind;
import com.pgm.xdsl.api.StructureException;
import com.pgm.xdsl.api.UnsupportedKindException;
import com.pgm.xdsl.model.GraphModel;
import lombok.extern.log4j.Log4j2;

import java.util.List;

/**
 * Creates single nodes inside a model under construction.
 */
@Log4j2
public final class NodeFactory {
    private NodeFactory() {
        // Utility class
    }

    /**
     * Creates a node from a kind name such as {@code "cpt"}, {@code "decision"}
     * or {@code "utility"}.
     *
     * @throws UnsupportedKindException if the name denotes no supported kind
     */
    public static int createNode(GraphModel.Builder model, String kind, String id, List<String> states) {
        return createNode(model, NodeKind.fromString(kind), id, states);
    }

    /**
     * Creates a node and returns its handle. For utility nodes the states are
     * ignored and the node gets a single value slot.
     *
     * @throws UnsupportedKindException if {@code kind} is null
     * @throws StructureException       if a chance or decision node has no
     *                                  states, or the id is already taken
     */
    public static int createNode(GraphModel.Builder model, NodeKind kind, String id, List<String> states) {
        if (kind == null)
            throw new UnsupportedKindException(null);
        if (id == null || id.isEmpty())
            throw new IllegalArgumentException("Node id must not be empty");
        if (kind != NodeKind.UTILITY && states.isEmpty())
            throw new StructureException("Node " + id + " declares no states");

        int handle = model.addNode(kind, id, states);
        log.debug("Created {} node {} (handle {}) with states {}", kind, id, handle, states);
        return handle;
    }
}
