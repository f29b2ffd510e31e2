package com.pgm.xdsl.model;

import com.pgm.xdsl.api.NodeKind;
import com.pgm.xdsl.api.StructureException;
import com.pgm.xdsl.api.TableShapeException;

import java.util.*;

/**
 * Influence diagram extracted from an XDSL document.
 *
 * <p>
 * Nodes live in an arena indexed by a stable integer handle; the registry maps
 * each document id to its handle. Arcs, probability tables, utility tables and
 * MAU weights all refer to nodes by id. Registry iteration order is the order
 * in which nodes were added, i.e. document order.
 *
 * <p>
 * Instances are immutable. Use {@link #builder()} to populate one.
 */
public final class GraphModel {
    private final NodeDefinition[] nodes;
    private final Map<String, Integer> idToHandle;
    private final List<Arc> arcs;
    private final Map<String, List<Double>> probabilities;
    private final Map<String, List<Double>> utilities;
    private final Map<String, Double> weights;

    private GraphModel(Builder b) {
        this.nodes = b.nodes.toArray(new NodeDefinition[0]);
        this.idToHandle = Collections.unmodifiableMap(new LinkedHashMap<>(b.idToHandle));
        this.arcs = List.copyOf(b.arcs);
        this.probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(b.probabilities));
        this.utilities = Collections.unmodifiableMap(new LinkedHashMap<>(b.utilities));
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(b.weights));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int nodeCount() {
        return nodes.length;
    }

    /** Returns the node stored at the given handle. */
    public NodeDefinition node(int handle) {
        return nodes[handle];
    }

    /** Resolves a node id to its definition. */
    public NodeDefinition node(String id) {
        return nodes[handle(id)];
    }

    /** Resolves a node id to its handle. */
    public int handle(String id) {
        Integer idx = idToHandle.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public boolean contains(String id) {
        return idToHandle.containsKey(id);
    }

    /** All nodes in registry order. */
    public List<NodeDefinition> nodes() {
        return List.of(nodes);
    }

    public List<NodeDefinition> nodesOfKind(NodeKind kind) {
        List<NodeDefinition> out = new ArrayList<>();
        for (NodeDefinition n : nodes)
            if (n.kind() == kind)
                out.add(n);
        return out;
    }

    /** Arcs in the order they were added, duplicates included. */
    public List<Arc> arcs() {
        return arcs;
    }

    /** Parent ids of a node, one entry per incoming arc. */
    public List<String> parentsOf(String id) {
        List<String> out = new ArrayList<>();
        for (Arc a : arcs)
            if (a.child().equals(id))
                out.add(a.parent());
        return out;
    }

    /** Flattened probability table of a chance node; empty when none was given. */
    public List<Double> probabilities(String id) {
        return probabilities.getOrDefault(id, List.of());
    }

    /** Weighted, flattened utility table of a utility node; empty when none was given. */
    public List<Double> utilities(String id) {
        return utilities.getOrDefault(id, List.of());
    }

    /** MAU weights keyed by the weighted node's id. */
    public Map<String, Double> weights() {
        return weights;
    }

    public double weight(String id) {
        return weights.getOrDefault(id, 1.0);
    }

    public int cardinality(String id) {
        return node(id).cardinality();
    }

    /**
     * Number of entries a full table for this node holds: the node's own
     * cardinality times the cardinality of every parent, one factor per
     * incoming arc. Utility nodes contribute a factor of 1.
     *
     * @throws TableShapeException if the product does not fit in an int
     */
    public int tableSize(String id) {
        int size = cardinality(id);
        for (String parent : parentsOf(id)) {
            try {
                size = Math.multiplyExact(size, cardinality(parent));
            } catch (ArithmeticException e) {
                throw TableShapeException.tooLarge(id);
            }
        }
        return size;
    }

    /**
     * Mutable accumulator for a {@link GraphModel}. Not thread-safe.
     */
    public static final class Builder {
        private final List<NodeDefinition> nodes = new ArrayList<>();
        private final Map<String, Integer> idToHandle = new LinkedHashMap<>();
        private final List<Arc> arcs = new ArrayList<>();
        private final Map<String, List<Double>> probabilities = new LinkedHashMap<>();
        private final Map<String, List<Double>> utilities = new LinkedHashMap<>();
        private final Map<String, Double> weights = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a node and returns its handle.
         *
         * @throws StructureException if the id is already registered
         */
        public int addNode(NodeKind kind, String id, List<String> states) {
            if (idToHandle.containsKey(id))
                throw new StructureException("Duplicate node id: " + id);
            int handle = nodes.size();
            nodes.add(new NodeDefinition(handle, id, kind,
                    kind == NodeKind.UTILITY ? List.of() : states));
            idToHandle.put(id, handle);
            return handle;
        }

        public boolean contains(String id) {
            return idToHandle.containsKey(id);
        }

        public NodeKind kind(String id) {
            return nodes.get(requireHandle(id)).kind();
        }

        public Builder addArc(String parent, String child) {
            requireHandle(parent);
            requireHandle(child);
            arcs.add(new Arc(parent, child));
            return this;
        }

        public Builder setProbabilities(String id, List<Double> values) {
            requireHandle(id);
            probabilities.put(id, List.copyOf(values));
            return this;
        }

        public Builder setUtilities(String id, List<Double> values) {
            requireHandle(id);
            utilities.put(id, List.copyOf(values));
            return this;
        }

        /** Weights may name ids that are never registered; they are kept as given. */
        public Builder putWeight(String id, double weight) {
            weights.put(id, weight);
            return this;
        }

        public double weight(String id) {
            return weights.getOrDefault(id, 1.0);
        }

        public GraphModel build() {
            return new GraphModel(this);
        }

        private int requireHandle(String id) {
            Integer idx = idToHandle.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }
    }
}
