package com.pgm.xdsl.codegen;

import com.pgm.xdsl.api.CodeGenerator;
import com.pgm.xdsl.model.Arc;
import com.pgm.xdsl.model.GraphModel;
import com.pgm.xdsl.model.NodeDefinition;

/**
 * Renders the influence diagram as a Mermaid flowchart.
 *
 * <p>
 * Shapes follow the usual influence diagram notation: chance nodes are
 * rounded, decision nodes rectangular and utility nodes diamonds. Nodes are
 * declared in registry order, then one edge per arc in arc order.
 */
public final class MermaidCodeGenerator implements CodeGenerator {

    @Override
    public String generate(GraphModel model) {
        StringBuilder sb = new StringBuilder(256 + model.nodeCount() * 64);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (NodeDefinition n : model.nodes()) {
            String safeName = sanitize(n.id());
            String label = labelFor(model, n);
            switch (n.kind()) {
                case CHANCE -> sb.append("  ").append(safeName).append("([\"").append(label).append("\"]);\n");
                case DECISION -> sb.append("  ").append(safeName).append("[\"").append(label).append("\"];\n");
                case UTILITY -> sb.append("  ").append(safeName).append("{\"").append(label).append("\"};\n");
            }
        }

        // 2. Edges afterwards
        for (Arc arc : model.arcs()) {
            sb.append("  ").append(sanitize(arc.parent())).append(" --> ").append(sanitize(arc.child()))
                    .append(";\n");
        }
        return sb.toString();
    }

    private static String labelFor(GraphModel model, NodeDefinition n) {
        StringBuilder label = new StringBuilder(escape(n.id()));
        if (!n.states().isEmpty()) {
            label.append("<br/>").append(escape(String.join(" | ", n.states())));
        }
        double weight = model.weight(n.id());
        if (weight != 1.0) {
            label.append("<br/>w=").append(weight);
        }
        return label.toString();
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
