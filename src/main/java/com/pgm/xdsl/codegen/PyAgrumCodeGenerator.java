package com.pgm.xdsl.codegen;

import com.pgm.xdsl.api.CodeGenerator;
import com.pgm.xdsl.api.NodeKind;
import com.pgm.xdsl.model.Arc;
import com.pgm.xdsl.model.GraphModel;
import com.pgm.xdsl.model.NodeDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Emits Python statements that rebuild the model with pyAgrum's
 * {@code InfluenceDiagram} API.
 *
 * <p>
 * Output order is fixed: preamble, chance nodes, decision nodes, arcs, CPT
 * fills, then each utility node followed by its utility fill. Node ids are used
 * verbatim as Python identifiers.
 */
public final class PyAgrumCodeGenerator implements CodeGenerator {
    static final String DIAGRAM = "diag";

    @Override
    public String generate(GraphModel model) {
        List<String> code = new ArrayList<>();
        code.add("import pyAgrum as gum");
        code.add("");
        code.add("# Influence diagram");
        code.add(DIAGRAM + " = gum.InfluenceDiagram()");
        code.add("");

        appendVariableNodes(model, NodeKind.CHANCE, "addChanceNode", code);
        appendVariableNodes(model, NodeKind.DECISION, "addDecisionNode", code);
        appendArcs(model, code);
        appendCpts(model, code);
        appendUtilityNodes(model, code);

        return String.join("\n", code);
    }

    private static void appendVariableNodes(GraphModel model, NodeKind kind, String method, List<String> code) {
        for (NodeDefinition n : model.nodesOfKind(kind)) {
            code.add("# " + (kind == NodeKind.CHANCE ? "Chance" : "Decision") + " node " + n.id());
            code.add(n.id() + " = " + DIAGRAM + "." + method + "(gum.LabelizedVariable('" + n.id() + "', '"
                    + n.id() + "', " + quotedLabels(n.states()) + "))");
            code.add("");
        }
    }

    private static void appendArcs(GraphModel model, List<String> code) {
        code.add("# Arcs");
        for (Arc arc : model.arcs())
            code.add(DIAGRAM + ".addArc(" + arc.parent() + ", " + arc.child() + ")");
        code.add("");
    }

    private static void appendCpts(GraphModel model, List<String> code) {
        code.add("# Conditional probability tables");
        for (NodeDefinition n : model.nodesOfKind(NodeKind.CHANCE)) {
            List<Double> probs = model.probabilities(n.id());
            if (!probs.isEmpty())
                code.add(DIAGRAM + ".cpt(" + n.id() + ").fillWith(" + PythonLiterals.floatList(probs) + ")");
        }
        code.add("");
    }

    private static void appendUtilityNodes(GraphModel model, List<String> code) {
        for (NodeDefinition n : model.nodesOfKind(NodeKind.UTILITY)) {
            List<Double> utils = model.utilities(n.id());
            if (utils.isEmpty()) {
                // A fresh pyAgrum utility table holds zeros.
                utils = Collections.nCopies(model.tableSize(n.id()), 0.0);
            }
            code.add("# Utility node " + n.id());
            code.add(n.id() + " = " + DIAGRAM + ".addUtilityNode(gum.LabelizedVariable('" + n.id() + "', '"
                    + n.id() + "', 1))");
            code.add(DIAGRAM + ".utility(" + n.id() + ").fillWith(" + PythonLiterals.floatList(utils) + ")");
            code.add("");
        }
    }

    private static String quotedLabels(List<String> labels) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < labels.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append('"').append(labels.get(i)).append('"');
        }
        return sb.append(']').toString();
    }
}
