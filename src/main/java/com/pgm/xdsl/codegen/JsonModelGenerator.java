package com.pgm.xdsl.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgm.xdsl.api.CodeGenerator;
import com.pgm.xdsl.model.Arc;
import com.pgm.xdsl.model.GraphModel;
import com.pgm.xdsl.model.NodeDefinition;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Dumps the whole model (nodes, arcs, tables and MAU weights) as pretty-printed
 * JSON.
 */
public final class JsonModelGenerator implements CodeGenerator {
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String generate(GraphModel model) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(model));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize model", e);
        }
    }

    static ModelDocument toDocument(GraphModel model) {
        List<ModelDocument.NodeDoc> nodes = new ArrayList<>(model.nodeCount());
        for (NodeDefinition n : model.nodes()) {
            ModelDocument.NodeDoc doc = new ModelDocument.NodeDoc();
            doc.setId(n.id());
            doc.setKind(n.kind().name());
            doc.setStates(n.states());
            doc.setParents(model.parentsOf(n.id()));
            doc.setProbabilities(model.probabilities(n.id()));
            doc.setUtilities(model.utilities(n.id()));
            nodes.add(doc);
        }

        List<ModelDocument.ArcDoc> arcs = new ArrayList<>(model.arcs().size());
        for (Arc a : model.arcs()) {
            ModelDocument.ArcDoc doc = new ModelDocument.ArcDoc();
            doc.setParent(a.parent());
            doc.setChild(a.child());
            arcs.add(doc);
        }

        ModelDocument document = new ModelDocument();
        document.setNodes(nodes);
        document.setArcs(arcs);
        document.setWeights(new LinkedHashMap<>(model.weights()));
        return document;
    }
}
