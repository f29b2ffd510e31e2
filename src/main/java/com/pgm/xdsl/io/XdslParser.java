package com.pgm.xdsl.io;

import com.pgm.xdsl.api.NodeKind;
import com.pgm.xdsl.api.StructureException;
import com.pgm.xdsl.api.TableShapeException;
import com.pgm.xdsl.api.XdslParseException;
import com.pgm.xdsl.model.GraphModel;
import com.pgm.xdsl.model.NodeDefinition;
import lombok.extern.log4j.Log4j2;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an XDSL document into a {@link GraphModel}.
 *
 * <p>
 * The children of the first {@code nodes} element are walked twice:
 * <ol>
 * <li><b>Pass 1</b> creates one node per {@code cpt}, {@code decision} and
 * {@code utility} element and collects {@code mau} weights.</li>
 * <li><b>Pass 2</b> resolves {@code parents} lists into arcs and fills the
 * probability and utility tables. Since every node already exists, parents
 * may be declared after their children.</li>
 * </ol>
 *
 * <p>
 * Elements without an id and parent references to unknown ids are skipped
 * without error. Tags outside the dialect never create nodes, but if their id
 * matches a registered node their {@code parents} still become arcs.
 *
 * <p>
 * Not thread-safe; use one parser per thread.
 */
@Log4j2
public final class XdslParser {
    static final String NODES = "nodes";
    static final String STATE = "state";
    static final String PARENTS = "parents";
    static final String PROBABILITIES = "probabilities";
    static final String UTILITIES = "utilities";
    static final String WEIGHTS = "weights";
    static final String ID = "id";

    private boolean strictTableShapes;

    /**
     * When enabled, every probability and utility list must have exactly
     * {@link GraphModel#tableSize(String)} entries.
     */
    public XdslParser strictTableShapes(boolean strict) {
        this.strictTableShapes = strict;
        return this;
    }

    public boolean isStrictTableShapes() {
        return strictTableShapes;
    }

    /** Parses an XDSL file. */
    public GraphModel parse(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(readDocument(new InputSource(in), path.toString()));
        } catch (IOException e) {
            throw new XdslParseException("Failed to read XDSL file " + path, e);
        }
    }

    /** Parses an XDSL document from a stream. The stream is not closed. */
    public GraphModel parse(InputStream in) {
        return parse(readDocument(new InputSource(in), "stream"));
    }

    /** Parses an in-memory XDSL document. */
    public GraphModel parseString(String xml) {
        return parse(readDocument(new InputSource(new StringReader(xml)), "string"));
    }

    /** Extracts the model from an already loaded document. */
    public GraphModel parse(Document doc) {
        Element container = XmlElements.firstDescendant(doc.getDocumentElement(), NODES);
        if (container == null)
            throw new StructureException("Invalid XDSL structure: element '" + NODES + "' not found");

        List<Element> elements = XmlElements.children(container);
        GraphModel.Builder builder = GraphModel.builder();

        for (Element e : elements)
            createNode(builder, e);

        for (Element e : elements)
            addArcsAndTables(builder, e);

        GraphModel model = builder.build();
        if (strictTableShapes)
            verifyTableShapes(model);

        log.info("Parsed XDSL model: {} nodes, {} arcs, {} probability tables, {} utility tables, {} weights",
                model.nodeCount(), model.arcs().size(),
                countTables(model, NodeKind.CHANCE), countTables(model, NodeKind.UTILITY),
                model.weights().size());
        return model;
    }

    // ── Pass 1 ──────────────────────────────────────────────────────

    private void createNode(GraphModel.Builder builder, Element e) {
        String id = XmlElements.attribute(e, ID);
        if (id == null) {
            log.debug("Skipping <{}> without id", e.getTagName());
            return;
        }

        ElementType type = ElementType.fromTag(e.getTagName());
        if (type == null) {
            log.debug("Ignoring unrecognised element <{}> id={}", e.getTagName(), id);
            return;
        }

        if (type == ElementType.MAU) {
            collectWeights(builder, e);
            return;
        }

        NodeFactory.createNode(builder, type.nodeKind(), id, readStates(e, id));
    }

    private static List<String> readStates(Element e, String nodeId) {
        List<String> states = new ArrayList<>();
        for (Element s : XmlElements.children(e, STATE)) {
            String label = XmlElements.attribute(s, ID);
            if (label == null)
                throw new StructureException("State without id in node " + nodeId);
            states.add(label);
        }
        return states;
    }

    private static void collectWeights(GraphModel.Builder builder, Element mau) {
        List<String> parents = XmlElements.tokens(mau, PARENTS);
        List<String> weights = XmlElements.tokens(mau, WEIGHTS);
        int n = Math.min(parents.size(), weights.size());
        for (int i = 0; i < n; i++) {
            builder.putWeight(parents.get(i), Double.parseDouble(weights.get(i)));
        }
        if (parents.size() != weights.size())
            log.debug("MAU {} pairs {} parents with {} weights; extra entries dropped",
                    XmlElements.attribute(mau, ID), parents.size(), weights.size());
    }

    // ── Pass 2 ──────────────────────────────────────────────────────

    private void addArcsAndTables(GraphModel.Builder builder, Element e) {
        String id = XmlElements.attribute(e, ID);
        if (id == null || !builder.contains(id))
            return;

        // Any element carrying a registered id contributes arcs, whatever its tag.
        for (String parent : XmlElements.tokens(e, PARENTS)) {
            if (builder.contains(parent)) {
                builder.addArc(parent, id);
            } else {
                log.debug("Skipping arc {} -> {}: unknown parent", parent, id);
            }
        }

        // Tables only come from the element that declared the node.
        ElementType type = ElementType.fromTag(e.getTagName());
        if (type == null || type.nodeKind() != builder.kind(id))
            return;

        if (type == ElementType.CPT) {
            List<String> tokens = XmlElements.tokens(e, PROBABILITIES);
            if (!tokens.isEmpty())
                builder.setProbabilities(id, parseDoubles(tokens, 1.0));
        } else if (type == ElementType.UTILITY) {
            List<String> tokens = XmlElements.tokens(e, UTILITIES);
            if (!tokens.isEmpty())
                builder.setUtilities(id, parseDoubles(tokens, builder.weight(id)));
        }
    }

    private static List<Double> parseDoubles(List<String> tokens, double scale) {
        List<Double> out = new ArrayList<>(tokens.size());
        for (String t : tokens)
            out.add(Double.parseDouble(t) * scale);
        return out;
    }

    // ── Validation ──────────────────────────────────────────────────

    private static void verifyTableShapes(GraphModel model) {
        for (NodeDefinition n : model.nodes()) {
            List<Double> table = switch (n.kind()) {
                case CHANCE -> model.probabilities(n.id());
                case UTILITY -> model.utilities(n.id());
                case DECISION -> List.of();
            };
            if (table.isEmpty())
                continue;
            int expected = model.tableSize(n.id());
            if (table.size() != expected)
                throw new TableShapeException(n.id(), expected, table.size());
        }
    }

    private static long countTables(GraphModel model, NodeKind kind) {
        return model.nodesOfKind(kind).stream()
                .filter(n -> kind == NodeKind.CHANCE
                        ? !model.probabilities(n.id()).isEmpty()
                        : !model.utilities(n.id()).isEmpty())
                .count();
    }

    // ── XML loading ─────────────────────────────────────────────────

    private static Document readDocument(InputSource source, String description) {
        try {
            DocumentBuilder db = newDocumentBuilder();
            return db.parse(source);
        } catch (SAXException | IOException e) {
            throw new XdslParseException("Malformed XDSL document (" + description + "): " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            dbf.setExpandEntityReferences(false);
            DocumentBuilder db = dbf.newDocumentBuilder();
            db.setErrorHandler(RETHROWING_HANDLER);
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    // The JDK default handler prints fatal errors to stderr before throwing.
    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.warn("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };
}
