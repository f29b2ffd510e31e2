package com.pgm.xdsl;

import com.pgm.xdsl.api.CodeGenerator;
import com.pgm.xdsl.codegen.GeneratorTarget;
import com.pgm.xdsl.codegen.PyAgrumCodeGenerator;
import com.pgm.xdsl.io.XdslParser;
import com.pgm.xdsl.model.GraphModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry point for converting XDSL influence diagrams into code.
 * <p>
 * A converter holds at most one parsed model. Each successful
 * {@code parse(...)} replaces it entirely; a failed parse leaves the previous
 * model untouched and propagates the error unchanged.
 * <p>
 * Instances are not thread-safe. Use one converter per concurrent conversion.
 */
public class XdslConverter {
    private static final Logger log = LogManager.getLogger(XdslConverter.class);

    /** Returned by {@link #generateCode()} before any model was parsed. */
    public static final String NOTHING_TO_CONVERT = "# Nothing to convert";

    private final CodeGenerator generator;
    private final XdslParser parser = new XdslParser();
    private GraphModel model;

    /** Creates a converter that emits pyAgrum code. */
    public XdslConverter() {
        this(new PyAgrumCodeGenerator());
    }

    public XdslConverter(GeneratorTarget target) {
        this(target.create());
    }

    public XdslConverter(CodeGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    /** See {@link XdslParser#strictTableShapes(boolean)}. */
    public XdslConverter strictTableShapes(boolean strict) {
        parser.strictTableShapes(strict);
        return this;
    }

    /**
     * Parses an XDSL file given as a path string.
     *
     * @param path relative or absolute path to the XDSL file
     */
    public GraphModel parse(String path) {
        return parse(Path.of(path));
    }

    /** Parses an XDSL file. */
    public GraphModel parse(Path path) {
        log.info("Parsing XDSL file {}", path);
        return replaceModel(parser.parse(path));
    }

    /** Parses an XDSL document from a stream. The stream is not closed. */
    public GraphModel parse(InputStream in) {
        return replaceModel(parser.parse(in));
    }

    /**
     * Generates code for the current model.
     *
     * @return the generated text, or {@link #NOTHING_TO_CONVERT} if nothing
     *         has been parsed yet
     */
    public String generateCode() {
        if (model == null)
            return NOTHING_TO_CONVERT;
        String code = generator.generate(model);
        log.info("Generated {} characters with {}", code.length(), generator.getClass().getSimpleName());
        return code;
    }

    /** The current model, or null if nothing has been parsed. */
    public GraphModel getModel() {
        return model;
    }

    public CodeGenerator getGenerator() {
        return generator;
    }

    private GraphModel replaceModel(GraphModel parsed) {
        if (model != null)
            log.info("Replacing previously parsed model ({} nodes)", model.nodeCount());
        this.model = parsed;
        return parsed;
    }
}
