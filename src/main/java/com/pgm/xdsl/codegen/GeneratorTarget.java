package com.pgm.xdsl.codegen;

import com.pgm.xdsl.api.CodeGenerator;

import java.util.function.Supplier;

/**
 * Built-in generation targets, selectable by name.
 */
public enum GeneratorTarget {
    PYAGRUM(PyAgrumCodeGenerator::new, "py"),
    MERMAID(MermaidCodeGenerator::new, "mmd"),
    JSON(JsonModelGenerator::new, "json");

    private final Supplier<CodeGenerator> factory;
    private final String fileExtension;

    GeneratorTarget(Supplier<CodeGenerator> factory, String fileExtension) {
        this.factory = factory;
        this.fileExtension = fileExtension;
    }

    public CodeGenerator create() {
        return factory.get();
    }

    public String fileExtension() {
        return fileExtension;
    }

    public static GeneratorTarget fromString(String text) {
        for (GeneratorTarget t : GeneratorTarget.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown GeneratorTarget: " + text);
    }
}
