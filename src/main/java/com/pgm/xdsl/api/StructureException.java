package com.pgm.xdsl.api;

/**
 * The document is well-formed XML but does not describe a usable model, e.g.
 * the {@code nodes} container is missing.
 */
public class StructureException extends ConversionException {
    public StructureException(String message) {
        super(message);
    }
}
