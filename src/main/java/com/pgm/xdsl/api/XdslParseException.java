package com.pgm.xdsl.api;

/**
 * The input could not be read or is not well-formed XML.
 */
public class XdslParseException extends ConversionException {
    public XdslParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
