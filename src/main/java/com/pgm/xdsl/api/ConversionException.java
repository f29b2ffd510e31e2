package com.pgm.xdsl.api;

/**
 * Base class of the errors raised while converting an XDSL document.
 */
public class ConversionException extends RuntimeException {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
