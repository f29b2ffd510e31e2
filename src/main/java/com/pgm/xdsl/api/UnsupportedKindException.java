package com.pgm.xdsl.api;

import lombok.Getter;

/** Raised when a node is requested for a kind other than chance, decision or utility. */
@Getter
public class UnsupportedKindException extends ConversionException {
    private final String kind;

    public UnsupportedKindException(String kind) {
        super("Unsupported node kind: " + kind);
        this.kind = kind;
    }
}
