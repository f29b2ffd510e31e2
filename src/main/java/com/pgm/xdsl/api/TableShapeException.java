package com.pgm.xdsl.api;

import lombok.Getter;

/**
 * A probability or utility list whose length does not match the cardinality
 * of the node and its parents, raised when strict table shapes are on. Also
 * raised whenever a node's full table would be too large to index.
 */
@Getter
public class TableShapeException extends ConversionException {
    private final String nodeId;
    private final int expected;
    private final int actual;

    public TableShapeException(String nodeId, int expected, int actual) {
        super("Table for node " + nodeId + " has " + actual + " entries, expected " + expected);
        this.nodeId = nodeId;
        this.expected = expected;
        this.actual = actual;
    }

    private TableShapeException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
        this.expected = -1;
        this.actual = -1;
    }

    /** The full table of {@code nodeId} would have more than {@link Integer#MAX_VALUE} entries. */
    public static TableShapeException tooLarge(String nodeId) {
        return new TableShapeException(nodeId,
                "Table for node " + nodeId + " exceeds " + Integer.MAX_VALUE + " entries");
    }
}
