package com.pgm.xdsl.io;

import com.pgm.xdsl.api.NodeKind;

/**
 * Element tags recognised directly under the XDSL {@code nodes} container.
 */
public enum ElementType {
    CPT("cpt", NodeKind.CHANCE),
    DECISION("decision", NodeKind.DECISION),
    UTILITY("utility", NodeKind.UTILITY),
    // Multi-attribute utility: contributes weights only, never a node.
    MAU("mau", null);

    private final String tag;
    private final NodeKind nodeKind;

    ElementType(String tag, NodeKind nodeKind) {
        this.tag = tag;
        this.nodeKind = nodeKind;
    }

    public String tag() {
        return tag;
    }

    /** Kind of node this element declares, or {@code null} for MAU. */
    public NodeKind nodeKind() {
        return nodeKind;
    }

    public boolean declaresNode() {
        return nodeKind != null;
    }

    /**
     * Looks up an element type by its exact tag.
     *
     * @return the type, or {@code null} if the tag is not part of the dialect
     */
    public static ElementType fromTag(String tag) {
        for (ElementType t : ElementType.values()) {
            if (t.tag.equals(tag)) {
                return t;
            }
        }
        return null;
    }
}
