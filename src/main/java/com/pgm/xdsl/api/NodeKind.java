package com.pgm.xdsl.api;

/**
 * The node kinds an influence diagram is built from.
 */
public enum NodeKind {
    CHANCE("cpt"),
    DECISION("decision"),
    UTILITY("utility");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /** The XDSL element tag that declares a node of this kind. */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a kind from either its XDSL tag ("cpt") or its name ("chance").
     *
     * @throws UnsupportedKindException if the text names no supported kind
     */
    public static NodeKind fromString(String text) {
        for (NodeKind k : NodeKind.values()) {
            if (k.tag.equalsIgnoreCase(text) || k.name().equalsIgnoreCase(text)) {
                return k;
            }
        }
        throw new UnsupportedKindException(text);
    }
}
