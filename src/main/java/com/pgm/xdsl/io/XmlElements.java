package com.pgm.xdsl.io;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Small DOM helpers for walking XDSL elements.
 */
final class XmlElements {
    // Unicode White_Space, so NBSP and friends separate tokens too.
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private XmlElements() {
    }

    /** First descendant (not the element itself) with the given tag, in document order. */
    static Element firstDescendant(Element parent, String tag) {
        NodeList list = parent.getElementsByTagName(tag);
        return list.getLength() == 0 ? null : (Element) list.item(0);
    }

    /** Immediate element children, in document order. */
    static List<Element> children(Element parent) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE)
                out.add((Element) n);
        }
        return out;
    }

    /** Immediate element children with the given tag, in document order. */
    static List<Element> children(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element e : children(parent)) {
            if (e.getTagName().equals(tag))
                out.add(e);
        }
        return out;
    }

    /** First immediate child with the given tag, or null. */
    static Element child(Element parent, String tag) {
        for (Element e : children(parent)) {
            if (e.getTagName().equals(tag))
                return e;
        }
        return null;
    }

    /** Attribute value, or null when the attribute is absent or empty. */
    static String attribute(Element e, String name) {
        if (!e.hasAttribute(name))
            return null;
        String v = e.getAttribute(name);
        return v.isEmpty() ? null : v;
    }

    /**
     * Whitespace-separated tokens of the named child's text. Returns an empty
     * list when the child is missing or blank.
     */
    static List<String> tokens(Element parent, String tag) {
        Element e = child(parent, tag);
        if (e == null)
            return List.of();
        List<String> out = new ArrayList<>();
        for (String token : WHITESPACE.split(e.getTextContent())) {
            if (!token.isEmpty())
                out.add(token);
        }
        return out;
    }
}
