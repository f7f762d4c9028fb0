package com.eyelevel.invoicetransformer.common.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-tolerant navigation helpers over DOM elements. Children are matched by local name so the source
 * format is read the same way with or without a default namespace.
 */
public final class XmlElements {

    private XmlElements() {
    }

    public static String localName(final Node node) {
        final String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    /**
     * Returns the first child element with the given local name.
     */
    public static Optional<Element> child(final Element parent, final String name) {
        if (parent == null) {
            return Optional.empty();
        }
        final NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            final Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                return Optional.of((Element) node);
            }
        }
        return Optional.empty();
    }

    /**
     * Follows a path of child names, e.g. {@code path(invoice, "Dates", "InvoiceDate")}.
     */
    public static Optional<Element> path(final Element start, final String... names) {
        Optional<Element> current = Optional.ofNullable(start);
        for (final String name : names) {
            current = current.flatMap(element -> child(element, name));
        }
        return current;
    }

    /**
     * Returns all child elements with the given local name, in document order.
     */
    public static List<Element> children(final Element parent, final String name) {
        final List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        final NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            final Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Returns the attribute value, or {@code null} when the element or the attribute is absent.
     */
    public static String attribute(final Element element, final String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    public static String attribute(final Optional<Element> element, final String name) {
        return attribute(element.orElse(null), name);
    }
}
