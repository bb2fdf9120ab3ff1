package com.gnumeric.app.models;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Small set of DOM helpers for walking and editing a Gnumeric document.
 * Every lookup is namespace-qualified against {@link #NAMESPACE}.
 */
public final class GnumericXml {

    public static final String NAMESPACE = "http://www.gnumeric.org/v10.dtd";
    public static final String PREFIX = "gnm";

    private GnumericXml() {
    }

    /**
     * True if the node is an element named gnm:{localName}.
     */
    public static boolean isElement(Node node, String localName) {
        return node.getNodeType() == Node.ELEMENT_NODE
                && NAMESPACE.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    /**
     * First child element named gnm:{localName}, or null.
     */
    public static Element getChild(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (isElement(n, localName)) {
                return (Element) n;
            }
        }
        return null;
    }

    /**
     * All child elements named gnm:{localName}, in document order.
     */
    public static List<Element> getChildren(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (isElement(n, localName)) {
                result.add((Element) n);
            }
        }
        return result;
    }

    public static Element createElement(Document document, String localName) {
        return document.createElementNS(NAMESPACE, PREFIX + ":" + localName);
    }

    public static Element appendChild(Element parent, String localName) {
        Element child = createElement(parent.getOwnerDocument(), localName);
        parent.appendChild(child);
        return child;
    }

    /**
     * Unqualified attribute value, or null when the attribute is missing.
     */
    public static String getAttribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    /**
     * gnm-qualified attribute value, or null when the attribute is missing.
     */
    public static String getQualifiedAttribute(Element element, String localName) {
        return element.hasAttributeNS(NAMESPACE, localName) ? element.getAttributeNS(NAMESPACE, localName) : null;
    }

    public static void setQualifiedAttribute(Element element, String localName, String value) {
        element.setAttributeNS(NAMESPACE, PREFIX + ":" + localName, value);
    }

    public static int getIntAttribute(Element element, String name, int defaultValue) {
        String value = getAttribute(element, name);
        return value == null ? defaultValue : Integer.parseInt(value.trim());
    }

    /**
     * Text held by the element. An element without text (or with only an empty text node) yields null.
     */
    public static String getText(Element element) {
        if (!element.hasChildNodes()) {
            return null;
        }
        String text = element.getTextContent();
        return text.isEmpty() ? null : text;
    }

    /**
     * Replaces the element's content with the given text; null or "" leaves it without content.
     */
    public static void setText(Element element, String text) {
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
        if (text != null && !text.isEmpty()) {
            element.appendChild(element.getOwnerDocument().createTextNode(text));
        }
    }

    /**
     * Serialized form of a node, for diagnostics.
     */
    public static String toXml(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            return "<" + node.getNodeName() + "/>";
        }
    }
}
