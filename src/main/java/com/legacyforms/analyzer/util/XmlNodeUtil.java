package com.legacyforms.analyzer.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

import javax.xml.XMLConstants;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Lenient DOM helpers for view markup. Element and attribute names are
 * matched by local name, ignoring case and namespace; a missing attribute
 * reads as the empty string.
 */
public class XmlNodeUtil {

    private XmlNodeUtil() {
        // Utility class
    }

    public static String localName(Node node) {
        String name = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    public static boolean isNamed(Element element, String... names) {
        String local = localName(element);
        for (String name : names) {
            if (local.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    public static String attr(Element element, String name) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            if (!isNamespaceDeclaration(attribute) && localName(attribute).equalsIgnoreCase(name)) {
                return attribute.getValue();
            }
        }
        return "";
    }

    public static boolean hasAttr(Element element, String name) {
        return !attr(element, name).isEmpty();
    }

    /**
     * Class-attribute check by substring, so {@code xdSection} also matches
     * compound values such as {@code xdSection xdOptional}.
     */
    public static boolean hasClass(Element element, String token) {
        return attr(element, "class").toLowerCase(Locale.ROOT).contains(token.toLowerCase(Locale.ROOT));
    }

    /**
     * Attributes of the element, without namespace declarations.
     */
    public static List<Attr> attributes(Element element) {
        NamedNodeMap map = element.getAttributes();
        List<Attr> result = new ArrayList<>(map.getLength());
        for (int i = 0; i < map.getLength(); i++) {
            Attr attribute = (Attr) map.item(i);
            if (!isNamespaceDeclaration(attribute)) {
                result.add(attribute);
            }
        }
        return result;
    }

    private static boolean isNamespaceDeclaration(Attr attribute) {
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())
                || attribute.getName().startsWith(XMLConstants.XMLNS_ATTRIBUTE);
    }

    public static List<Element> childElements(Element element) {
        List<Element> result = new ArrayList<>();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child) {
                result.add(child);
            }
        }
        return result;
    }

    public static Optional<Element> firstChildElement(Element element) {
        List<Element> children = childElements(element);
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * All descendant elements in document order, excluding the element itself.
     */
    public static List<Element> descendants(Element element) {
        List<Element> result = new ArrayList<>();
        collectDescendants(element, result);
        return result;
    }

    public static Optional<Element> firstDescendant(Element element, Predicate<Element> filter) {
        return descendants(element).stream().filter(filter).findFirst();
    }

    public static boolean anyDescendant(Element element, Predicate<Element> filter) {
        return firstDescendant(element, filter).isPresent();
    }

    public static Optional<Element> ancestor(Element element, String... names) {
        Node parent = element.getParentNode();
        while (parent instanceof Element candidate) {
            if (isNamed(candidate, names)) {
                return Optional.of(candidate);
            }
            parent = candidate.getParentNode();
        }
        return Optional.empty();
    }

    /**
     * Concatenated text of the element's own text children, ignoring nested elements.
     */
    public static String directText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        return text.toString();
    }

    public static String collapsedText(Element element) {
        return NamingUtil.collapseWhitespace(element.getTextContent());
    }

    private static void collectDescendants(Element element, List<Element> sink) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child) {
                sink.add(child);
                collectDescendants(child, sink);
            }
        }
    }
}
