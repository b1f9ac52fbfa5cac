package com.legacyforms.analyzer.parser.extract;

import java.util.Locale;
import java.util.Set;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Captures the visible text of a label element: its own text plus the text of
 * inline emphasis children, whitespace collapsed.
 */
public class LabelTextExtractor {

    private static final Set<String> INLINE_TAGS = Set.of("strong", "em", "font", "span", "b", "i", "u");

    public String extract(Element element) {
        StringBuilder text = new StringBuilder();
        append(element, text);
        return NamingUtil.collapseWhitespace(text.toString());
    }

    private void append(Element element, StringBuilder text) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue()).append(' ');
            } else if (child instanceof Element inline
                    && INLINE_TAGS.contains(XmlNodeUtil.localName(inline).toLowerCase(Locale.ROOT))) {
                append(inline, text);
            }
        }
    }
}
