package com.legacyforms.analyzer.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.w3c.dom.Element;

import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Lookup of moded template blocks by mode name. The first block declared for
 * a mode wins.
 */
public class TemplateIndex {

    private TemplateIndex() {
        // Utility class
    }

    public static Map<String, Element> byMode(Element root) {
        Map<String, Element> templates = new LinkedHashMap<>();
        for (Element element : XmlNodeUtil.descendants(root)) {
            if (XmlNodeUtil.isNamed(element, "template")) {
                String mode = XmlNodeUtil.attr(element, "mode");
                if (!mode.isEmpty()) {
                    templates.putIfAbsent(mode, element);
                }
            }
        }
        return templates;
    }

    /**
     * Select of the first looping construct inside a block, if it has one.
     */
    public static Optional<String> firstLoopSelect(Element block) {
        return XmlNodeUtil.firstDescendant(block, e -> XmlNodeUtil.isNamed(e, "for-each"))
                .map(loop -> XmlNodeUtil.attr(loop, "select"));
    }
}
