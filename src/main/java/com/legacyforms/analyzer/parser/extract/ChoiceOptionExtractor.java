package com.legacyforms.analyzer.parser.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import com.legacyforms.analyzer.model.DataOption;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Reads the static choices of dropdowns, radio groups and checkbox groups.
 */
public class ChoiceOptionExtractor {

    /**
     * Options of a {@code select} element in document order. An option is the
     * default when it carries {@code selected}, either directly or through a
     * generated attribute.
     */
    public List<DataOption> fromSelect(Element select) {
        List<DataOption> options = new ArrayList<>();
        for (Element option : XmlNodeUtil.descendants(select)) {
            if (!XmlNodeUtil.isNamed(option, "option")) {
                continue;
            }
            String display = NamingUtil.collapseWhitespace(XmlNodeUtil.directText(option));
            String value = XmlNodeUtil.attr(option, "value");
            if (value.isEmpty() && display.isEmpty()) {
                continue;
            }
            options.add(DataOption.builder()
                    .value(value.isEmpty() ? display : value)
                    .displayText(display.isEmpty() ? value : display)
                    .order(options.size())
                    .defaultOption(isSelected(option))
                    .build());
        }
        return options;
    }

    /**
     * Options of the radio group {@code radio} belongs to: same-name inputs
     * under the nearest {@code div} or {@code td}.
     */
    public List<DataOption> fromRadioGroup(Element radio) {
        return fromPeerGroup(radio, "radio");
    }

    /**
     * Options of a checkbox group. A checkbox with no same-name peer is a
     * plain on/off field and yields no options.
     */
    public List<DataOption> fromCheckboxGroup(Element checkbox) {
        List<DataOption> options = fromPeerGroup(checkbox, "checkbox");
        return options.size() > 1 ? options : List.of();
    }

    private List<DataOption> fromPeerGroup(Element input, String inputType) {
        String groupKey = groupKey(input);
        if (groupKey.isEmpty()) {
            return List.of();
        }
        Element scope = XmlNodeUtil.ancestor(input, "div", "td")
                .orElse(input.getParentNode() instanceof Element parent ? parent : input);

        List<DataOption> options = new ArrayList<>();
        for (Element peer : XmlNodeUtil.descendants(scope)) {
            if (!XmlNodeUtil.isNamed(peer, "input") || !inputType.equalsIgnoreCase(XmlNodeUtil.attr(peer, "type"))) {
                continue;
            }
            if (!groupKey.equals(groupKey(peer))) {
                continue;
            }
            String value = NamingUtil.firstNonBlank(XmlNodeUtil.attr(peer, "value"), XmlNodeUtil.attr(peer, "onValue"));
            if (value == null) {
                continue;
            }
            options.add(DataOption.builder()
                    .value(value)
                    .displayText(peerLabel(peer, scope).orElse(value))
                    .order(options.size())
                    .defaultOption(XmlNodeUtil.hasAttr(peer, "checked"))
                    .build());
        }
        return options;
    }

    private static String groupKey(Element input) {
        String binding = XmlNodeUtil.attr(input, "binding");
        return binding.isEmpty() ? XmlNodeUtil.attr(input, "name") : binding;
    }

    private static Optional<String> peerLabel(Element input, Element scope) {
        String id = XmlNodeUtil.attr(input, "id");
        if (!id.isEmpty()) {
            Optional<String> forLabel = XmlNodeUtil.descendants(scope).stream()
                    .filter(e -> XmlNodeUtil.isNamed(e, "label") && id.equals(XmlNodeUtil.attr(e, "for")))
                    .map(XmlNodeUtil::collapsedText)
                    .filter(text -> !text.isEmpty())
                    .findFirst();
            if (forLabel.isPresent()) {
                return forLabel;
            }
        }
        Node next = input.getNextSibling();
        while (next != null && next.getNodeType() != Node.ELEMENT_NODE) {
            if (next.getNodeType() == Node.TEXT_NODE && !NamingUtil.isBlank(next.getNodeValue())) {
                return Optional.of(NamingUtil.collapseWhitespace(next.getNodeValue()));
            }
            next = next.getNextSibling();
        }
        return Optional.empty();
    }

    private static boolean isSelected(Element option) {
        if (XmlNodeUtil.hasAttr(option, "selected")) {
            return true;
        }
        return XmlNodeUtil.descendants(option).stream()
                .anyMatch(e -> XmlNodeUtil.isNamed(e, "attribute")
                        && "selected".equalsIgnoreCase(XmlNodeUtil.attr(e, "name")));
    }
}
