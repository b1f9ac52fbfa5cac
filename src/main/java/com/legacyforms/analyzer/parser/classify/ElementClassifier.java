package com.legacyforms.analyzer.parser.classify;

import java.util.Locale;
import java.util.Set;

import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.parser.extract.LabelTextExtractor;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Maps one markup element to the role it plays in the view. Rules are tried
 * in a fixed order and the first match wins; anything unrecognized is a
 * pass-through container.
 */
public class ElementClassifier {

    private static final Set<String> LABEL_TAGS = Set.of(
            "strong", "b", "em", "i", "font", "label", "h1", "h2", "h3", "h4", "h5", "h6");

    private static final Set<String> INTERACTIVE_TAGS = Set.of("input", "select", "textarea", "object");

    private final ControlTypeMapper typeMapper;
    private final LabelTextExtractor labelTextExtractor;

    public ElementClassifier() {
        this(new ControlTypeMapper(), new LabelTextExtractor());
    }

    public ElementClassifier(ControlTypeMapper typeMapper, LabelTextExtractor labelTextExtractor) {
        this.typeMapper = typeMapper;
        this.labelTextExtractor = labelTextExtractor;
    }

    public ElementClassification classify(Element element) {
        if (isInsertionPlaceholder(element)) {
            return ElementClassification.passThrough();
        }
        if (XmlNodeUtil.isNamed(element, "apply-templates") && XmlNodeUtil.hasAttr(element, "mode")) {
            return ElementClassification.indirection(XmlNodeUtil.attr(element, "mode"),
                    XmlNodeUtil.attr(element, "select"));
        }
        if (XmlNodeUtil.isNamed(element, "template")) {
            String mode = XmlNodeUtil.attr(element, "mode");
            return mode.isEmpty() ? ElementClassification.passThrough() : ElementClassification.templateDefinition(mode);
        }

        String controlKind = XmlNodeUtil.attr(element, "xctname");
        if (!controlKind.isEmpty() && !typeMapper.isStructuralKind(controlKind)) {
            return ElementClassification.boundControl(typeMapper.fromControlKind(controlKind));
        }
        if (isRepeatingTable(element)) {
            return ElementClassification.of(ElementKind.REPEATING_TABLE);
        }
        if (isRepeatingSection(element)) {
            return ElementClassification.of(ElementKind.REPEATING_SECTION);
        }
        if (isPlainSection(element)) {
            return ElementClassification.of(ElementKind.PLAIN_SECTION);
        }
        if (isLabel(element)) {
            return ElementClassification.of(ElementKind.LABEL);
        }
        if (XmlNodeUtil.isNamed(element, "input")) {
            return ElementClassification.boundControl(typeMapper.fromInputType(XmlNodeUtil.attr(element, "type")));
        }
        if (XmlNodeUtil.isNamed(element, "select")) {
            return ElementClassification.boundControl(ControlTypes.DROP_DOWN);
        }
        if (XmlNodeUtil.isNamed(element, "textarea")) {
            return ElementClassification.boundControl(ControlTypes.RICH_TEXT);
        }
        if (XmlNodeUtil.isNamed(element, "object")) {
            return ElementClassification.boundControl(typeMapper.fromObjectClassId(XmlNodeUtil.attr(element, "classid")));
        }
        if (XmlNodeUtil.hasAttr(element, "binding")) {
            return ElementClassification.boundControl(typeMapper.fromHints(element));
        }
        return ElementClassification.passThrough();
    }

    /**
     * Layout hints that start a new grid row.
     */
    public boolean isRowBoundary(Element element) {
        if (XmlNodeUtil.isNamed(element, "tr", "hr")) {
            return true;
        }
        if (XmlNodeUtil.isNamed(element, "div")
                && (XmlNodeUtil.hasClass(element, "xdSection") || XmlNodeUtil.hasClass(element, "xdRepeatingSection"))) {
            return true;
        }
        if (XmlNodeUtil.isNamed(element, "td", "th") && parseInt(XmlNodeUtil.attr(element, "colspan")) > 2) {
            return true;
        }
        if (XmlNodeUtil.isNamed(element, "img")
                && XmlNodeUtil.attr(element, "src").toLowerCase(Locale.ROOT).contains("line")) {
            return true;
        }
        if (XmlNodeUtil.hasClass(element, "xdTableHeader") || XmlNodeUtil.hasClass(element, "xdHeadingRow")
                || XmlNodeUtil.hasClass(element, "xdTitleRow")) {
            return true;
        }
        return hasHeavyTopBorder(XmlNodeUtil.attr(element, "style"));
    }

    public boolean isInsertionPlaceholder(Element element) {
        return XmlNodeUtil.hasClass(element, "optionalPlaceholder")
                || XmlNodeUtil.attr(element, "action").toLowerCase(Locale.ROOT).contains("xcollection::insert");
    }

    public boolean isRepeatingTable(Element element) {
        if (!XmlNodeUtil.isNamed(element, "table")) {
            return false;
        }
        if (XmlNodeUtil.hasClass(element, "xdRepeatingTable")
                || "repeatingtable".equalsIgnoreCase(XmlNodeUtil.attr(element, "xctname"))) {
            return true;
        }
        return XmlNodeUtil.childElements(element).stream()
                .filter(child -> XmlNodeUtil.isNamed(child, "tbody"))
                .anyMatch(body -> XmlNodeUtil.hasAttr(body, "repeating")
                        || "repeatingtable".equalsIgnoreCase(XmlNodeUtil.attr(body, "xctname")));
    }

    public boolean isRepeatingSection(Element element) {
        if (XmlNodeUtil.hasClass(element, "xdRepeatingSection")
                || "repeatingsection".equalsIgnoreCase(XmlNodeUtil.attr(element, "xctname"))) {
            return true;
        }
        return XmlNodeUtil.childElements(element).stream()
                .filter(child -> XmlNodeUtil.isNamed(child, "apply-templates") && XmlNodeUtil.hasAttr(child, "mode"))
                .anyMatch(child -> NamingUtil.pathSegments(XmlNodeUtil.attr(child, "select")).size() >= 2);
    }

    public boolean isPlainSection(Element element) {
        String controlKind = XmlNodeUtil.attr(element, "xctname");
        if ("section".equalsIgnoreCase(controlKind) || "optionalsection".equalsIgnoreCase(controlKind)) {
            return true;
        }
        return XmlNodeUtil.hasClass(element, "xdSection") && !XmlNodeUtil.hasClass(element, "xdRepeating");
    }

    public boolean isLabel(Element element) {
        if (!LABEL_TAGS.contains(XmlNodeUtil.localName(element).toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (XmlNodeUtil.hasAttr(element, "binding")) {
            return false;
        }
        boolean interactive = XmlNodeUtil.anyDescendant(element, d -> XmlNodeUtil.hasAttr(d, "xctname")
                || XmlNodeUtil.hasAttr(d, "binding")
                || INTERACTIVE_TAGS.contains(XmlNodeUtil.localName(d).toLowerCase(Locale.ROOT)));
        if (interactive) {
            return false;
        }
        if (NamingUtil.isBlank(XmlNodeUtil.directText(element))) {
            return false;
        }
        return labelTextExtractor.extract(element).length() > 1;
    }

    private static boolean hasHeavyTopBorder(String style) {
        String normalized = style.toLowerCase(Locale.ROOT).replace(" ", "");
        if (!normalized.contains("border-top") || !normalized.contains("solid")) {
            return false;
        }
        return normalized.contains("2.25pt") || normalized.contains("2pt") || normalized.contains("3pt");
    }

    private static int parseInt(String value) {
        try {
            return value.isBlank() ? 0 : Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
