package com.legacyforms.analyzer.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.DynamicSection;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Finds template blocks whose whole content is guarded by one field
 * comparison and records which controls that field shows or hides.
 * <p>
 * Runs over the raw view tree, independently of {@link ViewParser}. Blocks
 * containing a loop belong to repeating classification and are ignored here.
 */
public class DynamicSectionExtractor {
    private static final Logger log = LoggerFactory.getLogger(DynamicSectionExtractor.class);

    /** {@code prefix:name} not followed by a call parenthesis. */
    private static final Pattern FIELD_REFERENCE =
            Pattern.compile("(?<![\\w:.-])[A-Za-z_][\\w-]*:([A-Za-z_][\\w.-]*+)(?!\\s*\\()");
    private static final Pattern CONTAINS_LITERAL =
            Pattern.compile("contains\\([^,]+,\\s*[\"']([^\"']+)[\"']\\s*\\)");
    private static final Pattern EQUALITY_LITERAL =
            Pattern.compile("!?=\\s*[\"']([^\"']*)[\"']");

    public List<DynamicSection> extract(Element root) {
        Map<String, Element> templates = TemplateIndex.byMode(root);
        Set<String> seenModes = new HashSet<>();
        List<DynamicSection> sections = new ArrayList<>();

        for (Element element : XmlNodeUtil.descendants(root)) {
            if (!XmlNodeUtil.isNamed(element, "apply-templates")) {
                continue;
            }
            String mode = XmlNodeUtil.attr(element, "mode");
            if (mode.isEmpty() || !seenModes.add(mode)) {
                continue;
            }
            Element block = templates.get(mode);
            if (block == null) {
                continue;
            }
            guardedSection(mode, block).ifPresent(sections::add);
        }

        log.debug("Found {} dynamic sections", sections.size());
        return sections;
    }

    private Optional<DynamicSection> guardedSection(String mode, Element block) {
        Optional<Element> first = XmlNodeUtil.firstChildElement(block);
        if (first.isEmpty() || !XmlNodeUtil.isNamed(first.get(), "if")) {
            return Optional.empty();
        }
        if (TemplateIndex.firstLoopSelect(block).isPresent()) {
            return Optional.empty();
        }

        Element guard = first.get();
        String condition = XmlNodeUtil.attr(guard, "test");
        Element region = regionOf(guard);

        List<String> controlIds = new ArrayList<>();
        for (Element descendant : XmlNodeUtil.descendants(region)) {
            String ctrlId = XmlNodeUtil.attr(descendant, ControlDefinition.CTRL_ID);
            if (!ctrlId.isEmpty() && !controlIds.contains(ctrlId)) {
                controlIds.add(ctrlId);
            }
        }

        String regionId = XmlNodeUtil.attr(region, ControlDefinition.CTRL_ID);
        return Optional.of(DynamicSection.builder()
                .mode(mode)
                .condition(condition)
                .conditionField(drivingField(condition))
                .conditionValue(comparedLiteral(condition))
                .ctrlId(regionId.isEmpty() ? null : regionId)
                .caption(NamingUtil.firstNonBlank(XmlNodeUtil.attr(region, "caption_0"),
                        XmlNodeUtil.attr(region, "caption")))
                .controlIds(controlIds)
                .build());
    }

    /**
     * The guarded region: an element with a stable id and a caption, else the
     * first element with a stable id, else the guard itself.
     */
    private static Element regionOf(Element guard) {
        return XmlNodeUtil.firstDescendant(guard, e -> XmlNodeUtil.hasAttr(e, ControlDefinition.CTRL_ID)
                        && (XmlNodeUtil.hasAttr(e, "caption_0") || XmlNodeUtil.hasAttr(e, "caption")))
                .or(() -> XmlNodeUtil.firstDescendant(guard, e -> XmlNodeUtil.hasAttr(e, ControlDefinition.CTRL_ID)))
                .orElse(guard);
    }

    public static String drivingField(String condition) {
        if (condition == null) {
            return null;
        }
        Matcher matcher = FIELD_REFERENCE.matcher(condition);
        return matcher.find() ? matcher.group(1) : null;
    }

    public static String comparedLiteral(String condition) {
        if (condition == null) {
            return null;
        }
        Matcher contains = CONTAINS_LITERAL.matcher(condition);
        if (contains.find()) {
            return contains.group(1);
        }
        Matcher equality = EQUALITY_LITERAL.matcher(condition);
        return equality.find() ? equality.group(1) : null;
    }
}
