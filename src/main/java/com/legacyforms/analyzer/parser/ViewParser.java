package com.legacyforms.analyzer.parser;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.SectionInfo;
import com.legacyforms.analyzer.model.SectionKind;
import com.legacyforms.analyzer.model.ViewDefinition;
import com.legacyforms.analyzer.parser.classify.ElementClassification;
import com.legacyforms.analyzer.parser.classify.ElementClassifier;
import com.legacyforms.analyzer.parser.classify.IndirectionClassifier;
import com.legacyforms.analyzer.parser.classify.IndirectionDecision;
import com.legacyforms.analyzer.parser.context.RepeatingContext;
import com.legacyforms.analyzer.parser.context.SectionContext;
import com.legacyforms.analyzer.parser.context.ViewParseState;
import com.legacyforms.analyzer.parser.extract.ControlExtractor;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Recursive walk over one view template that produces its ordered control
 * list and section list.
 *
 * Parsing only:
 * - Classifies elements and materializes labels and bound controls
 * - Tracks grid coordinates and the section / repeating context stack
 * - Resolves template-mode indirections once per mode
 *
 * It does NOT pair labels with controls, merge label fragments or fold columns.
 * Parsing never throws on unexpected markup; unknown elements are passed through.
 */
public class ViewParser {
    private static final Logger log = LoggerFactory.getLogger(ViewParser.class);

    private static final String DEFAULT_SECTION_NAME = "Section";
    private static final String DEFAULT_TABLE_NAME = "RepeatingTable";

    private final ElementClassifier classifier;
    private final ControlExtractor extractor;
    private final IndirectionClassifier indirectionClassifier;

    public ViewParser() {
        this(new ElementClassifier(), new ControlExtractor(), new IndirectionClassifier());
    }

    public ViewParser(ElementClassifier classifier, ControlExtractor extractor,
            IndirectionClassifier indirectionClassifier) {
        this.classifier = classifier;
        this.extractor = extractor;
        this.indirectionClassifier = indirectionClassifier;
    }

    public ViewDefinition parse(String viewName, Document document) {
        return parse(viewName, document.getDocumentElement());
    }

    public ViewDefinition parse(String viewName, Element root) {
        ViewParseState state = new ViewParseState(TemplateIndex.byMode(root));

        if (XmlNodeUtil.isNamed(root, "stylesheet", "transform")) {
            // Entry templates first so indirections are resolved from their callers.
            List<Element> templates = XmlNodeUtil.childElements(root);
            templates.stream()
                    .filter(t -> XmlNodeUtil.isNamed(t, "template") && !XmlNodeUtil.hasAttr(t, "mode"))
                    .forEach(t -> walk(t, state));
            templates.stream()
                    .filter(t -> !(XmlNodeUtil.isNamed(t, "template") && !XmlNodeUtil.hasAttr(t, "mode")))
                    .forEach(t -> walk(t, state));
        } else {
            walk(root, state);
        }

        log.debug("Parsed view {}: {} controls, {} sections, {} template modes",
                viewName, state.getControls().size(), state.getSections().size(), state.getVisitedModes().size());

        return ViewDefinition.builder()
                .viewName(viewName)
                .controls(state.getControls())
                .sections(state.getSections())
                .build();
    }

    private void walk(Element element, ViewParseState state) {
        if (classifier.isRowBoundary(element)) {
            state.rowBoundary();
        }

        ElementClassification classification = classifier.classify(element);
        switch (classification.kind()) {
            case LABEL -> materialize(extractor.label(element), state);
            case BOUND_CONTROL -> materialize(extractor.boundControl(element, classification.controlType()), state);
            case PLAIN_SECTION -> plainSection(element, state);
            case REPEATING_SECTION -> repeatingSection(element, state);
            case REPEATING_TABLE -> repeatingTable(element, state);
            case TEMPLATE_INDIRECTION -> indirection(classification.mode(), classification.select(), state);
            case TEMPLATE_DEFINITION -> templateDefinition(element, classification.mode(), state);
            default -> walkChildren(element, state);
        }
    }

    private void walkChildren(Element element, ViewParseState state) {
        Runnable body = () -> {
            for (Element child : XmlNodeUtil.childElements(element)) {
                walk(child, state);
            }
        };
        if (XmlNodeUtil.isNamed(element, "for-each")) {
            state.withSelect(XmlNodeUtil.attr(element, "select"), body);
        } else {
            body.run();
        }
    }

    private void materialize(ControlDefinition control, ViewParseState state) {
        if (!state.claimStableId(control.stableId())) {
            log.debug("Skipping duplicate control {} ({})", control.stableId(), control.getType());
            return;
        }
        state.record(control);
        state.advanceColumn();
    }

    private void plainSection(Element element, ViewParseState state) {
        String ctrlId = XmlNodeUtil.attr(element, ControlDefinition.CTRL_ID);
        if (!state.claimStableId(ctrlId)) {
            log.debug("Skipping duplicate section {}", ctrlId);
            return;
        }

        String name = NamingUtil.firstNonBlank(XmlNodeUtil.attr(element, "caption_0"),
                XmlNodeUtil.attr(element, "caption"), ctrlId);
        if (name == null) {
            name = DEFAULT_SECTION_NAME;
        }
        boolean optional = XmlNodeUtil.hasClass(element, "xdOptional")
                || "optionalsection".equalsIgnoreCase(XmlNodeUtil.attr(element, "xctname"));
        String sectionType = optional ? "optional" : "section";
        String binding = NamingUtil.firstNonBlank(XmlNodeUtil.attr(element, "binding"),
                state.enclosingSelect().orElse(null));

        SectionInfo info = new SectionInfo(name, SectionKind.PLAIN, state.getRow());
        info.setCtrlId(ctrlId.isEmpty() ? null : ctrlId);
        info.setSectionType(sectionType);
        info.setBinding(binding);

        SectionContext context = new SectionContext(name, binding, sectionType, ctrlId, state.depth() + 1, info);
        state.enter(context, () -> walkChildren(element, state));
    }

    private void repeatingSection(Element element, ViewParseState state) {
        String ctrlId = XmlNodeUtil.attr(element, ControlDefinition.CTRL_ID);
        if (!state.claimStableId(ctrlId)) {
            log.debug("Skipping duplicate repeating section {}", ctrlId);
            return;
        }

        String binding = NamingUtil.firstNonBlank(XmlNodeUtil.attr(element, "binding"), innerSelect(element),
                state.enclosingSelect().orElse(null));
        String name = sectionName(element, binding, IndirectionClassifier.DEFAULT_SECTION_NAME);

        if (state.hasOpenRepeating() && (state.isRepeatingOpen(binding, name) || referencesSingleItem(element))) {
            log.debug("Flattening repeating section {} into open repeating context", name);
            walkChildren(element, state);
            return;
        }

        SectionInfo info = new SectionInfo(name, SectionKind.REPEATING, state.getRow());
        info.setCtrlId(ctrlId.isEmpty() ? null : ctrlId);
        info.setBinding(binding);

        RepeatingContext context = new RepeatingContext(name, binding, false, state.depth() + 1, info);
        state.enter(context, () -> walkChildren(element, state));
    }

    private void repeatingTable(Element table, ViewParseState state) {
        String ctrlId = XmlNodeUtil.attr(table, ControlDefinition.CTRL_ID);
        if (!state.claimStableId(ctrlId)) {
            log.debug("Skipping duplicate repeating table {}", ctrlId);
            return;
        }

        String binding = NamingUtil.firstNonBlank(tableBodyBinding(table), XmlNodeUtil.attr(table, "binding"),
                innerSelect(table), state.enclosingSelect().orElse(null));
        String name = sectionName(table, binding, DEFAULT_TABLE_NAME);

        state.record(extractor.repeatingTable(table, name, binding));
        state.nextRow();

        if (state.isRepeatingOpen(binding, name)) {
            walkChildren(table, state);
            return;
        }

        SectionInfo info = new SectionInfo(name, SectionKind.REPEATING, state.getRow());
        info.setTable(true);
        info.setCtrlId(ctrlId.isEmpty() ? null : ctrlId);
        info.setBinding(binding);

        RepeatingContext context = new RepeatingContext(name, binding, true, state.depth() + 1, info);
        state.enter(context, () -> walkChildren(table, state));
    }

    private void indirection(String mode, String select, ViewParseState state) {
        Element block = state.template(mode).orElse(null);
        if (block == null) {
            log.debug("No template block for mode {}", mode);
            return;
        }
        if (!state.claimMode(mode)) {
            log.debug("Template mode {} already processed", mode);
            return;
        }

        String loopSelect = TemplateIndex.firstLoopSelect(block).orElse(null);
        IndirectionDecision decision = indirectionClassifier.classify(select, loopSelect, state.hasOpenRepeating());
        Runnable body = () -> state.withSelect(select, () -> walkChildren(block, state));

        if (decision.isRepeating() && !state.isRepeatingOpen(decision.binding(), decision.sectionName())) {
            SectionInfo info = new SectionInfo(decision.sectionName(), SectionKind.REPEATING, state.getRow());
            info.setBinding(decision.binding());
            RepeatingContext context = new RepeatingContext(decision.sectionName(), decision.binding(), false,
                    state.depth() + 1, info);
            state.enter(context, body);
        } else {
            log.debug("Template mode {} resolved as {}", mode, decision.kind());
            body.run();
        }
    }

    private void templateDefinition(Element template, String mode, ViewParseState state) {
        if (!state.claimMode(mode)) {
            return;
        }
        log.debug("Template mode {} is not referenced before its definition; parsing in place", mode);
        walkChildren(template, state);
    }

    private static String sectionName(Element element, String binding, String fallback) {
        String name = NamingUtil.firstNonBlank(XmlNodeUtil.attr(element, "caption_0"),
                XmlNodeUtil.attr(element, "caption"), XmlNodeUtil.attr(element, "title"),
                NamingUtil.sectionNameFromPath(binding));
        return name != null ? name : fallback;
    }

    private static String tableBodyBinding(Element table) {
        for (Element child : XmlNodeUtil.childElements(table)) {
            if (XmlNodeUtil.isNamed(child, "tbody")) {
                String binding = NamingUtil.firstNonBlank(XmlNodeUtil.attr(child, "repeating"),
                        XmlNodeUtil.attr(child, "binding"));
                if (binding != null) {
                    return binding;
                }
            }
        }
        return null;
    }

    /**
     * First loop or indirection select inside the element that names a path.
     */
    private static String innerSelect(Element element) {
        return XmlNodeUtil.firstDescendant(element, e -> XmlNodeUtil.isNamed(e, "for-each", "apply-templates")
                        && !NamingUtil.pathSegments(XmlNodeUtil.attr(e, "select")).isEmpty())
                .map(e -> XmlNodeUtil.attr(e, "select"))
                .orElse(null);
    }

    private static boolean referencesSingleItem(Element element) {
        return XmlNodeUtil.childElements(element).stream()
                .filter(child -> XmlNodeUtil.isNamed(child, "apply-templates") && XmlNodeUtil.hasAttr(child, "mode"))
                .map(child -> XmlNodeUtil.attr(child, "select"))
                .anyMatch(select -> NamingUtil.pathSegments(select).size() == 1 && !select.contains("/"));
    }
}
