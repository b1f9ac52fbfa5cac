package com.legacyforms.analyzer.parser.context;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.SectionInfo;
import com.legacyforms.analyzer.util.NamingUtil;

/**
 * Mutable bookkeeping of a single view parse: grid coordinates, the document
 * index counter, the structural context stack, duplicate suppression and the
 * template-mode reentrancy guard.
 * <p>
 * A new instance is created for every parse, so parses of different views
 * never share state.
 */
public class ViewParseState {

    private int row = 1;
    private int column = 1;
    private int nextDocIndex = 0;

    private final Deque<StructuralContext> contexts = new ArrayDeque<>();
    private final Deque<String> selects = new ArrayDeque<>();
    private final Set<String> materializedIds = new HashSet<>();
    private final Set<String> visitedModes = new HashSet<>();
    private final Map<String, Element> templatesByMode = new LinkedHashMap<>();

    private final List<ControlDefinition> controls = new ArrayList<>();
    private final List<SectionInfo> sections = new ArrayList<>();

    public ViewParseState(Map<String, Element> templatesByMode) {
        this.templatesByMode.putAll(templatesByMode);
    }

    // ---- grid ----

    public int getRow() {
        return row;
    }

    public String gridToken() {
        return new GridPosition(row, column).toToken();
    }

    public void advanceColumn() {
        column++;
    }

    /**
     * Starts a new row, unless the current row has not received anything yet.
     */
    public void rowBoundary() {
        if (column > 1) {
            row++;
        }
        column = 1;
    }

    public void nextRow() {
        row++;
        column = 1;
    }

    // ---- materialization ----

    /**
     * Registers a stable id. Returns false when it was already materialized in
     * this view. Blank ids are never suppressed.
     */
    public boolean claimStableId(String stableId) {
        if (NamingUtil.isBlank(stableId)) {
            return true;
        }
        return materializedIds.add(stableId);
    }

    /**
     * Stamps grid position, document index and the innermost context onto the
     * control, then records it with every open section.
     */
    public void record(ControlDefinition control) {
        control.setGridPosition(gridToken());
        control.setDocIndex(nextDocIndex++);
        applyContext(control);
        controls.add(control);

        String memberId = NamingUtil.firstNonBlank(control.stableId(), control.getName());
        if (memberId != null) {
            for (StructuralContext context : contexts) {
                context.section().getControlIds().add(memberId);
            }
        }
    }

    private void applyContext(ControlDefinition control) {
        Optional<RepeatingContext> repeating = innermostRepeating();
        if (repeating.isPresent()) {
            RepeatingContext current = repeating.get();
            control.setInRepeating(true);
            control.setRepeatingSectionName(current.name());
            control.setRepeatingSectionBinding(current.binding());
            List<String> outer = repeatingChain();
            if (outer.size() > 1) {
                control.putProperty(ControlDefinition.PARENT_REPEATING_SECTIONS,
                        String.join("|", outer.subList(0, outer.size() - 1)));
            }
            return;
        }
        innermostSection().ifPresent(section -> {
            control.setParentSection(section.name());
            control.setSectionType(section.sectionType());
            control.putProperty(ControlDefinition.SECTION_CTRL_ID, section.ctrlId());
        });
    }

    // ---- structural contexts ----

    public int depth() {
        return contexts.size();
    }

    /**
     * Runs {@code body} with {@code context} pushed, then pops it and closes its
     * section with the current row, whatever way the body exits.
     */
    public void enter(StructuralContext context, Runnable body) {
        SectionInfo section = context.section();
        section.setStartRow(row);
        sections.add(section);
        contexts.push(context);
        try {
            body.run();
        } finally {
            contexts.pop();
            section.setEndRow(row);
        }
    }

    public Optional<RepeatingContext> innermostRepeating() {
        for (StructuralContext context : contexts) {
            if (context instanceof RepeatingContext repeating) {
                return Optional.of(repeating);
            }
        }
        return Optional.empty();
    }

    public Optional<SectionContext> innermostSection() {
        for (StructuralContext context : contexts) {
            if (context instanceof SectionContext section) {
                return Optional.of(section);
            }
        }
        return Optional.empty();
    }

    public boolean hasOpenRepeating() {
        return innermostRepeating().isPresent();
    }

    /**
     * True when a repeating context with this binding or name is already open.
     */
    public boolean isRepeatingOpen(String binding, String name) {
        for (StructuralContext context : contexts) {
            if (context instanceof RepeatingContext repeating) {
                if (!NamingUtil.isBlank(binding) && binding.equals(repeating.binding())) {
                    return true;
                }
                if (!NamingUtil.isBlank(name) && name.equalsIgnoreCase(repeating.name())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Names of the open repeating contexts, outermost first.
     */
    public List<String> repeatingChain() {
        List<String> names = new ArrayList<>();
        Iterator<StructuralContext> outermostFirst = contexts.descendingIterator();
        while (outermostFirst.hasNext()) {
            if (outermostFirst.next() instanceof RepeatingContext repeating) {
                names.add(repeating.name());
            }
        }
        return names;
    }

    // ---- template modes and select paths ----

    public Optional<Element> template(String mode) {
        return Optional.ofNullable(templatesByMode.get(mode));
    }

    /**
     * Claims a template mode for processing. Only the first claim succeeds.
     */
    public boolean claimMode(String mode) {
        return visitedModes.add(mode);
    }

    public void withSelect(String select, Runnable body) {
        if (NamingUtil.isBlank(select)) {
            body.run();
            return;
        }
        selects.push(select.trim());
        try {
            body.run();
        } finally {
            selects.pop();
        }
    }

    /**
     * Innermost enclosing loop or indirection select that names a path.
     */
    public Optional<String> enclosingSelect() {
        return selects.stream()
                .filter(s -> !NamingUtil.pathSegments(s).isEmpty())
                .findFirst();
    }

    // ---- results ----

    public List<ControlDefinition> getControls() {
        return controls;
    }

    public List<SectionInfo> getSections() {
        return sections;
    }

    public Set<String> getVisitedModes() {
        return visitedModes.stream().collect(Collectors.toUnmodifiableSet());
    }
}
