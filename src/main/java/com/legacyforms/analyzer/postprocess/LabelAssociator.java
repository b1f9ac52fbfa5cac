package com.legacyforms.analyzer.postprocess;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.parser.context.GridPosition;
import com.legacyforms.analyzer.util.NamingUtil;

/**
 * Pairs each label of a view with the control it most likely describes,
 * using grid positions first and document order as the fallback.
 */
public class LabelAssociator {
    private static final Logger log = LoggerFactory.getLogger(LabelAssociator.class);

    public void associate(List<ControlDefinition> controls) {
        List<ControlDefinition> labels = controls.stream()
                .filter(c -> c.isLabelRecord() && !c.isMergedIntoParent())
                .sorted(Comparator.comparingInt(ControlDefinition::getDocIndex))
                .toList();
        List<ControlDefinition> candidates = controls.stream()
                .filter(c -> !c.isLabelRecord() && !ControlTypes.SECTION.equals(c.getType()) && !c.isMergedIntoParent())
                .sorted(Comparator.comparingInt(ControlDefinition::getDocIndex))
                .toList();

        int paired = 0;
        for (ControlDefinition label : labels) {
            Optional<ControlDefinition> target = findTarget(label, candidates);
            if (target.isPresent()) {
                link(label, target.get());
                paired++;
            }
        }
        log.debug("Associated {} of {} labels", paired, labels.size());
    }

    private Optional<ControlDefinition> findTarget(ControlDefinition label, List<ControlDefinition> candidates) {
        GridPosition position = GridPosition.parse(label.getGridPosition());

        Optional<ControlDefinition> sameRow = candidates.stream()
                .filter(c -> {
                    GridPosition p = GridPosition.parse(c.getGridPosition());
                    return p.row() == position.row() && p.column() > position.column();
                })
                .min(Comparator.comparingInt((ControlDefinition c) -> GridPosition.parse(c.getGridPosition()).column())
                        .thenComparingInt(ControlDefinition::getDocIndex));
        if (sameRow.isPresent()) {
            return sameRow;
        }

        Optional<ControlDefinition> nextRow = candidates.stream()
                .filter(c -> GridPosition.parse(c.getGridPosition()).row() == position.row() + 1)
                .min(Comparator.comparingInt((ControlDefinition c) -> GridPosition.parse(c.getGridPosition()).column())
                        .thenComparingInt(ControlDefinition::getDocIndex));
        if (nextRow.isPresent()) {
            return nextRow;
        }

        return candidates.stream()
                .filter(c -> c.getDocIndex() > label.getDocIndex())
                .findFirst();
    }

    private static void link(ControlDefinition label, ControlDefinition control) {
        label.setAssociatedControlId(control.getName());
        control.setAssociatedLabelId(label.getName());
        if (NamingUtil.isBlank(control.getLabel())) {
            control.setLabel(label.getLabel());
        }
    }
}
