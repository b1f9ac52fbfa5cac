package com.legacyforms.analyzer.postprocess;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.parser.context.GridPosition;

/**
 * Collapses label fragments that belong together (same grid cell, or
 * back-to-back in document order on neighbouring rows) into the first label
 * of the run.
 */
public class MultiFragmentLabelMerger {
    private static final Logger log = LoggerFactory.getLogger(MultiFragmentLabelMerger.class);

    public void merge(List<ControlDefinition> controls) {
        ControlDefinition head = null;
        int merged = 0;

        for (int i = 1; i < controls.size(); i++) {
            ControlDefinition previous = controls.get(i - 1);
            ControlDefinition current = controls.get(i);

            if (!previous.isLabelRecord() || !current.isLabelRecord() || current.isMergedIntoParent()
                    || !related(previous, current)) {
                head = null;
                continue;
            }
            if (head == null || !previous.isMergedIntoParent()) {
                head = previous;
            }

            head.setLabel(head.getLabel() + " " + current.getLabel());
            head.setMultiLineLabel(true);
            current.setMergedIntoParent(true);
            merged++;
        }
        if (merged > 0) {
            log.debug("Merged {} label fragments", merged);
        }
    }

    static boolean related(ControlDefinition first, ControlDefinition second) {
        if (first.getGridPosition() != null && first.getGridPosition().equals(second.getGridPosition())) {
            return true;
        }
        int rowDistance = Math.abs(GridPosition.parse(first.getGridPosition()).row()
                - GridPosition.parse(second.getGridPosition()).row());
        return Math.abs(first.getDocIndex() - second.getDocIndex()) == 1 && rowDistance <= 1;
    }
}
