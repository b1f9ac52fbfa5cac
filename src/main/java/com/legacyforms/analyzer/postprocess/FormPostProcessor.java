package com.legacyforms.analyzer.postprocess;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.model.DataColumn;
import com.legacyforms.analyzer.model.DataOption;
import com.legacyforms.analyzer.model.DynamicSection;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.FormMetadata;
import com.legacyforms.analyzer.model.SectionInfo;
import com.legacyforms.analyzer.model.ViewDefinition;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;
import com.legacyforms.analyzer.util.NamingUtil;

/**
 * Folds every parsed view of a form into the canonical data-column model,
 * the conditional-visibility map and the aggregate metadata.
 * <p>
 * Must run after all views and dynamic sections are collected. Each phase is
 * isolated: a failing phase leaves its own output at the default and is
 * reported as a warning.
 */
public class FormPostProcessor {
    private static final Logger log = LoggerFactory.getLogger(FormPostProcessor.class);

    public void process(FormDefinition form, ToolDiagnostics diagnostics) {
        runPhase("conditional visibility", diagnostics, () -> buildVisibilityMap(form));
        runPhase("data columns", diagnostics, () -> buildColumns(form));
        runPhase("metadata", diagnostics, () -> buildMetadata(form));

        log.info("Form {}: {} data columns, {} conditional fields", form.getFormName(),
                form.getDataColumns().size(), form.getConditionalVisibility().size());
    }

    private void runPhase(String phase, ToolDiagnostics diagnostics, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            log.warn("Post-processing phase '{}' failed: {}", phase, e.getMessage(), e);
            diagnostics.getWarnings().add("Post-processing phase '" + phase + "' failed: " + e.getMessage());
        }
    }

    void buildVisibilityMap(FormDefinition form) {
        Map<String, Set<String>> visibility = new LinkedHashMap<>();
        for (DynamicSection section : form.getDynamicSections()) {
            if (NamingUtil.isBlank(section.getConditionField())) {
                continue;
            }
            visibility.computeIfAbsent(section.getConditionField(), k -> new LinkedHashSet<>())
                    .addAll(section.getControlIds());
        }
        form.setConditionalVisibility(visibility);
    }

    void buildColumns(FormDefinition form) {
        Map<String, String> drivingFieldByControl = new LinkedHashMap<>();
        form.getConditionalVisibility().forEach((field, ids) -> ids.forEach(id -> drivingFieldByControl.putIfAbsent(id, field)));

        Map<ColumnKey, DataColumn> columns = new LinkedHashMap<>();
        int synthetic = 0;

        for (ViewDefinition view : form.getViews()) {
            for (ControlDefinition control : view.getControls()) {
                if (control.isMergedIntoParent() || !ControlTypes.isDataBearing(control.getType())) {
                    continue;
                }

                String name = NamingUtil.firstNonBlank(control.getName(), control.getLabel(),
                        NamingUtil.lastSegment(control.getBinding()), control.stableId());
                if (name == null) {
                    name = "Column" + (++synthetic);
                }
                String owner = control.isInRepeating() ? control.getRepeatingSectionName() : null;
                ColumnKey key = new ColumnKey(name, owner);

                DataColumn column = columns.get(key);
                if (column == null) {
                    column = newColumn(name, control, view.getViewName());
                    columns.put(key, column);
                } else {
                    fillMissing(column, control);
                }

                String drivingField = drivingFieldByControl.get(control.stableId());
                if (drivingField != null) {
                    control.setConditional(true);
                    control.setConditionalOnField(drivingField);
                    if (!column.isConditional()) {
                        column.setConditional(true);
                        column.setConditionalOnField(drivingField);
                    }
                }
            }
        }
        form.setDataColumns(new ArrayList<>(columns.values()));
    }

    void buildMetadata(FormDefinition form) {
        FormMetadata metadata = new FormMetadata();
        List<ControlDefinition> active = form.getViews().stream()
                .flatMap(v -> v.activeControls().stream())
                .toList();

        metadata.setViewCount(form.getViews().size());
        metadata.setTotalControls(active.size());
        metadata.setTotalSections((int) form.getViews().stream()
                .flatMap(v -> v.getSections().stream())
                .map(SectionInfo::getName)
                .filter(Objects::nonNull)
                .distinct()
                .count());
        metadata.setDynamicSectionCount(form.getDynamicSections().size());

        long repeatingSections = form.getViews().stream()
                .flatMap(v -> v.getSections().stream())
                .filter(s -> s.isRepeating() && !s.isTable())
                .count();
        long repeatingTables = active.stream()
                .filter(c -> ControlTypes.REPEATING_TABLE.equals(c.getType()))
                .count();
        metadata.setRepeatingSectionCount((int) (repeatingSections + repeatingTables));
        metadata.setConditionalFields(new ArrayList<>(form.getConditionalVisibility().keySet()));

        Map<String, Integer> typeCounts = active.stream()
                .collect(Collectors.toMap(ControlDefinition::getType, c -> 1, Integer::sum, LinkedHashMap::new));
        metadata.setControlTypeCounts(typeCounts);

        form.setMetadata(metadata);
    }

    private static DataColumn newColumn(String name, ControlDefinition control, String viewName) {
        DataColumn column = DataColumn.builder()
                .columnName(name)
                .type(control.getType())
                .displayName(NamingUtil.isBlank(control.getLabel()) ? name : control.getLabel())
                .repeating(control.isInRepeating())
                .repeatingSectionName(control.isInRepeating() ? control.getRepeatingSectionName() : null)
                .repeatingSectionBinding(control.isInRepeating() ? control.getRepeatingSectionBinding() : null)
                .sourceView(viewName)
                .build();
        fillMissing(column, control);
        return column;
    }

    private static void fillMissing(DataColumn column, ControlDefinition control) {
        // Only controls with static options contribute options and a default.
        if (!control.hasDataOptions()) {
            return;
        }
        if (!column.hasValidValues()) {
            column.setValidValues(new ArrayList<>(control.getDataOptions()));
        }
        if (column.getDefaultValue() == null) {
            String defaultValue = control.getDataOptions().stream()
                    .filter(DataOption::isDefaultOption)
                    .map(DataOption::getValue)
                    .findFirst()
                    .orElse(control.getProperties().get(ControlDefinition.DEFAULT_VALUE));
            column.setDefaultValue(defaultValue);
        }
    }

    private record ColumnKey(String name, String repeatingSection) {
    }
}
