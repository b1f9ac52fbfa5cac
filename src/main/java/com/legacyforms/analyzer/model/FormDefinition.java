package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of the reconstructed form. Views are added by the analysis driver;
 * columns, the visibility map and metadata are filled in afterwards by the
 * post-processor.
 */
@Data
@NoArgsConstructor
public class FormDefinition {
    private String formName;
    private List<ViewDefinition> views = new ArrayList<>();
    private List<FormRule> rules = new ArrayList<>();
    private List<DataColumn> dataColumns = new ArrayList<>();
    private List<DynamicSection> dynamicSections = new ArrayList<>();
    private Map<String, Set<String>> conditionalVisibility = new LinkedHashMap<>();
    private FormMetadata metadata = new FormMetadata();

    public FormDefinition(String formName) {
        this.formName = formName;
    }

    public List<DataColumn> mainColumns() {
        return dataColumns.stream().filter(c -> !c.isRepeating()).toList();
    }

    /**
     * Repeating columns grouped by their owning section, in first-seen order.
     */
    public Map<String, List<DataColumn>> repeatingColumnsBySection() {
        Map<String, List<DataColumn>> grouped = new LinkedHashMap<>();
        for (DataColumn column : dataColumns) {
            if (column.isRepeating()) {
                grouped.computeIfAbsent(column.getRepeatingSectionName(), k -> new ArrayList<>()).add(column);
            }
        }
        return grouped;
    }
}
