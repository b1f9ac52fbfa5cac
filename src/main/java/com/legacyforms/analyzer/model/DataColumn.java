package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical column folded from every control sharing one
 * (name, owning repeating section) key across all views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataColumn {
    private String columnName;
    private String type;
    private String displayName;
    private String repeatingSectionName;
    private String repeatingSectionBinding;
    private boolean repeating;
    private String sourceView;

    @Builder.Default
    private List<DataOption> validValues = new ArrayList<>();
    private String defaultValue;

    private boolean conditional;
    private String conditionalOnField;

    public boolean hasValidValues() {
        return validValues != null && !validValues.isEmpty();
    }
}
