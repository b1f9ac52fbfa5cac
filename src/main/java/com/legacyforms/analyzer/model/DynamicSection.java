package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Template block whose visibility is guarded by a single comparison
 * against a field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DynamicSection {
    private String mode;
    private String condition;
    private String conditionField;
    private String conditionValue;
    private String ctrlId;
    private String caption;
    @Builder.Default
    private List<String> controlIds = new ArrayList<>();
}
