package com.legacyforms.analyzer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static choice of a dropdown, radio group or checkbox.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataOption {
    private String value;
    private String displayText;
    private int order;
    private boolean defaultOption;
}
