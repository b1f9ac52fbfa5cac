package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class FormMetadata {
    private int viewCount;
    private int totalControls;
    private int totalSections;
    private int dynamicSectionCount;
    private int repeatingSectionCount;
    private List<String> conditionalFields = new ArrayList<>();
    private Map<String, Integer> controlTypeCounts = new LinkedHashMap<>();
}
