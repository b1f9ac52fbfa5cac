package com.legacyforms.analyzer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Parse output of one view file. Controls are in document order, sections in
 * discovery order.
 */
@Value
@Builder
public class ViewDefinition {
    String viewName;
    @Singular
    List<ControlDefinition> controls;
    @Singular
    List<SectionInfo> sections;

    public List<ControlDefinition> activeControls() {
        return controls.stream().filter(c -> !c.isMergedIntoParent()).toList();
    }
}
