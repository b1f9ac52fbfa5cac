package com.legacyforms.analyzer.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Declarative business rule taken from the form manifest.
 */
@Value
@Builder
public class FormRule {
    String name;
    String condition;
    @Builder.Default
    boolean enabled = true;
    @Singular
    List<FormRuleAction> actions;
}
