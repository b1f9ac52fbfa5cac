package com.legacyforms.analyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FormRuleAction {
    String type;
    String target;
    String expression;
}
