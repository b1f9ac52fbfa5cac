package com.legacyforms.analyzer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AnalysisMessage {
    Severity severity;
    String message;
    String details;
    String source;
}
