package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import com.legacyforms.analyzer.model.context.ToolDiagnostics;

import lombok.Builder;
import lombok.Data;

/**
 * Result of analyzing one form.
 */
@Data
@Builder
public class AnalysisResult {
    private boolean success;
    private String errorMessage;
    private FormDefinition form;
    @Builder.Default
    private List<AnalysisMessage> messages = new ArrayList<>();
    private ToolDiagnostics diagnostics;
    private int viewsParsed;
    private long durationMillis;

    public static AnalysisResult failure(String errorMessage) {
        return AnalysisResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
