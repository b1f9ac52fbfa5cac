package com.legacyforms.analyzer.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.legacyforms.analyzer.model.AnalysisMessage;
import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.model.DataColumn;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.FormMetadata;
import com.legacyforms.analyzer.model.Severity;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;

/**
 * Derives severity-tagged findings about a finished form, aimed at whoever
 * migrates it to another platform.
 */
public class FormAnalysisReporter {

    static final int MANY_REPEATING_SECTIONS = 5;
    static final int LARGE_FORM_CONTROLS = 100;

    public List<AnalysisMessage> report(FormDefinition form, ToolDiagnostics diagnostics) {
        List<AnalysisMessage> messages = new ArrayList<>();
        FormMetadata metadata = form.getMetadata();
        List<ControlDefinition> active = form.getViews().stream()
                .flatMap(v -> v.activeControls().stream())
                .toList();

        messages.add(info("Structure",
                "Analyzed " + form.getViews().size() + " view(s) with " + metadata.getTotalControls() + " controls",
                null));

        int repeating = metadata.getRepeatingSectionCount();
        if (repeating > MANY_REPEATING_SECTIONS) {
            messages.add(warning("Repeating Sections", "Form has " + repeating + " repeating sections",
                    "Each repeating section becomes a child table; review the relationships before generating a schema"));
        } else if (repeating > 0) {
            messages.add(info("Repeating Sections", "Found " + repeating + " repeating section(s)", null));
        }

        if (!form.getDynamicSections().isEmpty()) {
            messages.add(info("Conditional Logic",
                    "Found " + form.getDynamicSections().size() + " conditional section(s)",
                    "Driving fields: " + String.join(", ", metadata.getConditionalFields())));
        }

        long lookups = form.getDataColumns().stream().filter(DataColumn::hasValidValues).count();
        if (lookups > 0) {
            messages.add(info("Lookups", lookups + " column(s) carry static option lists",
                    "Candidates for lookup tables"));
        }

        Map<String, Integer> complexTypes = new LinkedHashMap<>();
        for (ControlDefinition control : active) {
            if (ControlTypes.isComplex(control.getType())) {
                complexTypes.merge(control.getType(), 1, Integer::sum);
            }
        }
        complexTypes.forEach((type, count) -> messages.add(warning("Complex Controls",
                "Form uses " + count + " " + type + " control(s)", "Requires manual handling during migration")));

        if (metadata.getTotalControls() > LARGE_FORM_CONTROLS) {
            messages.add(warning("Form Size", "Large form with " + metadata.getTotalControls() + " controls",
                    "Consider splitting the form into smaller units"));
        }

        boolean nested = active.stream()
                .anyMatch(c -> c.getProperties().containsKey(ControlDefinition.PARENT_REPEATING_SECTIONS));
        if (nested) {
            messages.add(warning("Repeating Sections", "Nested repeating sections detected",
                    "Nested collections need multi-level child tables"));
        }

        if (form.getDataColumns().isEmpty()) {
            messages.add(warning("Data Structure", "No data columns were found", null));
        } else {
            messages.add(info("Data Structure",
                    form.mainColumns().size() + " main column(s), " + form.repeatingColumnsBySection().size()
                            + " repeating group(s)",
                    null));
        }

        if (!form.getRules().isEmpty()) {
            messages.add(info("Business Rules", "Found " + form.getRules().size() + " business rule(s)", null));
        }

        diagnostics.getErrors().forEach(e -> messages.add(message(Severity.ERROR, "Diagnostics", e, null)));
        diagnostics.getWarnings().forEach(w -> messages.add(message(Severity.WARNING, "Diagnostics", w, null)));
        return messages;
    }

    private static AnalysisMessage info(String source, String text, String details) {
        return message(Severity.INFO, source, text, details);
    }

    private static AnalysisMessage warning(String source, String text, String details) {
        return message(Severity.WARNING, source, text, details);
    }

    private static AnalysisMessage message(Severity severity, String source, String text, String details) {
        return AnalysisMessage.builder()
                .severity(severity)
                .source(source)
                .message(text)
                .details(details)
                .build();
    }
}
