package com.legacyforms.analyzer.export;

import static com.legacyforms.analyzer.ViewFixtures.NAME_AND_ITEMS_VIEW;
import static com.legacyforms.analyzer.ViewFixtures.view;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.legacyforms.analyzer.model.AnalysisMessage;
import com.legacyforms.analyzer.model.DynamicSection;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.Severity;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;
import com.legacyforms.analyzer.parser.ViewParser;
import com.legacyforms.analyzer.postprocess.FormPostProcessor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FormSummaryReportWriter.
 */
class FormSummaryReportWriterTest {

    private final FormSummaryReportWriter writer = new FormSummaryReportWriter();

    @Test
    void testRenderSummary() throws IOException {
        FormDefinition form = new FormDefinition("Expenses");
        form.getViews().add(new ViewParser().parse("view1", view(NAME_AND_ITEMS_VIEW)));
        form.getDynamicSections().add(DynamicSection.builder()
                .mode("_5").conditionField("needsDetails").conditionValue("Yes").caption("Details")
                .controlIds(List.of("CTRL11")).build());
        new FormPostProcessor().process(form, new ToolDiagnostics());
        List<AnalysisMessage> messages = List.of(AnalysisMessage.builder()
                .severity(Severity.WARNING).source("Complex Controls").message("Form uses 1 PeoplePicker control(s)")
                .details("Requires manual handling during migration").build());

        String summary = writer.render(form, messages);

        assertThat(summary)
                .contains("# Form: Expenses")
                .contains("- **view1**: 5 controls, 1 sections")
                .contains("| Name | TextField |")
                .contains("### Items")
                .contains("| Desc | TextField |")
                .contains("`needsDetails` = `Yes` shows Details: CTRL11")
                .contains("- **WARNING** [Complex Controls] Form uses 1 PeoplePicker control(s) "
                        + "(Requires manual handling during migration)");
    }

    @Test
    void testRenderEmptyForm() throws IOException {
        FormDefinition form = new FormDefinition("Blank");
        new FormPostProcessor().process(form, new ToolDiagnostics());

        String summary = writer.render(form, List.of());

        assertThat(summary)
                .contains("_No main columns._")
                .contains("_No repeating sections._")
                .doesNotContain("## Conditional sections");
    }
}
