package com.legacyforms.analyzer.export;

import static com.legacyforms.analyzer.ViewFixtures.NAME_AND_ITEMS_VIEW;
import static com.legacyforms.analyzer.ViewFixtures.view;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legacyforms.analyzer.model.FormDefinition;
import com.legacyforms.analyzer.model.context.ToolDiagnostics;
import com.legacyforms.analyzer.parser.ViewParser;
import com.legacyforms.analyzer.postprocess.FormPostProcessor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FormJsonExporter.
 */
class FormJsonExporterTest {

    @TempDir
    Path tempDir;

    private final FormJsonExporter exporter = new FormJsonExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testModelFieldsAreSerialized() throws IOException {
        JsonNode root = mapper.readTree(exporter.toJson(sampleForm()));

        assertThat(root.get("formName").asText()).isEqualTo("Expenses");
        assertThat(root.get("views")).hasSize(1);
        JsonNode firstControl = root.get("views").get(0).get("controls").get(0);
        assertThat(firstControl.get("gridPosition").asText()).isEqualTo("1A");
        assertThat(firstControl.get("type").asText()).isEqualTo("Label");
        assertThat(root.get("dataColumns")).hasSize(2);
        assertThat(root.get("metadata").get("totalControls").asInt()).isEqualTo(5);
    }

    @Test
    void testConvenienceAccessorsAreNotSerialized() throws IOException {
        String json = exporter.toJson(sampleForm());

        assertThat(json)
                .doesNotContain("\"labelRecord\"")
                .doesNotContain("\"activeControls\"")
                .doesNotContain("\"mainColumns\"");
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        Path output = tempDir.resolve("nested").resolve("Expenses.json");

        exporter.write(sampleForm(), output);

        assertThat(mapper.readTree(output.toFile()).get("formName").asText()).isEqualTo("Expenses");
    }

    private static FormDefinition sampleForm() {
        FormDefinition form = new FormDefinition("Expenses");
        form.getViews().add(new ViewParser().parse("view1", view(NAME_AND_ITEMS_VIEW)));
        new FormPostProcessor().process(form, new ToolDiagnostics());
        return form;
    }
}
