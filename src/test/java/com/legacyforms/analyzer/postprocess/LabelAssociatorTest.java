package com.legacyforms.analyzer.postprocess;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LabelAssociator.
 */
class LabelAssociatorTest {

    private final LabelAssociator associator = new LabelAssociator();

    @Test
    void testSameRowNearestColumnWins() {
        ControlDefinition label = control("FIRSTNAME", ControlTypes.LABEL, "First name", "1A", 0);
        ControlDefinition near = control("firstName", ControlTypes.TEXT_FIELD, null, "1B", 1);
        ControlDefinition far = control("lastName", ControlTypes.TEXT_FIELD, null, "1C", 2);

        associator.associate(List.of(label, far, near));

        assertThat(label.getAssociatedControlId()).isEqualTo("firstName");
        assertThat(near.getAssociatedLabelId()).isEqualTo("FIRSTNAME");
        assertThat(near.getLabel()).isEqualTo("First name");
        assertThat(far.getAssociatedLabelId()).isNull();
    }

    @Test
    void testExistingControlLabelIsKept() {
        ControlDefinition label = control("AMOUNT", ControlTypes.LABEL, "Amount", "1A", 0);
        ControlDefinition field = control("amount", ControlTypes.TEXT_FIELD, "Total amount", "1B", 1);

        associator.associate(List.of(label, field));

        assertThat(field.getAssociatedLabelId()).isEqualTo("AMOUNT");
        assertThat(field.getLabel()).isEqualTo("Total amount");
    }

    @Test
    void testFallsBackToNextRow() {
        ControlDefinition label = control("COMMENTS", ControlTypes.LABEL, "Comments", "1A", 0);
        ControlDefinition field = control("comments", ControlTypes.RICH_TEXT, null, "2B", 1);

        associator.associate(List.of(label, field));

        assertThat(label.getAssociatedControlId()).isEqualTo("comments");
    }

    @Test
    void testFallsBackToDocumentOrder() {
        ControlDefinition earlier = control("before", ControlTypes.TEXT_FIELD, null, "1A", 0);
        ControlDefinition label = control("NOTES", ControlTypes.LABEL, "Notes", "3B", 1);
        ControlDefinition field = control("notes", ControlTypes.TEXT_FIELD, null, "7A", 2);

        associator.associate(List.of(earlier, label, field));

        assertThat(label.getAssociatedControlId()).isEqualTo("notes");
        assertThat(earlier.getAssociatedLabelId()).isNull();
    }

    @Test
    void testLabelsSectionsAndMergedRecordsAreNotTargets() {
        ControlDefinition label = control("HEADER", ControlTypes.LABEL, "Header", "1A", 0);
        ControlDefinition otherLabel = control("SUB", ControlTypes.LABEL, "Sub", "1B", 1);
        ControlDefinition section = control("group", ControlTypes.SECTION, null, "1C", 2);
        ControlDefinition merged = control("old", ControlTypes.TEXT_FIELD, null, "1D", 3);
        merged.setMergedIntoParent(true);

        associator.associate(List.of(label, otherLabel, section, merged));

        assertThat(label.getAssociatedControlId()).isNull();
        assertThat(otherLabel.getAssociatedControlId()).isNull();
    }

    private static ControlDefinition control(String name, String type, String label, String grid, int docIndex) {
        ControlDefinition control = new ControlDefinition();
        control.setName(name);
        control.setType(type);
        control.setLabel(label);
        control.setGridPosition(grid);
        control.setDocIndex(docIndex);
        return control;
    }
}
