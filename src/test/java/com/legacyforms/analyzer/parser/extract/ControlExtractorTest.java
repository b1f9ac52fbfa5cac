package com.legacyforms.analyzer.parser.extract;

import static com.legacyforms.analyzer.ViewFixtures.element;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.model.DataOption;
import com.legacyforms.analyzer.util.XmlNodeUtil;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ControlExtractor.
 */
class ControlExtractorTest {

    private final ControlExtractor extractor = new ControlExtractor();

    @Test
    void testLabelTextAndKey() {
        ControlDefinition label = extractor.label(element("<strong>Total <em>amount</em>:</strong>"));

        assertThat(label.getType()).isEqualTo(ControlTypes.LABEL);
        assertThat(label.getLabel()).isEqualTo("Total amount :");
        assertThat(label.getName()).isEqualTo("TOTALAMOUNT");
    }

    @Test
    void testDropDownOptionsAndDefault() {
        Element select = element("""
                <select class="xdComboBox" xd:xctname="dropdown" xd:CtrlId="CTRL5" xd:binding="my:country"
                        title="Country" style="WIDTH: 100%" size="1">
                  <option value="US"><xsl:attribute name="selected">selected</xsl:attribute>United States</option>
                  <option value="CA">Canada</option>
                </select>
                """);

        ControlDefinition control = extractor.boundControl(select, ControlTypes.DROP_DOWN);

        assertThat(control.getName()).isEqualTo("country");
        assertThat(control.getLabel()).isEqualTo("Country");
        assertThat(control.getBinding()).isEqualTo("my:country");
        assertThat(control.stableId()).isEqualTo("CTRL5");
        assertThat(control.getProperties())
                .containsEntry(ControlDefinition.DEFAULT_VALUE, "US")
                .containsEntry(ControlDefinition.DATA_VALUES, "United States, Canada")
                .containsEntry("size", "1")
                .doesNotContainKeys("style", "class", "xctname", "title", "binding", "xsl", "xd");
        assertThat(control.getDataOptions())
                .extracting(DataOption::getValue, DataOption::getDisplayText, DataOption::getOrder,
                        DataOption::isDefaultOption)
                .containsExactly(
                        tuple("US", "United States", 0, true),
                        tuple("CA", "Canada", 1, false));
    }

    @Test
    void testRadioGroupOptions() {
        Element group = element("""
                <div>
                  <input type="radio" name="{generate-id(my:color)}" xd:binding="my:color" value="red" id="r1" checked="checked"/>
                  <label for="r1">Red</label>
                  <input type="radio" name="{generate-id(my:color)}" xd:binding="my:color" value="blue"/> Blue
                  <input type="radio" xd:binding="my:size" value="L"/> Large
                </div>
                """);
        Element red = XmlNodeUtil.firstChildElement(group).orElseThrow();

        ControlDefinition control = extractor.boundControl(red, ControlTypes.RADIO_BUTTON);

        assertThat(control.getName()).isEqualTo("color");
        assertThat(control.getDataOptions())
                .extracting(DataOption::getValue, DataOption::getDisplayText, DataOption::isDefaultOption)
                .containsExactly(tuple("red", "Red", true), tuple("blue", "Blue", false));
    }

    @Test
    void testCheckBoxDefault() {
        ControlDefinition checked = extractor.boundControl(
                element("<input type=\"checkbox\" xd:binding=\"my:agree\" checked=\"checked\"/>"), ControlTypes.CHECK_BOX);
        ControlDefinition unchecked = extractor.boundControl(
                element("<input type=\"checkbox\" xd:binding=\"my:optIn\"/>"), ControlTypes.CHECK_BOX);

        assertThat(checked.getProperties()).containsEntry(ControlDefinition.DEFAULT_VALUE, "true");
        assertThat(unchecked.getProperties()).containsEntry(ControlDefinition.DEFAULT_VALUE, "false");
    }

    @Test
    void testCheckBoxGroupOptions() {
        Element group = element("""
                <div>
                  <input type="checkbox" xd:binding="my:channel" value="email" id="c1" checked="checked"/>
                  <label for="c1">E-mail</label>
                  <input type="checkbox" xd:binding="my:channel" value="phone"/> Phone
                  <input type="checkbox" xd:binding="my:optIn"/>
                </div>
                """);
        Element email = XmlNodeUtil.firstChildElement(group).orElseThrow();

        ControlDefinition control = extractor.boundControl(email, ControlTypes.CHECK_BOX);

        assertThat(control.getDataOptions())
                .extracting(DataOption::getValue, DataOption::getDisplayText, DataOption::isDefaultOption)
                .containsExactly(tuple("email", "E-mail", true), tuple("phone", "Phone", false));
        assertThat(control.getProperties())
                .containsEntry(ControlDefinition.DATA_VALUES, "E-mail, Phone")
                .doesNotContainKey(ControlDefinition.DEFAULT_VALUE);
    }

    @Test
    void testObjectParams() {
        Element object = element("""
                <object classid="clsid:61E40D31-993D-4777-8FA0-19CA59B6D0BB" xd:CtrlId="CTRL9">
                  <param name="binding" value="my:approver"/>
                  <param name="ShowIcons" value="true"/>
                </object>
                """);

        ControlDefinition control = extractor.boundControl(object, ControlTypes.PEOPLE_PICKER);

        assertThat(control.getBinding()).isEqualTo("my:approver");
        assertThat(control.getName()).isEqualTo("approver");
        assertThat(control.stableId()).isEqualTo("CTRL9");
        assertThat(control.getProperties()).containsEntry("ShowIcons", "true");
    }

    @Test
    void testRepeatingTableRecord() {
        ControlDefinition table = extractor.repeatingTable(
                element("<table class=\"xdRepeatingTable\" xd:CtrlId=\"CTRL2\"/>"), "Items", "my:Items/my:Item");

        assertThat(table.getType()).isEqualTo(ControlTypes.REPEATING_TABLE);
        assertThat(table.getName()).isEqualTo("Items");
        assertThat(table.getBinding()).isEqualTo("my:Items/my:Item");
        assertThat(table.getProperties())
                .containsEntry(ControlDefinition.CTRL_ID, "CTRL2")
                .containsEntry("TableType", "Repeating")
                .containsEntry("DisplayName", "Items");
    }
}
