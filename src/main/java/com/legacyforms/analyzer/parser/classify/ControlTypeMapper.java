package com.legacyforms.analyzer.parser.classify;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Fixed lookup tables from markup hints to control type tags.
 */
public class ControlTypeMapper {

    /** Class id of the people-picker ActiveX control. */
    public static final String PEOPLE_PICKER_CLASS_ID = "61e40d31-993d-4777-8fa0-19ca59b6d0bb";

    private static final Map<String, String> CONTROL_KINDS = Map.ofEntries(
            Map.entry("plaintext", ControlTypes.TEXT_FIELD),
            Map.entry("dtpicker", ControlTypes.DATE_PICKER),
            Map.entry("datepicker", ControlTypes.DATE_PICKER),
            Map.entry("richtext", ControlTypes.RICH_TEXT),
            Map.entry("dropdown", ControlTypes.DROP_DOWN),
            Map.entry("combobox", ControlTypes.COMBO_BOX),
            Map.entry("checkbox", ControlTypes.CHECK_BOX),
            Map.entry("optionbutton", ControlTypes.RADIO_BUTTON),
            Map.entry("button", ControlTypes.BUTTON),
            Map.entry("fileattachment", ControlTypes.FILE_ATTACHMENT),
            Map.entry("sharepoint:sharepointfileattachment", ControlTypes.SHAREPOINT_FILE_ATTACHMENT),
            Map.entry("section", ControlTypes.SECTION),
            Map.entry("optionalsection", ControlTypes.OPTIONAL_SECTION),
            Map.entry("repeatingsection", ControlTypes.REPEATING_SECTION),
            Map.entry("repeatingtable", ControlTypes.REPEATING_TABLE),
            Map.entry("bulletedlist", "BulletedList"),
            Map.entry("numberedlist", "NumberedList"),
            Map.entry("plainnumberedlist", "PlainNumberedList"),
            Map.entry("multipleselectlist", "MultipleSelectList"),
            Map.entry("hyperlink", "Hyperlink"),
            Map.entry("inlinepicture", ControlTypes.INLINE_PICTURE),
            Map.entry("linkedpicture", "LinkedPicture"),
            Map.entry("signatureline", ControlTypes.SIGNATURE_LINE));

    private static final Set<String> STRUCTURAL_KINDS = Set.of(
            "section", "optionalsection", "repeatingsection", "repeatingtable", "expressionbox");

    private static final Map<String, String> INPUT_TYPES = Map.of(
            "text", ControlTypes.TEXT_FIELD,
            "checkbox", ControlTypes.CHECK_BOX,
            "radio", ControlTypes.RADIO_BUTTON,
            "button", ControlTypes.BUTTON,
            "submit", ControlTypes.BUTTON);

    public boolean isStructuralKind(String controlKind) {
        return controlKind != null && STRUCTURAL_KINDS.contains(controlKind.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Maps a control-kind attribute value. Braced class ids map to
     * {@code PeoplePicker} or {@code ActiveX-{id}}; unknown kinds are returned as given.
     */
    public String fromControlKind(String controlKind) {
        String raw = controlKind == null ? "" : controlKind.trim();
        if (raw.startsWith("{") && raw.endsWith("}")) {
            return raw.toLowerCase(Locale.ROOT).contains(PEOPLE_PICKER_CLASS_ID)
                    ? ControlTypes.PEOPLE_PICKER
                    : ControlTypes.ACTIVE_X + "-" + raw;
        }
        return CONTROL_KINDS.getOrDefault(raw.toLowerCase(Locale.ROOT), raw);
    }

    public String fromInputType(String inputType) {
        String key = inputType == null ? "" : inputType.trim().toLowerCase(Locale.ROOT);
        return INPUT_TYPES.getOrDefault(key, ControlTypes.TEXT_FIELD);
    }

    public String fromObjectClassId(String classId) {
        return classId != null && classId.toLowerCase(Locale.ROOT).contains(PEOPLE_PICKER_CLASS_ID)
                ? ControlTypes.PEOPLE_PICKER
                : ControlTypes.ACTIVE_X;
    }

    /**
     * Type for an element that only carries a binding: structural class hints
     * first, then the shape of the binding path, then the tag itself.
     */
    public String fromHints(Element element) {
        if (XmlNodeUtil.hasClass(element, "xdBehavior_Boolean")) {
            return ControlTypes.CHECK_BOX;
        }
        if (XmlNodeUtil.hasClass(element, "xdRichTextBox")) {
            return ControlTypes.RICH_TEXT;
        }
        if (XmlNodeUtil.hasClass(element, "xdTextBox")) {
            return ControlTypes.TEXT_FIELD;
        }
        if (XmlNodeUtil.hasClass(element, "xdComboBox") || XmlNodeUtil.isNamed(element, "select")) {
            return ControlTypes.DROP_DOWN;
        }
        if (XmlNodeUtil.hasClass(element, "xdDTPicker")) {
            return ControlTypes.DATE_PICKER;
        }
        if (XmlNodeUtil.hasClass(element, "xdFileAttachment")) {
            return ControlTypes.FILE_ATTACHMENT;
        }

        String field = NamingUtil.lastSegment(XmlNodeUtil.attr(element, "binding"));
        if (field.endsWith("Date")) {
            return ControlTypes.DATE_PICKER;
        }
        if (field.matches("(is|has)[A-Z].*")) {
            return ControlTypes.CHECK_BOX;
        }
        return XmlNodeUtil.localName(element);
    }
}
