package com.legacyforms.analyzer.model;

import java.util.Set;

/**
 * Control type tags. Types are open-ended strings because unrecognized
 * control kinds are carried through verbatim.
 */
public final class ControlTypes {

    public static final String LABEL = "Label";
    public static final String TEXT_FIELD = "TextField";
    public static final String RICH_TEXT = "RichText";
    public static final String DATE_PICKER = "DatePicker";
    public static final String DROP_DOWN = "DropDown";
    public static final String COMBO_BOX = "ComboBox";
    public static final String CHECK_BOX = "CheckBox";
    public static final String RADIO_BUTTON = "RadioButton";
    public static final String BUTTON = "Button";
    public static final String FILE_ATTACHMENT = "FileAttachment";
    public static final String SHAREPOINT_FILE_ATTACHMENT = "SharePointFileAttachment";
    public static final String PEOPLE_PICKER = "PeoplePicker";
    public static final String ACTIVE_X = "ActiveX";
    public static final String INLINE_PICTURE = "InlinePicture";
    public static final String SIGNATURE_LINE = "SignatureLine";
    public static final String SECTION = "Section";
    public static final String OPTIONAL_SECTION = "OptionalSection";
    public static final String REPEATING_SECTION = "RepeatingSection";
    public static final String REPEATING_TABLE = "RepeatingTable";

    /** Types that describe layout or actions rather than stored data. */
    public static final Set<String> NON_DATA = Set.of(
            LABEL, BUTTON, SECTION, OPTIONAL_SECTION, REPEATING_SECTION, REPEATING_TABLE);

    /** Types that usually need manual attention when a form is migrated. */
    public static final Set<String> COMPLEX = Set.of(
            PEOPLE_PICKER, FILE_ATTACHMENT, SHAREPOINT_FILE_ATTACHMENT, ACTIVE_X, INLINE_PICTURE, SIGNATURE_LINE);

    private ControlTypes() {
    }

    public static boolean isDataBearing(String type) {
        return type != null && !NON_DATA.contains(type);
    }

    public static boolean isComplex(String type) {
        return type != null && (COMPLEX.contains(type) || type.startsWith(ACTIVE_X));
    }
}
