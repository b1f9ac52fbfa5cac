package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recognized markup unit of a view: a label, a bound control or a
 * structure record such as a repeating table.
 * <p>
 * Records absorbed by a multi-fragment label merge keep their place in the
 * view for traceability but are flagged {@code mergedIntoParent} and ignored
 * by every later consumer.
 */
@Data
@NoArgsConstructor
public class ControlDefinition {

    public static final String CTRL_ID = "CtrlId";
    public static final String DEFAULT_VALUE = "DefaultValue";
    public static final String DATA_VALUES = "DataValues";
    public static final String SECTION_CTRL_ID = "SectionCtrlId";
    public static final String PARENT_REPEATING_SECTIONS = "ParentRepeatingSections";

    private String name;
    private String type;
    private String label;
    private String binding;
    private int docIndex;
    private String gridPosition;

    private boolean inRepeating;
    private String repeatingSectionName;
    private String repeatingSectionBinding;

    private String parentSection;
    private String sectionType;

    private boolean mergedIntoParent;
    private boolean multiLineLabel;
    private String associatedLabelId;
    private String associatedControlId;

    private boolean conditional;
    private String conditionalOnField;

    private List<DataOption> dataOptions = new ArrayList<>();
    private Map<String, String> properties = new LinkedHashMap<>();

    public String stableId() {
        return properties.getOrDefault(CTRL_ID, "");
    }

    public boolean isLabelRecord() {
        return ControlTypes.LABEL.equals(type);
    }

    public boolean hasDataOptions() {
        return dataOptions != null && !dataOptions.isEmpty();
    }

    public void putProperty(String key, String value) {
        if (key != null && value != null && !value.isEmpty()) {
            properties.put(key, value);
        }
    }
}
