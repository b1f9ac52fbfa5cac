package com.legacyforms.analyzer.parser.extract;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;

import com.legacyforms.analyzer.model.ControlDefinition;
import com.legacyforms.analyzer.model.ControlTypes;
import com.legacyforms.analyzer.model.DataOption;
import com.legacyforms.analyzer.util.NamingUtil;
import com.legacyforms.analyzer.util.XmlNodeUtil;

/**
 * Builds control records from classified elements. Position, document index
 * and context are stamped later by the parse state.
 */
public class ControlExtractor {

    private static final Set<String> SKIPPED_ATTRIBUTES = Set.of(
            "style", "class", "hidefocus", "tabindex", "contenteditable", "xctname", "title", "binding");

    private final ChoiceOptionExtractor optionExtractor;
    private final LabelTextExtractor labelTextExtractor;

    public ControlExtractor() {
        this(new ChoiceOptionExtractor(), new LabelTextExtractor());
    }

    public ControlExtractor(ChoiceOptionExtractor optionExtractor, LabelTextExtractor labelTextExtractor) {
        this.optionExtractor = optionExtractor;
        this.labelTextExtractor = labelTextExtractor;
    }

    public ControlDefinition label(Element element) {
        String text = labelTextExtractor.extract(element);
        ControlDefinition label = new ControlDefinition();
        label.setType(ControlTypes.LABEL);
        label.setLabel(text);
        label.setName(NamingUtil.labelKey(text));
        return label;
    }

    public ControlDefinition boundControl(Element element, String type) {
        ControlDefinition control = new ControlDefinition();
        control.setType(type);
        copyAttributes(element, control);

        if (XmlNodeUtil.isNamed(element, "object")) {
            readObjectParams(element, control);
        } else {
            control.setBinding(XmlNodeUtil.attr(element, "binding"));
        }
        control.setName(controlName(element, control.getBinding()));

        String title = XmlNodeUtil.attr(element, "title");
        if (!title.isBlank()) {
            control.setLabel(title.trim());
        }

        if (XmlNodeUtil.isNamed(element, "select")) {
            control.setDataOptions(optionExtractor.fromSelect(element));
            control.getDataOptions().stream()
                    .filter(o -> o.isDefaultOption())
                    .findFirst()
                    .ifPresent(o -> control.putProperty(ControlDefinition.DEFAULT_VALUE, o.getValue()));
        } else if (isInputOfType(element, "radio")) {
            control.setDataOptions(optionExtractor.fromRadioGroup(element));
        } else if (isInputOfType(element, "checkbox")) {
            control.setDataOptions(optionExtractor.fromCheckboxGroup(element));
            if (!control.hasDataOptions()) {
                control.putProperty(ControlDefinition.DEFAULT_VALUE,
                        Boolean.toString(XmlNodeUtil.hasAttr(element, "checked")));
            }
        }
        if (control.hasDataOptions()) {
            control.putProperty(ControlDefinition.DATA_VALUES, control.getDataOptions().stream()
                    .map(DataOption::getDisplayText)
                    .collect(Collectors.joining(", ")));
        }
        return control;
    }

    /**
     * Record standing for a repeating table itself.
     */
    public ControlDefinition repeatingTable(Element table, String name, String binding) {
        ControlDefinition control = new ControlDefinition();
        control.setType(ControlTypes.REPEATING_TABLE);
        control.setName(name);
        control.setLabel(name);
        control.setBinding(binding);
        control.putProperty(ControlDefinition.CTRL_ID, XmlNodeUtil.attr(table, "CtrlId"));
        control.putProperty("TableType", "Repeating");
        control.putProperty("DisplayName", name);
        return control;
    }

    private void copyAttributes(Element element, ControlDefinition control) {
        for (Attr attribute : XmlNodeUtil.attributes(element)) {
            String name = XmlNodeUtil.localName(attribute);
            if (SKIPPED_ATTRIBUTES.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (name.equalsIgnoreCase("value")) {
                control.putProperty(ControlDefinition.DEFAULT_VALUE, attribute.getValue());
            } else if (name.equalsIgnoreCase(ControlDefinition.CTRL_ID)) {
                control.putProperty(ControlDefinition.CTRL_ID, attribute.getValue());
            } else {
                control.putProperty(name, attribute.getValue());
            }
        }
    }

    private void readObjectParams(Element object, ControlDefinition control) {
        String binding = XmlNodeUtil.attr(object, "binding");
        for (Element param : XmlNodeUtil.childElements(object)) {
            if (!XmlNodeUtil.isNamed(param, "param")) {
                continue;
            }
            String name = XmlNodeUtil.attr(param, "name");
            String value = XmlNodeUtil.attr(param, "value");
            if (name.isEmpty()) {
                continue;
            }
            if (name.equalsIgnoreCase(ControlDefinition.CTRL_ID) && control.stableId().isEmpty()) {
                control.putProperty(ControlDefinition.CTRL_ID, value);
            } else if (name.equalsIgnoreCase("binding") && binding.isEmpty()) {
                binding = value;
            } else {
                control.putProperty(name, value);
            }
        }
        control.setBinding(binding);
    }

    private static String controlName(Element element, String binding) {
        String explicit = XmlNodeUtil.attr(element, "name");
        if (!explicit.isBlank() && !explicit.contains("{")) {
            return explicit.trim();
        }
        String fromBinding = NamingUtil.lastSegment(binding);
        return fromBinding.isEmpty() ? null : fromBinding;
    }

    private static boolean isInputOfType(Element element, String type) {
        return XmlNodeUtil.isNamed(element, "input") && type.equalsIgnoreCase(XmlNodeUtil.attr(element, "type"));
    }
}
