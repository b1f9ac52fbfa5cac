package com.legacyforms.analyzer.parser.classify;

/**
 * Classifier verdict for one element. {@code controlType} is set for bound
 * controls; {@code mode} and {@code select} for template indirections and
 * definitions.
 */
public record ElementClassification(ElementKind kind, String controlType, String mode, String select) {

    private static final ElementClassification PASS = new ElementClassification(ElementKind.PASS_THROUGH, null, null, null);

    public static ElementClassification of(ElementKind kind) {
        return kind == ElementKind.PASS_THROUGH ? PASS : new ElementClassification(kind, null, null, null);
    }

    public static ElementClassification passThrough() {
        return PASS;
    }

    public static ElementClassification boundControl(String controlType) {
        return new ElementClassification(ElementKind.BOUND_CONTROL, controlType, null, null);
    }

    public static ElementClassification indirection(String mode, String select) {
        return new ElementClassification(ElementKind.TEMPLATE_INDIRECTION, null, mode, select);
    }

    public static ElementClassification templateDefinition(String mode) {
        return new ElementClassification(ElementKind.TEMPLATE_DEFINITION, null, mode, null);
    }
}
