package com.legacyforms.analyzer.parser.classify;

public record IndirectionDecision(IndirectionKind kind, String sectionName, String binding) {

    public boolean isRepeating() {
        return kind == IndirectionKind.REPEATING;
    }
}
