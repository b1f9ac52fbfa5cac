package com.legacyforms.analyzer.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structural region of a view. Opened when its context is entered and closed,
 * with the end row and member ids filled in, when the context is left.
 */
@Data
@NoArgsConstructor
public class SectionInfo {
    private String name;
    private SectionKind kind;
    private boolean table;
    private String ctrlId;
    private String binding;
    private String sectionType;
    private int startRow;
    private int endRow;
    private List<String> controlIds = new ArrayList<>();

    public SectionInfo(String name, SectionKind kind, int startRow) {
        this.name = name;
        this.kind = kind;
        this.startRow = startRow;
    }

    public boolean isRepeating() {
        return kind == SectionKind.REPEATING;
    }
}
