package com.legacyforms.analyzer.parser.classify;

import java.util.List;

import com.legacyforms.analyzer.util.NamingUtil;

/**
 * Decides what a template-mode indirection stands for, from the shape of its
 * select path and whether a repeating block is already open.
 */
public class IndirectionClassifier {

    public static final String DEFAULT_SECTION_NAME = "RepeatingSection";

    /**
     * @param select         the select path of the invoking element
     * @param loopSelect     select of the first looping construct inside the
     *                       referenced block, or null when it has none
     * @param repeatingOpen  whether a repeating context is already open
     */
    public IndirectionDecision classify(String select, String loopSelect, boolean repeatingOpen) {
        String path = select == null ? "" : select.trim();

        if (loopSelect != null) {
            String combined = join(path, loopSelect.trim());
            return new IndirectionDecision(IndirectionKind.REPEATING, sectionName(combined), combined);
        }

        List<String> segments = NamingUtil.pathSegments(path);
        if (segments.size() >= 2) {
            String parent = segments.get(segments.size() - 2);
            String child = segments.get(segments.size() - 1);
            if (CollectionNamePatterns.isCollectionOf(parent, child)) {
                return new IndirectionDecision(IndirectionKind.REPEATING, sectionName(path), path);
            }
        }

        if (!path.contains("/") && repeatingOpen) {
            return new IndirectionDecision(IndirectionKind.NESTED_IN_REPEATING, null, path);
        }
        return new IndirectionDecision(IndirectionKind.PASS_THROUGH, null, path);
    }

    private static String sectionName(String path) {
        String name = NamingUtil.sectionNameFromPath(path);
        return name != null ? name : DEFAULT_SECTION_NAME;
    }

    private static String join(String select, String loopSelect) {
        if (NamingUtil.pathSegments(select).isEmpty() || loopSelect.startsWith("/")) {
            return loopSelect;
        }
        if (NamingUtil.pathSegments(loopSelect).isEmpty()) {
            return select;
        }
        return select + "/" + loopSelect;
    }
}
