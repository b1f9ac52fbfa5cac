package com.legacyforms.analyzer.parser.classify;

import java.util.List;
import java.util.Locale;

import com.legacyforms.analyzer.util.NamingUtil;

/**
 * English naming heuristics that tell whether a {@code parent/child} path
 * names a collection and its item.
 */
public class CollectionNamePatterns {

    private static final List<String> COLLECTION_SUFFIXES = List.of("list", "collection", "array");

    private CollectionNamePatterns() {
        // Utility class
    }

    public static boolean isCollectionOf(String parentSegment, String childSegment) {
        String parent = NamingUtil.stripPrefix(parentSegment).toLowerCase(Locale.ROOT);
        String child = NamingUtil.stripPrefix(childSegment).toLowerCase(Locale.ROOT);
        if (parent.isEmpty() || child.isEmpty()) {
            return false;
        }
        if (parent.equals(child)) {
            return true;
        }
        if (parent.equals(child + "s") || parent.equals(child + "es")) {
            return true;
        }
        if (child.endsWith("y") && parent.equals(child.substring(0, child.length() - 1) + "ies")) {
            return true;
        }
        for (String suffix : COLLECTION_SUFFIXES) {
            if (parent.length() > suffix.length() && parent.endsWith(suffix)
                    && parent.substring(0, parent.length() - suffix.length()).equals(child)) {
                return true;
            }
        }
        return false;
    }
}
