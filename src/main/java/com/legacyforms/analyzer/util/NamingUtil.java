package com.legacyforms.analyzer.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Naming helpers for binding paths, section names and label keys.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return null;
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    /**
     * Removes a namespace prefix: {@code my:item} becomes {@code item}.
     */
    public static String stripPrefix(String segment) {
        if (segment == null) {
            return "";
        }
        String cleaned = segment.replaceAll("\\[.*?]", "").replace("@", "").trim();
        int colon = cleaned.lastIndexOf(':');
        return colon >= 0 ? cleaned.substring(colon + 1) : cleaned;
    }

    /**
     * Splits a binding or select path into its non-empty, non-relative segments.
     */
    public static List<String> pathSegments(String path) {
        if (isBlank(path)) {
            return List.of();
        }
        return Arrays.stream(path.split("/"))
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.equals(".") && !s.equals(".."))
                .toList();
    }

    public static String lastSegment(String path) {
        List<String> segments = pathSegments(path);
        return segments.isEmpty() ? "" : stripPrefix(segments.get(segments.size() - 1));
    }

    /**
     * Derives a display name for a repeating group from its binding: the
     * collection (second-to-last) segment, or the only segment of a one-segment path.
     * {@code my:expenseItems/my:item} becomes {@code Expense Items}.
     */
    public static String sectionNameFromPath(String path) {
        List<String> segments = pathSegments(path);
        if (segments.isEmpty()) {
            return null;
        }
        String collection = segments.size() >= 2 ? segments.get(segments.size() - 2) : segments.get(0);
        String name = humanize(stripPrefix(collection));
        return name.isEmpty() ? null : name;
    }

    /**
     * Capitalizes the first letter and splits camel case into words.
     */
    public static String humanize(String name) {
        if (isBlank(name)) {
            return "";
        }
        String spaced = name.replaceAll("([a-z])([A-Z])", "$1 $2").replace('_', ' ');
        return spaced.substring(0, 1).toUpperCase(Locale.ROOT) + spaced.substring(1);
    }

    /**
     * Normalized key for label text: letters, digits and slashes only, upper case.
     */
    public static String labelKey(String text) {
        if (text == null) {
            return "";
        }
        return text.replaceAll("[^a-zA-Z0-9/]", "").toUpperCase(Locale.ROOT);
    }
}
