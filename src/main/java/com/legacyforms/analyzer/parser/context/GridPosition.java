package com.legacyforms.analyzer.parser.context;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Approximate 2-D layout position of a control: a row number plus a column
 * letter run, spreadsheet style ({@code 12B}, {@code 3AA}).
 */
public record GridPosition(int row, int column) {

    private static final Pattern ROW = Pattern.compile("^(\\d+)");
    private static final Pattern COLUMN = Pattern.compile("([A-Z]+)$");

    /**
     * Decodes a grid token. Malformed parts decode to 0.
     */
    public static GridPosition parse(String token) {
        if (token == null || token.isBlank()) {
            return new GridPosition(0, 0);
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        int row = 0;
        Matcher rowMatcher = ROW.matcher(normalized);
        if (rowMatcher.find()) {
            try {
                row = Integer.parseInt(rowMatcher.group(1));
            } catch (NumberFormatException e) {
                row = 0;
            }
        }
        int column = 0;
        Matcher columnMatcher = COLUMN.matcher(normalized);
        if (columnMatcher.find()) {
            for (char c : columnMatcher.group(1).toCharArray()) {
                column = column * 26 + (c - 'A' + 1);
            }
        }
        return new GridPosition(row, column);
    }

    public static String columnLetters(int column) {
        if (column <= 0) {
            return "";
        }
        StringBuilder letters = new StringBuilder();
        int remaining = column;
        while (remaining > 0) {
            int rem = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + rem));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    public String toToken() {
        return row + columnLetters(column);
    }
}
