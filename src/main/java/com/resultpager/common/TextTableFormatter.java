package com.resultpager.common;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility for rendering ASCII tables similar to MySQL CLI output.
 */
public final class TextTableFormatter {
    private TextTableFormatter() {}

    public static String format(List<String> headers, List<List<String>> rows) {
        int columnCount = headers.size();
        int[] widths = new int[columnCount];
        for (int i = 0; i < columnCount; i++) {
            widths[i] = headers.get(i).length();
        }
        List<List<String>> normalizedRows = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> normalized = new ArrayList<>(columnCount);
            for (int i = 0; i < columnCount; i++) {
                // 行比表头短时补空
                String value = i < row.size() && row.get(i) != null ? row.get(i) : "";
                widths[i] = Math.max(widths[i], value.length());
                normalized.add(value);
            }
            normalizedRows.add(normalized);
        }
        StringBuilder sb = new StringBuilder();
        String horizontal = buildHorizontal(widths);
        sb.append(horizontal).append("\n");
        sb.append(buildRow(headers, widths)).append("\n");
        sb.append(horizontal).append("\n");
        for (List<String> row : normalizedRows) {
            sb.append(buildRow(row, widths)).append("\n");
        }
        sb.append(horizontal);
        return sb.toString();
    }

    private static String buildHorizontal(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }

    private static String buildRow(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < values.size(); i++) {
            sb.append(" ");
            sb.append(padRight(values.get(i), widths[i]));
            sb.append(" |");
        }
        return sb.toString();
    }

    private static String padRight(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return value + " ".repeat(width - value.length());
    }
}
