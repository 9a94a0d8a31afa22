package com.vtb.audit.reports;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Текстовая таблица с заголовком и многострочными ячейками
 */
public class TextTable {

    private final String title;
    private final List<String> headers;
    private final List<String[]> rows = new ArrayList<>();

    public TextTable(String title, String... headers) {
        if (headers == null || headers.length == 0) {
            throw new IllegalArgumentException("Таблица должна содержать хотя бы одну колонку");
        }
        this.title = title;
        this.headers = Arrays.asList(headers);
    }

    /**
     * Добавить строку. Ячейка может содержать переводы строк.
     *
     * @throws IllegalArgumentException если число значений не совпадает с числом колонок
     */
    public TextTable addRow(String... values) {
        if (values == null || values.length != headers.size()) {
            throw new IllegalArgumentException(String.format(
                "Ожидалось %d значений, получено %d", headers.size(), values == null ? 0 : values.length));
        }
        String[] row = new String[values.length];
        for (int i = 0; i < values.length; i++) {
            row[i] = values[i] != null ? values[i] : "";
        }
        rows.add(row);
        return this;
    }

    public int getRowCount() {
        return rows.size();
    }

    public String render() {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                for (String line : row[i].split("\n", -1)) {
                    widths[i] = Math.max(widths[i], line.length());
                }
            }
        }

        String separator = separator(widths);
        StringBuilder out = new StringBuilder();
        if (title != null && !title.isEmpty()) {
            out.append(title).append('\n');
        }
        out.append(separator);
        appendRow(out, headers.toArray(new String[0]), widths);
        out.append(separator);
        for (String[] row : rows) {
            appendRow(out, row, widths);
            out.append(separator);
        }
        return out.toString();
    }

    private static String separator(int[] widths) {
        StringBuilder line = new StringBuilder("+");
        for (int width : widths) {
            line.append("-".repeat(width + 2)).append('+');
        }
        return line.append('\n').toString();
    }

    private static void appendRow(StringBuilder out, String[] cells, int[] widths) {
        String[][] lines = new String[cells.length][];
        int height = 1;
        for (int i = 0; i < cells.length; i++) {
            lines[i] = cells[i].split("\n", -1);
            height = Math.max(height, lines[i].length);
        }
        for (int h = 0; h < height; h++) {
            out.append('|');
            for (int i = 0; i < cells.length; i++) {
                String text = h < lines[i].length ? lines[i][h] : "";
                out.append(' ').append(text).append(" ".repeat(widths[i] - text.length())).append(" |");
            }
            out.append('\n');
        }
    }
}
