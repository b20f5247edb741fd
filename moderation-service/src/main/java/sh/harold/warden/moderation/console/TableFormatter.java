package sh.harold.warden.moderation.console;

import java.util.ArrayList;
import java.util.List;

/**
 * Box-drawn table for console listings.
 */
public class TableFormatter {

    public static final String RED = "\u001B[31m";
    public static final String GREEN = "\u001B[32m";
    public static final String YELLOW = "\u001B[33m";
    public static final String CYAN = "\u001B[36m";
    private static final String RESET = "\u001B[0m";

    private final List<String> headers = new ArrayList<>();
    private final List<Integer> columnWidths = new ArrayList<>();
    private final List<List<String>> rows = new ArrayList<>();

    public TableFormatter addHeaders(String... headers) {
        for (String header : headers) {
            this.headers.add(header);
            this.columnWidths.add(header.length());
        }
        return this;
    }

    /**
     * Values beyond the header count are dropped; missing values render blank.
     */
    public TableFormatter addRow(String... values) {
        List<String> row = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            String value = i < values.length && values[i] != null ? values[i] : "";
            row.add(value);
            columnWidths.set(i, Math.max(columnWidths.get(i), value.length()));
        }
        rows.add(row);
        return this;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public String build() {
        int innerWidth = columnWidths.stream().mapToInt(Integer::intValue).sum() + (columnWidths.size() - 1) * 3 + 2;

        StringBuilder sb = new StringBuilder();
        sb.append('┌').append("─".repeat(innerWidth)).append("┐\n");
        appendRow(sb, headers);
        sb.append('├').append("─".repeat(innerWidth)).append("┤\n");
        for (List<String> row : rows) {
            appendRow(sb, row);
        }
        sb.append('└').append("─".repeat(innerWidth)).append('┘');
        return sb.toString();
    }

    private void appendRow(StringBuilder sb, List<String> cells) {
        sb.append("│ ");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(padRight(cells.get(i), columnWidths.get(i)));
            if (i < cells.size() - 1) {
                sb.append(" │ ");
            }
        }
        sb.append(" │\n");
    }

    private static String padRight(String text, int length) {
        return text.length() >= length ? text : text + " ".repeat(length - text.length());
    }

    public static String color(String text, String color) {
        return color + text + RESET;
    }
}
