package com.vat.extraction.service.strategy;

import com.vat.extraction.model.Money;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A delimited tax report (CSV, semicolon or tab separated) as exported by
 * shop platforms. Header names are normalized: lower case, underscores as
 * spaces, no dots, so {@code "Item Tax Amt."} and {@code item_tax_amt} match.
 * Rows whose first cell starts with "total" are summary rows and skipped.
 */
public final class TaxReportTable {

    private final List<String> headers;
    private final List<List<String>> rows;

    private TaxReportTable(List<String> headers, List<List<String>> rows) {
        this.headers = headers;
        this.rows = rows;
    }

    /** Finds the first header line the predicate accepts and reads the rows under it. */
    public static Optional<TaxReportTable> parse(String text, Predicate<List<String>> isHeader) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            char delimiter = delimiterOf(lines[i]);
            if (delimiter == 0) continue;

            List<String> header = split(lines[i], delimiter).stream().map(TaxReportTable::normalize).toList();
            if (!isHeader.test(header)) continue;

            List<List<String>> rows = new ArrayList<>();
            for (int j = i + 1; j < lines.length; j++) {
                if (lines[j].isBlank()) continue;
                List<String> cells = split(lines[j], delimiter);
                if (cells.size() < 2) break;
                if (cells.get(0).trim().toLowerCase(Locale.ROOT).startsWith("total")) continue;
                rows.add(cells);
            }
            return Optional.of(new TaxReportTable(header, rows));
        }
        return Optional.empty();
    }

    public static boolean hasColumn(List<String> header, String... names) {
        return indexOf(header, names) >= 0;
    }

    public static boolean hasColumnContaining(List<String> header, String fragment) {
        return header.stream().anyMatch(h -> h.contains(fragment));
    }

    public int column(String... names) {
        return indexOf(headers, names);
    }

    public int rowCount() {
        return rows.size();
    }

    /** Sum of a numeric column; blank and non-numeric cells count as zero. */
    public double sum(int column) {
        List<Double> values = new ArrayList<>();
        for (List<String> row : rows) {
            Double value = number(row, column);
            if (value != null) values.add(value);
        }
        return Money.sum(values);
    }

    /** Sums a numeric column per distinct (trimmed) value of another column. */
    public Map<String, Double> sumBy(int groupColumn, int valueColumn) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (List<String> row : rows) {
            if (groupColumn < 0 || groupColumn >= row.size()) continue;
            String key = row.get(groupColumn).trim();
            Double value = number(row, valueColumn);
            if (key.isEmpty() || value == null) continue;
            sums.merge(key, value, (a, b) -> Money.round(a + b));
        }
        return sums;
    }

    private static Double number(List<String> row, int column) {
        if (column < 0 || column >= row.size()) {
            return null;
        }
        String cell = row.get(column).replaceAll("[€£$\\s]", "");
        return Money.parse(cell);
    }

    private static int indexOf(List<String> header, String... names) {
        List<String> wanted = Arrays.stream(names).map(TaxReportTable::normalize).toList();
        for (int i = 0; i < header.size(); i++) {
            if (wanted.contains(header.get(i))) return i;
        }
        return -1;
    }

    static String normalize(String raw) {
        return raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replace(".", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static char delimiterOf(String line) {
        if (line.indexOf('\t') >= 0) return '\t';
        if (line.indexOf(';') >= 0) return ';';
        if (line.indexOf(',') >= 0) return ',';
        return 0;
    }

    // Quoted cells may hold the delimiter, e.g. "1,234.56"
    static List<String> split(String line, char delimiter) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == delimiter && !quoted) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
