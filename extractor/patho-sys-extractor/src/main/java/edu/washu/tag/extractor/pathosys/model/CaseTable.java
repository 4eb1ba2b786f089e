package edu.washu.tag.extractor.pathosys.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An in-memory table of text cells, as read from a CSV file.
 * Every row holds a value for every column, in column order. A missing value is {@code null}.
 *
 * @param columns Column names in order.
 * @param rows    Rows in order, keyed by column name.
 */
public record CaseTable(List<String> columns, List<Map<String, String>> rows) {

    public CaseTable {
        columns = List.copyOf(columns);
        List<String> columnOrder = columns;
        rows = rows.stream()
            .map(row -> freezeRow(columnOrder, row))
            .toList();
    }

    /**
     * Creates a table with no rows.
     *
     * @param columns Column names
     * @return an empty table
     */
    public static CaseTable empty(List<String> columns) {
        return new CaseTable(columns, List.of());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Finds required columns absent from this table.
     *
     * @param required Required column names
     * @return The required columns that are not present, in the order given
     */
    public List<String> missingColumns(Collection<String> required) {
        return required.stream()
            .filter(column -> !columns.contains(column))
            .toList();
    }

    /**
     * Keeps the rows matching a predicate.
     *
     * @param keep Predicate for rows to keep
     * @return a table with the same columns and the matching rows
     */
    public CaseTable filter(Predicate<Map<String, String>> keep) {
        return new CaseTable(columns, rows.stream().filter(keep).toList());
    }

    /**
     * Rows {@code from} (inclusive) to {@code to} (exclusive).
     *
     * @param from First row index
     * @param to   Row index after the last row
     * @return a table holding the slice
     */
    public CaseTable slice(int from, int to) {
        return new CaseTable(columns, rows.subList(from, to));
    }

    /**
     * Rewrites every row. Columns of the new table absent from a rewritten row are filled with missing values.
     *
     * @param newColumns Columns of the resulting table
     * @param rewrite    Function producing the new row from a mutable copy of the old one
     * @return the rewritten table
     */
    public CaseTable mapRows(List<String> newColumns, UnaryOperator<Map<String, String>> rewrite) {
        return new CaseTable(newColumns, rows.stream()
            .map(row -> rewrite.apply(new LinkedHashMap<>(row)))
            .toList());
    }

    private static Map<String, String> freezeRow(List<String> columns, Map<String, String> row) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String column : columns) {
            ordered.put(column, row.get(column));
        }
        return Collections.unmodifiableMap(ordered);
    }
}
