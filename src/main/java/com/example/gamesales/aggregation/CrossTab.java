package com.example.gamesales.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dense two-dimensional sales matrix, e.g. publisher by platform.
 *
 * <p>Every (row, column) pair has a cell; pairs with no records hold 0.0.
 * Rows and columns are listed in ascending key order.
 *
 * @param rowDimension name of the row grouping column
 * @param columnDimension name of the column grouping column
 * @param rows row keys
 * @param columns column keys
 * @param cells summed sales per row, then per column
 */
public record CrossTab<R extends Comparable<? super R>, C extends Comparable<? super C>>(
        String rowDimension,
        String columnDimension,
        List<R> rows,
        List<C> columns,
        Map<R, Map<C, Double>> cells
) {
    public CrossTab {
        Objects.requireNonNull(rowDimension, "rowDimension must not be null");
        Objects.requireNonNull(columnDimension, "columnDimension must not be null");
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
        Map<R, Map<C, Double>> copy = new LinkedHashMap<>();
        cells.forEach((row, line) -> copy.put(row, Collections.unmodifiableMap(new LinkedHashMap<>(line))));
        cells = Collections.unmodifiableMap(copy);
    }

    /**
     * Sales for one cell, 0.0 for keys outside the matrix.
     */
    public double value(R row, C column) {
        Map<C, Double> line = cells.get(row);
        if (line == null) {
            return 0.0;
        }
        return line.getOrDefault(column, 0.0);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty() || columns.isEmpty();
    }

    /**
     * Sum of every cell.
     */
    public double total() {
        double total = 0.0;
        for (R row : rows) {
            for (C column : columns) {
                total += value(row, column);
            }
        }
        return total;
    }
}
