package io.harmonia.core.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable tabular dataset: an ordered column list and rows keyed by column name.
///
/// Rows are defensively copied once on creation. Slicing and concatenation share
/// the already-immutable row maps, so splitting a large dataset into pieces does
/// not copy cell data.
///
/// Cells may be null; a row is allowed to omit a column entirely.
public final class Dataset {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    /// Creates a dataset from column names and row maps.
    ///
    /// @param columns ordered column names, not null
    /// @param rows row maps keyed by column name, not null
    /// @return the dataset, never null
    public static Dataset of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        List<Map<String, Object>> copied = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return new Dataset(List.copyOf(columns), Collections.unmodifiableList(copied));
    }

    /// Creates a dataset whose columns are the union of the rows' keys, in first-seen order.
    public static Dataset fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return of(new ArrayList<>(columns), rows);
    }

    public static Dataset empty(List<String> columns) {
        return new Dataset(List.copyOf(columns), List.of());
    }

    /// Concatenates datasets in order.
    ///
    /// The resulting column list is the union of the parts' columns in first-seen order.
    ///
    /// @param parts datasets to join, not null, may be empty
    /// @return the concatenation, never null
    public static Dataset concat(List<Dataset> parts) {
        Set<String> columns = new LinkedHashSet<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Dataset part : parts) {
            columns.addAll(part.columns);
            rows.addAll(part.rows);
        }
        return new Dataset(List.copyOf(columns), Collections.unmodifiableList(rows));
    }

    /// Returns the rows in `[fromRow, toRow)` as a new dataset with the same columns.
    ///
    /// @throws IndexOutOfBoundsException if the range is outside the dataset
    public Dataset slice(int fromRow, int toRow) {
        return new Dataset(columns, rows.subList(fromRow, toRow));
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    /// Returns every value of one column, in row order. Missing cells read as null.
    public List<Object> column(String name) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dataset other)) {
            return false;
        }
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
