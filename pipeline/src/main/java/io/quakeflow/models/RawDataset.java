package io.quakeflow.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Untyped tabular view of a dataset as loaded from disk, used by the quality
 * gate. Values keep the type they had in the source file so type checks can
 * see strings where numbers were expected. A column absent from the source is
 * absent from {@link #getColumns()}; a present column may hold nulls.
 */
public final class RawDataset {

    private final String source;
    private final Set<String> columns;
    private final List<Map<String, Object>> rows;

    public RawDataset(String source, Set<String> columns, List<Map<String, Object>> rows) {
        this.source = source;
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public String getSource() { return source; }
    public Set<String> getColumns() { return columns; }
    public List<Map<String, Object>> getRows() { return rows; }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Column values in row order; nulls included. */
    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }
}
