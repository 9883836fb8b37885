package com.kurobe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable columnar result of one query execution.
 *
 * <p>Every row has exactly {@code columns.size()} values and {@code rowCount == rows.size()}.
 * An empty result may still carry column names taken from the statement metadata.
 */
@Value
public class QueryResult {
    List<String> columns;
    List<List<Object>> rows;
    int rowCount;
    Double executionTimeMs;
    String query;
    String connectionId;

    @Builder
    private QueryResult(List<String> columns, List<List<Object>> rows, Double executionTimeMs, String query, String connectionId) {
        this.columns = columns != null ? List.copyOf(columns) : List.of();
        List<List<Object>> copied = new ArrayList<>(rows != null ? rows.size() : 0);
        if (rows != null) {
            int width = this.columns.size();
            for (int i = 0; i < rows.size(); i++) {
                List<Object> row = rows.get(i);
                int actual = row != null ? row.size() : 0;
                if (actual != width) {
                    throw new IllegalArgumentException("Row " + i + " has " + actual + " values but result has " + width + " columns");
                }
                // values may be null, so no List.copyOf here
                copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
        }
        this.rows = Collections.unmodifiableList(copied);
        this.rowCount = this.rows.size();
        this.executionTimeMs = executionTimeMs;
        this.query = query;
        this.connectionId = connectionId;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
