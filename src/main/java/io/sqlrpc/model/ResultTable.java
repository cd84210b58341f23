package io.sqlrpc.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ResultTable(
        @JsonProperty("column_names") List<String> columnNames,
        @JsonProperty("rows") List<List<Object>> rows
) {
    public ResultTable {
        columnNames = columnNames == null ? List.of() : List.copyOf(columnNames);
        rows = rows == null ? List.of() : rows;
    }

    public ResultTable limit(int maxRows) {
        if (rows.size() <= maxRows) {
            return this;
        }
        return new ResultTable(columnNames, rows.subList(0, maxRows));
    }
}
