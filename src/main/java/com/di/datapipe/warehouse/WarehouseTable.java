package com.di.datapipe.warehouse;

import lombok.Value;

import java.util.List;

/** Immutable column names plus string cells, as held by the in-memory warehouse. */
@Value
public class WarehouseTable {

    List<String> columns;

    List<List<String>> rows;

    public WarehouseTable(List<String> columns, List<List<String>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = rows.stream().map(List::copyOf).toList();
    }

    public long rowCount() {
        return rows.size();
    }

    public int columnIndex(String column) {
        return columns.indexOf(column);
    }
}
