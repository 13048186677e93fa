package com.example.ficregistry.access;

import java.util.List;
import java.util.Objects;

/**
 * Raw contents of the backing table: header cells and data rows, in source order.
 */
public record PersonTable(List<String> headers, List<List<String>> rows) {

    public PersonTable {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(rows, "rows");
        headers = List.copyOf(headers);
        rows = rows.stream().map(List::copyOf).toList();
    }

    public String cell(int row, int column) {
        List<String> values = rows.get(row);
        return column < values.size() ? values.get(column) : "";
    }
}
