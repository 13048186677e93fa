package com.example.ficregistry.access;

import com.example.ficregistry.models.PersonColumn;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Header positions of the canonical columns, resolved once per read. The first header
 * that maps to a column wins; unknown headers are ignored.
 */
public final class ColumnMapping {

    private final Map<PersonColumn, Integer> indexes;

    private ColumnMapping(Map<PersonColumn, Integer> indexes) {
        this.indexes = indexes;
    }

    public static ColumnMapping resolve(List<String> headers) {
        Map<PersonColumn, Integer> indexes = new EnumMap<>(PersonColumn.class);
        for (int i = 0; i < headers.size(); i++) {
            int position = i;
            PersonColumn.forHeader(headers.get(i))
                    .ifPresent(column -> indexes.putIfAbsent(column, position));
        }
        return new ColumnMapping(indexes);
    }

    public Optional<Integer> indexOf(PersonColumn column) {
        return Optional.ofNullable(indexes.get(column));
    }

    public boolean has(PersonColumn column) {
        return indexes.containsKey(column);
    }

    public Map<PersonColumn, Integer> indexes() {
        return Collections.unmodifiableMap(indexes);
    }

    /**
     * Picks the mapped cells out of one row. Missing cells come back as empty strings.
     */
    public Map<PersonColumn, String> extract(List<String> row) {
        Map<PersonColumn, String> values = new EnumMap<>(PersonColumn.class);
        indexes.forEach((column, index) -> values.put(column, index < row.size() ? row.get(index) : ""));
        return values;
    }
}
