package com.mikov.bulkcsvvalidator.dtos;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A header row plus fixed-width data rows, with a header-name lookup computed once at parse time.
 *
 * @author zahari.mikov
 */
@Getter
public class ParsedTable {
    private final List<String> header;
    private final List<List<String>> rows;
    private final boolean inconsistentColumns;
    private final Map<String, Integer> headerIndex;

    public ParsedTable(final List<String> header, final List<List<String>> rows) {
        this.header = List.copyOf(header);
        this.rows = Collections.unmodifiableList(rows);
        this.inconsistentColumns = rows.stream().anyMatch(row -> row.size() != header.size());
        final var index = new HashMap<String, Integer>();
        for (var i = 0; i < header.size(); i++) {
            index.putIfAbsent(header.get(i).trim().toLowerCase(), i);
        }
        this.headerIndex = Collections.unmodifiableMap(index);
    }

    public int fieldCount() {
        return header.size();
    }

    public int rowCount() {
        return rows.size();
    }

    public Optional<Integer> indexOf(final String columnName) {
        return Optional.ofNullable(headerIndex.get(columnName.trim().toLowerCase()));
    }

    /**
     * Field at {@code column}, or an empty string when the row is shorter than the header.
     */
    public static String fieldAt(final List<String> row, final int column) {
        if (column < 0 || column >= row.size()) {
            return "";
        }
        final var value = row.get(column);
        return value == null ? "" : value;
    }
}
