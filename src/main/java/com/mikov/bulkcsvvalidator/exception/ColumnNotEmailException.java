package com.mikov.bulkcsvvalidator.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The chosen column exists but neither its header nor its values look like email addresses.
 */
@Getter
public class ColumnNotEmailException extends UserInputException {
    private final int columnIndex;
    private final String columnName;
    private final List<Integer> suggestedColumns;

    public ColumnNotEmailException(final int columnIndex, final String columnName, final List<Integer> suggestedColumns) {
        super("Column " + columnIndex + " (" + columnName + ") doesn't appear to contain emails. Suggested columns: "
            + suggestedColumns.stream().map(String::valueOf).collect(Collectors.joining(", ")));
        this.columnIndex = columnIndex;
        this.columnName = columnName;
        this.suggestedColumns = List.copyOf(suggestedColumns);
    }
}
