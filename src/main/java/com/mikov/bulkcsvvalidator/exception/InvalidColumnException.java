package com.mikov.bulkcsvvalidator.exception;

public class InvalidColumnException extends UserInputException {

    public InvalidColumnException(final String message) {
        super(message);
    }

    public static InvalidColumnException outOfBounds(final int columnIndex, final int fieldCount) {
        return new InvalidColumnException("Column index " + columnIndex
            + " does not exist in the CSV file. Max index allowed: " + (fieldCount - 1));
    }
}
