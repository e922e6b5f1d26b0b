package com.mikov.bulkcsvvalidator.exception;

public class InvalidJobRequestException extends UserInputException {

    public InvalidJobRequestException(final String message) {
        super(message);
    }
}
