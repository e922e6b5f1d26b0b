package com.mikov.bulkcsvvalidator.exception;

public class UserNotFoundException extends UserInputException {

    public UserNotFoundException(final String userEmail) {
        super("User not found: " + userEmail);
    }
}
