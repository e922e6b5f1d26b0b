package com.mikov.bulkcsvvalidator.utils;

import com.mikov.bulkcsvvalidator.exception.ColumnNotEmailException;
import com.mikov.bulkcsvvalidator.exception.InsufficientCreditsException;
import com.mikov.bulkcsvvalidator.exception.InvalidColumnException;

/**
 * Turns internal failure messages into guidance a user can act on.
 *
 * @author zahari.mikov
 */
public final class ErrorMessageTranslator {

    private ErrorMessageTranslator() {
    }

    public static String translate(final Throwable error) {
        if (error instanceof InsufficientCreditsException credits) {
            return "You don't have enough credits to validate this file. You need " + credits.getShortfall()
                + " more credits (required: " + credits.getRequired() + ", available: " + credits.getAvailable()
                + "). Please purchase more credits and try again.";
        }
        if (error instanceof InvalidColumnException || error instanceof ColumnNotEmailException) {
            return error.getMessage() + " Please select the column that contains the email addresses.";
        }
        return translate(error.getMessage());
    }

    public static String translate(final String message) {
        if (message == null || message.isBlank()) {
            return "An unexpected error occurred during validation. Please try again.";
        }
        if (message.startsWith("Failed to fetch file")) {
            return "The uploaded file could not be found. Please upload it again.";
        }
        if (message.startsWith("Failed to upload file")) {
            return "The validated file could not be saved. Please try again later.";
        }
        return message;
    }
}
