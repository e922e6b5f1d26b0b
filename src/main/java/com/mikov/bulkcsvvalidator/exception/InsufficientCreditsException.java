package com.mikov.bulkcsvvalidator.exception;

import lombok.Getter;

@Getter
public class InsufficientCreditsException extends UserInputException {
    private final long required;
    private final long available;

    public InsufficientCreditsException(final long required, final long available) {
        super("Insufficient credits. Required: " + required + ", Available: " + available);
        this.required = required;
        this.available = available;
    }

    public long getShortfall() {
        return Math.max(0, required - available);
    }
}
