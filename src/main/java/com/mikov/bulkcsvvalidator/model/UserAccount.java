package com.mikov.bulkcsvvalidator.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class UserAccount {
    private final String userId;
    private final String userEmail;
    private final long credits;
    private final long reservedCredits;

    /**
     * Credits not already held by another running job.
     */
    public long availableCredits() {
        return credits - reservedCredits;
    }
}
