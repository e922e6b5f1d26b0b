package com.mikov.bulkcsvvalidator.verification;

import com.mikov.bulkcsvvalidator.model.VerificationOutcome;

/**
 * Verifies a single address against the reputation/mailbox service.
 *
 * @author zahari.mikov
 */
public interface VerificationClient {

    /**
     * Blocks until a terminal outcome is known. Transport failures are retried internally
     * and end as an outcome, never as an exception.
     *
     * @param address the address to verify
     * @return the terminal outcome
     */
    VerificationOutcome verify(final String address);
}
