package com.mikov.bulkcsvvalidator.model;

import com.mikov.bulkcsvvalidator.dtos.VerificationServiceResponse;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Terminal verification result for a single address.
 * The {@code label} is what gets written into the output file.
 *
 * @author zahari.mikov
 */
@Getter
@Builder
@ToString
public class VerificationOutcome {
    public static final String SERVICE_ERROR = "error";

    private final String address;
    private final VerificationStatus status;
    private final String label;
    private final String mxInfo;
    private final String provider;
    private final String reason;

    public static VerificationOutcome fromService(final String address, final VerificationServiceResponse response) {
        final var status = VerificationStatus.fromServiceStatus(response.emailStatus());
        final var label = status == VerificationStatus.UNVERIFIABLE && response.emailStatus() != null
                && !response.emailStatus().isBlank()
            ? response.emailStatus().trim().toLowerCase()
            : status.getLabel();
        return VerificationOutcome.builder()
            .address(address)
            .status(status)
            .label(label)
            .mxInfo(response.emailMx())
            .provider(response.provider())
            .build();
    }

    /**
     * Result for an address rejected before any network call.
     */
    public static VerificationOutcome rejectedLocally(final String address, final String reason) {
        return VerificationOutcome.builder()
            .address(address)
            .status(VerificationStatus.INVALID)
            .label(VerificationStatus.INVALID.getLabel())
            .reason(reason)
            .build();
    }

    /**
     * Result once every attempt against the verification service failed.
     * Reported as invalid so the row still gets a definite answer.
     */
    public static VerificationOutcome serviceError(final String address, final String reason) {
        return VerificationOutcome.builder()
            .address(address)
            .status(VerificationStatus.INVALID)
            .label(VerificationStatus.INVALID.getLabel())
            .mxInfo(SERVICE_ERROR)
            .provider(SERVICE_ERROR)
            .reason(reason)
            .build();
    }

    public boolean isServiceError() {
        return SERVICE_ERROR.equals(provider) && SERVICE_ERROR.equals(mxInfo);
    }
}
