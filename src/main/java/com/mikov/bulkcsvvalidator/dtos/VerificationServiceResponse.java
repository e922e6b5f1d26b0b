package com.mikov.bulkcsvvalidator.dtos;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body returned by the external verification service for one address.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerificationServiceResponse(
        @JsonProperty("email") String email,
        @JsonProperty("email_status") String emailStatus,
        @JsonProperty("email_mx") String emailMx,
        @JsonProperty("provider") String provider) {
}
