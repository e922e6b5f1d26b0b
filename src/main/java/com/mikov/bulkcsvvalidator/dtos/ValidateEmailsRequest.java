package com.mikov.bulkcsvvalidator.dtos;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a validation trigger.
 */
public record ValidateEmailsRequest(
        @JsonProperty("emailColumnIndex") Integer emailColumnIndex,
        @JsonProperty("user_email") String userEmail,
        @JsonProperty("total_emails") Integer totalEmails,
        @JsonProperty("full_filename") String fullFilename,
        @JsonProperty("emails_filename") String emailsFilename) {
}
