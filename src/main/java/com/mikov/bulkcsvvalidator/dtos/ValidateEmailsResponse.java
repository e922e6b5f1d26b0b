package com.mikov.bulkcsvvalidator.dtos;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ValidateEmailsResponse(
        boolean success,
        String message,
        @JsonProperty("file_id") String fileId,
        String status,
        String filename) {
}
