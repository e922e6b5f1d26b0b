package com.mikov.bulkcsvvalidator.model;

public record JobResult(String message, String status) {
}
