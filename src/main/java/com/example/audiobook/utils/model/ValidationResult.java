package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of the sampled integrity check. An {@code errorCount} of {@code -1} means the file
 * could not be assessed at all.
 */
@Value
@Builder
public class ValidationResult {
    public static final int NOT_ASSESSED = -1;

    boolean valid;
    int errorCount;
    String errorMessage;
    double duration;
    @Singular("sample")
    List<String> sampleReport;

    public static ValidationResult notAssessed(String message) {
        return ValidationResult.builder()
                .valid(false)
                .errorCount(NOT_ASSESSED)
                .errorMessage(message)
                .duration(0.0)
                .build();
    }
}
