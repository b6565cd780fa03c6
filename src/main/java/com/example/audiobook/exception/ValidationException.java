package com.example.audiobook.exception;

import com.example.audiobook.utils.model.ValidationResult;
import lombok.Getter;

/**
 * Thrown when a transcoded file fails the integrity check. Both staging artifacts are gone by
 * the time this is raised.
 */
@Getter
public class ValidationException extends ConversionException {
    private final ValidationResult result;

    public ValidationException(String message, ValidationResult result) {
        super(message);
        this.result = result;
    }
}
