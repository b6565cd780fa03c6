package com.example.audiobook.exception;

/**
 * Fatal failure of one conversion attempt.
 */
public class ConversionException extends PipelineException {
    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
