package com.example.audiobook.exception;

/**
 * Thrown when the validated artifact cannot be placed in the destination.
 */
public class DestinationWriteException extends ConversionException {
    public DestinationWriteException(String message) {
        super(message);
    }

    public DestinationWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
