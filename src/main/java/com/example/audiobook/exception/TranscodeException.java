package com.example.audiobook.exception;

import lombok.Getter;

/**
 * Thrown when the transcoding engine reports failure. The encrypted input is kept for a retry.
 */
@Getter
public class TranscodeException extends ConversionException {
    private final int returnCode;

    public TranscodeException(String message, int returnCode) {
        super(message);
        this.returnCode = returnCode;
    }

    public TranscodeException(String message, Throwable cause) {
        super(message, cause);
        this.returnCode = -1;
    }
}
