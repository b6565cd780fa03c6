package com.example.audiobook.exception;

public class LicenseException extends PipelineException {
    public LicenseException(String message) {
        super(message);
    }

    public LicenseException(String message, Throwable cause) {
        super(message, cause);
    }
}
