package com.example.audiobook.exception;

/**
 * Base type of every failure raised inside the acquisition pipeline.
 */
public class PipelineException extends Exception {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
