package com.example.audiobook.exception;

/**
 * Thrown when the download engine cannot report the status of a task.
 */
public class StatusQueryException extends PipelineException {
    public StatusQueryException(String message) {
        super(message);
    }

    public StatusQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
