package com.example.audiobook.exception;

/**
 * Thrown when the download engine rejects an enqueue, pause, resume or cancel call.
 */
public class DownloadEngineException extends PipelineException {
    public DownloadEngineException(String message) {
        super(message);
    }

    public DownloadEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
