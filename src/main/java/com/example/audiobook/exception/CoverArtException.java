package com.example.audiobook.exception;

/**
 * Cover art could not be fetched or rendered. Never fatal for an item.
 */
public class CoverArtException extends PipelineException {
    public CoverArtException(String message) {
        super(message);
    }

    public CoverArtException(String message, Throwable cause) {
        super(message, cause);
    }
}
