package com.example.audiobook.exception;

/**
 * Thrown when no relative path can be derived from the naming pattern.
 */
public class PathResolutionException extends PipelineException {
    public PathResolutionException(String message) {
        super(message);
    }
}
