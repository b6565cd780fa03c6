package com.example.audiobook.exception;

public class DestinationPermissionException extends DestinationWriteException {
    public DestinationPermissionException(String message) {
        super(message);
    }
}
