package com.example.audiobook.utils.model;

/**
 * Lifecycle states reported by the download engine for a single task.
 */
public enum DownloadState {
    QUEUED,
    DOWNLOADING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
