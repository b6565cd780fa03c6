package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a download task as owned by the download engine.
 */
@Value
@Builder
public class ItemStatus {
    String taskId;
    String itemId;
    DownloadState state;
    long bytesDownloaded;
    long totalBytes;
    String error;

    public double getPercentage() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return (bytesDownloaded * 100.0) / totalBytes;
    }
}
