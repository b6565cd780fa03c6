package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;

/**
 * One acquisition in flight. Lives as long as its monitor and is never persisted.
 */
@Value
@Builder(toBuilder = true)
public class WorkItem {
    @NonNull String itemId;
    @NonNull String taskId;
    String title;
    @NonNull Path encryptedPath;
    @NonNull Path decryptedPath;
    @NonNull String destinationDirectory;
    @ToString.Exclude String key;
    @ToString.Exclude String iv;
    long totalBytes;
}
