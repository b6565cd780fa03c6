package com.example.audiobook.utils.model;

import lombok.Value;

@Value
public class ProgressEvent {
    String itemId;
    PipelineStage stage;
    double percentage;
    long bytesDownloaded;
    long totalBytes;

    public static ProgressEvent stageStarted(String itemId, PipelineStage stage) {
        return new ProgressEvent(itemId, stage, 0.0, 0, 0);
    }
}
