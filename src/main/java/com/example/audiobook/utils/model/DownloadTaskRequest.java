package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Map;

@Value
@Builder
public class DownloadTaskRequest {
    String itemId;
    String title;
    String downloadUrl;
    long totalBytes;
    Path downloadPath;
    Path outputPath;
    @Singular
    Map<String, String> requestHeaders;
}
