package com.example.audiobook.utils.model;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

/**
 * Download prerequisites handed out by the licensing collaborator.
 */
@Value
@Builder
public class License {
    String downloadUrl;
    long totalBytes;
    @ToString.Exclude String key;
    @ToString.Exclude String iv;
    @Singular
    Map<String, String> requestHeaders;
}
