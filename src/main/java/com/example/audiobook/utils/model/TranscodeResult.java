package com.example.audiobook.utils.model;

import lombok.Value;

@Value
public class TranscodeResult {
    boolean success;
    int returnCode;
    String log;

    public static TranscodeResult success(String log) {
        return new TranscodeResult(true, 0, log);
    }

    public static TranscodeResult failure(int returnCode, String log) {
        return new TranscodeResult(false, returnCode, log);
    }
}
