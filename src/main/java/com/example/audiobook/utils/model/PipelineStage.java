package com.example.audiobook.utils.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PipelineStage {
    DOWNLOADING("downloading"),
    DECRYPTING("decrypting"),
    VALIDATING("validating"),
    COPYING("copying");

    private final String label;
}
