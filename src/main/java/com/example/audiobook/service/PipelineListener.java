package com.example.audiobook.service;

import com.example.audiobook.utils.model.CompletionEvent;
import com.example.audiobook.utils.model.ErrorEvent;
import com.example.audiobook.utils.model.ProgressEvent;

/**
 * Receives the events of the acquisition pipeline. Every event is delivered at most once and
 * is not retained afterwards.
 */
public interface PipelineListener {
    default void onProgress(ProgressEvent event) {
    }

    default void onCompletion(CompletionEvent event) {
    }

    default void onError(ErrorEvent event) {
    }
}
