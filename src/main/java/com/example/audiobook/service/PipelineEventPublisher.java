package com.example.audiobook.service;

import com.example.audiobook.utils.model.CompletionEvent;
import com.example.audiobook.utils.model.ErrorEvent;
import com.example.audiobook.utils.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Consumer;

@Slf4j
@Component
public class PipelineEventPublisher {
    private final Queue<PipelineListener> listeners = new ConcurrentLinkedQueue<>();

    /**
     * Register the listener within the publisher.
     *
     * @param listener The listener to add.
     */
    public void addListener(PipelineListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
    }

    /**
     * Remove the listener from the publisher.
     *
     * @param listener The listener to remove.
     */
    public void removeListener(PipelineListener listener) {
        listeners.remove(listener);
    }

    public void removeAllListeners() {
        listeners.clear();
    }

    public void publishProgress(ProgressEvent event) {
        invokeListeners(e -> e.onProgress(event));
    }

    public void publishCompletion(CompletionEvent event) {
        log.info("Item {} completed: {}", event.getItemId(), event.getFinalPath());
        invokeListeners(e -> e.onCompletion(event));
    }

    public void publishError(ErrorEvent event) {
        log.error("Item {} failed: {}", event.getItemId(), event.getErrorMessage());
        invokeListeners(e -> e.onError(event));
    }

    private void invokeListeners(Consumer<PipelineListener> action) {
        for (PipelineListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.error("Pipeline listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}
