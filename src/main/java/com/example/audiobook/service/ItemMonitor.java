package com.example.audiobook.service;

import com.example.audiobook.adapters.DownloadEngine;
import com.example.audiobook.exception.ConversionException;
import com.example.audiobook.exception.StatusQueryException;
import com.example.audiobook.utils.model.ErrorEvent;
import com.example.audiobook.utils.model.ItemStatus;
import com.example.audiobook.utils.model.PipelineStage;
import com.example.audiobook.utils.model.ProgressEvent;
import com.example.audiobook.utils.model.WorkItem;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Polls the download engine for a single item and drives it into the conversion stage once the
 * download completed. The monitor stops on the first terminal state, on a failing status query
 * or when its thread is interrupted.
 */
@Slf4j
public class ItemMonitor implements Runnable {
    private static final String UNKNOWN_ERROR = "Unknown error";

    @Getter
    private final WorkItem item;
    private final DownloadEngine downloadEngine;
    private final ConversionService conversionService;
    private final PipelineEventPublisher eventPublisher;
    private final Duration pollInterval;
    private final Consumer<ItemMonitor> onExit;

    /**
     * Indicates if the monitor reached a terminal state of the item before exiting.
     */
    @Getter
    private volatile boolean finished;

    public ItemMonitor(WorkItem item,
                       DownloadEngine downloadEngine,
                       ConversionService conversionService,
                       PipelineEventPublisher eventPublisher,
                       Duration pollInterval,
                       Consumer<ItemMonitor> onExit) {
        this.item = Objects.requireNonNull(item, "item cannot be null");
        this.downloadEngine = Objects.requireNonNull(downloadEngine, "downloadEngine cannot be null");
        this.conversionService = Objects.requireNonNull(conversionService, "conversionService cannot be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        this.onExit = onExit;
    }

    @Override
    public void run() {
        log.debug("Monitoring started for {} (task {})", item.getItemId(), item.getTaskId());
        try {
            monitor();
        } catch (InterruptedException e) {
            log.debug("Monitoring of {} was cancelled", item.getItemId());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Monitoring of {} failed unexpectedly: {}", item.getItemId(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.toString();
            eventPublisher.publishError(new ErrorEvent(item.getItemId(), item.getTitle(), message));
        } finally {
            if (onExit != null) {
                onExit.accept(this);
            }
            log.debug("Monitoring stopped for {}", item.getItemId());
        }
    }

    private void monitor() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            Thread.sleep(pollInterval.toMillis());

            ItemStatus status;
            try {
                status = downloadEngine.getStatus(item.getTaskId());
            } catch (StatusQueryException e) {
                log.warn("Status query for {} failed, stopping monitor: {}", item.getItemId(), e.getMessage());
                return;
            }
            if (status == null || status.getState() == null) {
                log.warn("Task {} of {} is unknown to the download engine, stopping monitor", item.getTaskId(), item.getItemId());
                return;
            }

            switch (status.getState()) {
                case DOWNLOADING:
                    publishDownloadProgress(status);
                    break;
                case QUEUED:
                case PAUSED:
                    break;
                case COMPLETED:
                    finished = true;
                    onDownloadCompleted();
                    return;
                case FAILED:
                    finished = true;
                    String error = status.getError() == null || status.getError().isBlank()
                            ? UNKNOWN_ERROR
                            : status.getError();
                    eventPublisher.publishError(new ErrorEvent(item.getItemId(), item.getTitle(), error));
                    return;
                case CANCELLED:
                    finished = true;
                    log.debug("Task {} of {} was cancelled", item.getTaskId(), item.getItemId());
                    return;
                default:
                    log.warn("Unsupported state {} for {}", status.getState(), item.getItemId());
                    return;
            }
        }
        throw new InterruptedException();
    }

    private void publishDownloadProgress(ItemStatus status) {
        long totalBytes = status.getTotalBytes() > 0 ? status.getTotalBytes() : item.getTotalBytes();
        double percentage = totalBytes > 0 ? (status.getBytesDownloaded() * 100.0) / totalBytes : 0.0;
        eventPublisher.publishProgress(new ProgressEvent(item.getItemId(), PipelineStage.DOWNLOADING,
                percentage, status.getBytesDownloaded(), totalBytes));
    }

    private void onDownloadCompleted() throws InterruptedException {
        log.info("Download completed for {}, starting conversion", item.getItemId());
        try {
            conversionService.convert(item);
        } catch (ConversionException e) {
            eventPublisher.publishError(new ErrorEvent(item.getItemId(), item.getTitle(), e.getMessage()));
        }
    }
}
