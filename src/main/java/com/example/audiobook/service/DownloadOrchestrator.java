package com.example.audiobook.service;

import com.example.audiobook.adapters.DownloadEngine;
import com.example.audiobook.adapters.LicenseProvider;
import com.example.audiobook.config.ApplicationConfig;
import com.example.audiobook.exception.DownloadEngineException;
import com.example.audiobook.exception.LicenseException;
import com.example.audiobook.exception.StatusQueryException;
import com.example.audiobook.utils.model.DownloadState;
import com.example.audiobook.utils.model.DownloadTaskRequest;
import com.example.audiobook.utils.model.EnqueueRequest;
import com.example.audiobook.utils.model.ErrorEvent;
import com.example.audiobook.utils.model.ItemStatus;
import com.example.audiobook.utils.model.License;
import com.example.audiobook.utils.model.PipelineStage;
import com.example.audiobook.utils.model.ProgressEvent;
import com.example.audiobook.utils.model.WorkItem;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.stream.Collectors;

/**
 * Entry point of the acquisition pipeline. Every public operation reports failures through its
 * return value and the registered {@link PipelineListener}s, never by throwing.
 */
@Slf4j
@Service
public class DownloadOrchestrator {
    private static final String STAGING_EXTENSION_ENCRYPTED = ".aax";
    private static final String STAGING_EXTENSION_DECRYPTED = ".m4b";
    private static final Set<DownloadState> CONTROLLABLE_STATES =
            EnumSet.of(DownloadState.QUEUED, DownloadState.DOWNLOADING, DownloadState.PAUSED);

    private final DownloadEngine downloadEngine;
    private final LicenseProvider licenseProvider;
    private final ConversionService conversionService;
    private final NetworkPolicyService networkPolicy;
    private final ManualPauseLedger manualPauseLedger;
    private final ItemLockRegistry itemLocks;
    private final PipelineEventPublisher eventPublisher;
    private final Validator validator;
    private final ApplicationConfig config;
    private final Executor executor;

    private final Map<String, MonitorHandle> monitors = new ConcurrentHashMap<>();
    private final Map<String, String> taskIds = new ConcurrentHashMap<>();

    public DownloadOrchestrator(DownloadEngine downloadEngine,
                                LicenseProvider licenseProvider,
                                ConversionService conversionService,
                                NetworkPolicyService networkPolicy,
                                ManualPauseLedger manualPauseLedger,
                                ItemLockRegistry itemLocks,
                                PipelineEventPublisher eventPublisher,
                                Validator validator,
                                ApplicationConfig config,
                                @Qualifier("pipelineExecutor") Executor executor) {
        this.downloadEngine = downloadEngine;
        this.licenseProvider = licenseProvider;
        this.conversionService = conversionService;
        this.networkPolicy = networkPolicy;
        this.manualPauseLedger = manualPauseLedger;
        this.itemLocks = itemLocks;
        this.eventPublisher = eventPublisher;
        this.validator = validator;
        this.config = config;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        networkPolicy.init();
    }

    //region Listeners

    public void addListener(PipelineListener listener) {
        if (listener == null) {
            log.warn("Ignoring null pipeline listener");
            return;
        }
        eventPublisher.addListener(listener);
    }

    public void removeListener(PipelineListener listener) {
        eventPublisher.removeListener(listener);
    }

    //endregion

    //region Lifecycle

    /**
     * Queue the acquisition of an item and start monitoring it.
     *
     * @param request The item to acquire.
     * @return Returns the download task id, or empty when the item could not be queued.
     */
    public Optional<String> enqueue(EnqueueRequest request) {
        if (request == null) {
            log.error("Unable to enqueue, no request given");
            return Optional.empty();
        }
        Set<ConstraintViolation<EnqueueRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining(", "));
            eventPublisher.publishError(new ErrorEvent(request.getItemId(), request.getTitle(), "Invalid request: " + message));
            return Optional.empty();
        }

        String itemId = request.getItemId();
        String quality = Optional.ofNullable(request.getQuality())
                .filter(e -> !e.isBlank())
                .orElse(config.getDefaultQuality());
        log.info("Enqueueing {} - {}", itemId, request.getTitle());

        try {
            License license = licenseProvider.obtainLicense(itemId, quality);
            log.debug("License obtained for {}, size {} MB", itemId, license.getTotalBytes() / 1024 / 1024);

            Path stagingPath = config.getStagingPath();
            Files.createDirectories(stagingPath);
            Path encryptedPath = stagingPath.resolve(itemId + STAGING_EXTENSION_ENCRYPTED);
            Path decryptedPath = stagingPath.resolve(itemId + STAGING_EXTENSION_DECRYPTED);

            String taskId = downloadEngine.enqueue(DownloadTaskRequest.builder()
                    .itemId(itemId)
                    .title(request.getTitle())
                    .downloadUrl(license.getDownloadUrl())
                    .totalBytes(license.getTotalBytes())
                    .downloadPath(encryptedPath)
                    .outputPath(decryptedPath)
                    .requestHeaders(license.getRequestHeaders())
                    .build());
            log.info("Download of {} enqueued as task {}", itemId, taskId);

            startMonitoring(WorkItem.builder()
                    .itemId(itemId)
                    .taskId(taskId)
                    .title(request.getTitle())
                    .encryptedPath(encryptedPath)
                    .decryptedPath(decryptedPath)
                    .destinationDirectory(request.getDestinationDirectory())
                    .key(license.getKey())
                    .iv(license.getIv())
                    .totalBytes(license.getTotalBytes())
                    .build());
            return Optional.of(taskId);
        } catch (LicenseException | DownloadEngineException e) {
            eventPublisher.publishError(new ErrorEvent(itemId, request.getTitle(), e.getMessage()));
        } catch (IOException e) {
            eventPublisher.publishError(new ErrorEvent(itemId, request.getTitle(),
                    "Failed to prepare staging directory: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error while enqueueing {}", itemId, e);
            eventPublisher.publishError(new ErrorEvent(itemId, request.getTitle(), e.getMessage()));
        }
        return Optional.empty();
    }

    /**
     * Start monitoring the given item, replacing any monitor which already exists for it.
     * This is also the restart path for items which were queued in an earlier session.
     *
     * @param item The item to monitor.
     */
    public boolean startMonitoring(WorkItem item) {
        if (item == null) {
            log.error("Unable to start monitoring, no item given");
            return false;
        }
        String itemId = item.getItemId();

        return itemLocks.withLock(itemId, () -> {
            ItemMonitor monitor = new ItemMonitor(item, downloadEngine, conversionService, eventPublisher,
                    config.getPollInterval(), this::onMonitorExit);
            MonitorHandle handle = new MonitorHandle(monitor, new FutureTask<Void>(monitor, null));

            MonitorHandle previous = monitors.put(itemId, handle);
            if (previous != null) {
                log.debug("Replacing existing monitor of {}", itemId);
                previous.cancel();
            }
            taskIds.put(itemId, item.getTaskId());

            eventPublisher.publishProgress(new ProgressEvent(itemId, PipelineStage.DOWNLOADING, 0.0, 0, item.getTotalBytes()));
            try {
                executor.execute(handle.getTask());
                return true;
            } catch (RuntimeException e) {
                monitors.remove(itemId, handle);
                eventPublisher.publishError(new ErrorEvent(itemId, item.getTitle(),
                        "Failed to start monitoring: " + e.getMessage()));
                return false;
            }
        });
    }

    /**
     * Cancel the monitor of the item without touching the download task itself.
     *
     * @return Returns true when a monitor was stopped.
     */
    public boolean stopMonitoring(String itemId) {
        return itemLocks.withLock(itemId, () -> {
            MonitorHandle handle = monitors.remove(itemId);
            clearLedgerEntry(itemId);
            if (handle == null) {
                return false;
            }
            handle.cancel();
            log.debug("Stopped monitoring {}", itemId);
            return true;
        });
    }

    /**
     * Cancel the acquisition of the item. Cancelling an unknown or already cancelled item is a no-op.
     *
     * @return Returns true when the item was cancelled by this call.
     */
    public boolean cancel(String itemId) {
        return itemLocks.withLock(itemId, () -> {
            MonitorHandle handle = monitors.remove(itemId);
            String taskId = taskIds.remove(itemId);
            if (handle == null && taskId == null) {
                log.debug("Nothing to cancel for {}", itemId);
                return false;
            }

            if (handle != null) {
                handle.cancel();
            }
            clearLedgerEntry(itemId);
            if (taskId != null) {
                try {
                    downloadEngine.cancel(taskId);
                } catch (DownloadEngineException e) {
                    log.warn("Download engine failed to cancel task {} of {}: {}", taskId, itemId, e.getMessage());
                }
            }
            log.info("Cancelled {}", itemId);
            return true;
        });
    }

    /**
     * Pause the download of the item on behalf of the user. The item will not be resumed by the
     * network policy until it is resumed manually.
     *
     * @return Returns true when the download was paused.
     */
    public boolean manuallyPause(String itemId) {
        return itemLocks.withLock(itemId, () -> resolveTaskId(itemId)
                .map(taskId -> pause(itemId, taskId))
                .orElseGet(() -> {
                    log.warn("Unable to pause {}, no download task found", itemId);
                    return false;
                }));
    }

    public boolean manuallyPause(String itemId, String taskId) {
        return itemLocks.withLock(itemId, () -> pause(itemId, taskId));
    }

    /**
     * Resume a download which was paused on behalf of the user.
     *
     * @return Returns true when the download was resumed.
     */
    public boolean manuallyResume(String itemId) {
        return itemLocks.withLock(itemId, () -> resolveTaskId(itemId)
                .map(taskId -> resume(itemId, taskId))
                .orElseGet(() -> {
                    log.warn("Unable to resume {}, no download task found", itemId);
                    return false;
                }));
    }

    public boolean manuallyResume(String itemId, String taskId) {
        return itemLocks.withLock(itemId, () -> resume(itemId, taskId));
    }

    public boolean isRestrictedOnlyMode() {
        return networkPolicy.isRestrictedOnlyMode();
    }

    /**
     * Update the restricted-only preference.
     *
     * @return Returns true when the preference was stored and applied.
     */
    public boolean setRestrictedOnlyMode(boolean enabled) {
        try {
            networkPolicy.setRestrictedOnlyMode(enabled);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to update restricted-only mode: {}", e.getMessage(), e);
            return false;
        }
    }

    public Set<String> getActiveItemIds() {
        return Set.copyOf(monitors.keySet());
    }

    public boolean isMonitoring(String itemId) {
        return monitors.containsKey(itemId);
    }

    /**
     * Cancel every active monitor and release the connectivity observation.
     */
    @PreDestroy
    public void shutdown() {
        log.debug("Shutting down the download orchestrator");
        monitors.forEach((itemId, handle) -> handle.cancel());
        monitors.clear();
        taskIds.clear();
        try {
            networkPolicy.shutdown();
        } catch (RuntimeException e) {
            log.warn("Failed to release the network policy: {}", e.getMessage(), e);
        }
        eventPublisher.removeAllListeners();
    }

    //endregion

    //region Functions

    // the ledger entry always precedes the engine pause
    private boolean pause(String itemId, String taskId) {
        boolean marked;
        try {
            marked = manualPauseLedger.mark(itemId);
        } catch (RuntimeException e) {
            log.error("Failed to record manual pause of {}, download not paused: {}", itemId, e.getMessage(), e);
            return false;
        }

        try {
            downloadEngine.pause(taskId);
            log.info("Manually paused {}", itemId);
            return true;
        } catch (DownloadEngineException | RuntimeException e) {
            log.error("Failed to pause {}: {}", itemId, e.getMessage());
            if (marked) {
                clearLedgerEntry(itemId);
            }
            return false;
        }
    }

    private boolean resume(String itemId, String taskId) {
        boolean cleared;
        try {
            cleared = manualPauseLedger.clear(itemId);
        } catch (RuntimeException e) {
            log.error("Failed to clear manual pause of {}, download not resumed: {}", itemId, e.getMessage(), e);
            return false;
        }

        try {
            downloadEngine.resume(taskId);
            log.info("Manually resumed {}", itemId);
            return true;
        } catch (DownloadEngineException | RuntimeException e) {
            log.error("Failed to resume {}: {}", itemId, e.getMessage());
            if (cleared) {
                restoreLedgerEntry(itemId);
            }
            return false;
        }
    }

    private void clearLedgerEntry(String itemId) {
        try {
            manualPauseLedger.clear(itemId);
        } catch (RuntimeException e) {
            log.warn("Failed to clear manual pause marker of {}: {}", itemId, e.getMessage());
        }
    }

    private void restoreLedgerEntry(String itemId) {
        try {
            manualPauseLedger.mark(itemId);
        } catch (RuntimeException e) {
            log.warn("Failed to restore manual pause marker of {}: {}", itemId, e.getMessage());
        }
    }

    private Optional<String> resolveTaskId(String itemId) {
        String taskId = taskIds.get(itemId);
        if (taskId != null) {
            return Optional.of(taskId);
        }

        for (DownloadState state : CONTROLLABLE_STATES) {
            try {
                Optional<String> found = downloadEngine.listByStatus(state).stream()
                        .filter(e -> itemId.equals(e.getItemId()))
                        .map(ItemStatus::getTaskId)
                        .findFirst();
                if (found.isPresent()) {
                    return found;
                }
            } catch (StatusQueryException e) {
                log.warn("Failed to look up the task of {}: {}", itemId, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private void onMonitorExit(ItemMonitor monitor) {
        String itemId = monitor.getItem().getItemId();
        monitors.computeIfPresent(itemId, (key, handle) -> handle.getMonitor() == monitor ? null : handle);
        if (monitor.isFinished()) {
            taskIds.remove(itemId, monitor.getItem().getTaskId());
        }
    }

    //endregion

    @Value
    private static class MonitorHandle {
        ItemMonitor monitor;
        FutureTask<Void> task;

        void cancel() {
            task.cancel(true);
        }
    }
}
