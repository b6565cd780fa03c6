package com.example.audiobook.service;

import com.example.audiobook.adapters.ConnectivityListener;
import com.example.audiobook.adapters.ConnectivityMonitor;
import com.example.audiobook.adapters.DownloadEngine;
import com.example.audiobook.adapters.PreferenceStore;
import com.example.audiobook.exception.DownloadEngineException;
import com.example.audiobook.exception.StatusQueryException;
import com.example.audiobook.utils.model.DownloadState;
import com.example.audiobook.utils.model.ItemStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Applies the restricted-network policy to the download engine. Losing a qualifying network
 * pauses every active download, regaining it resumes every paused download which was not
 * paused by the user.
 */
@Slf4j
@Service
public class NetworkPolicyService implements ConnectivityListener {
    private final PreferenceStore preferenceStore;
    private final ConnectivityMonitor connectivityMonitor;
    private final DownloadEngine downloadEngine;
    private final ManualPauseLedger manualPauseLedger;
    private final ItemLockRegistry itemLocks;
    private final Executor executor;

    private volatile boolean restrictedOnly;
    private volatile boolean started;

    public NetworkPolicyService(PreferenceStore preferenceStore,
                                ConnectivityMonitor connectivityMonitor,
                                DownloadEngine downloadEngine,
                                ManualPauseLedger manualPauseLedger,
                                ItemLockRegistry itemLocks,
                                @Qualifier("pipelineExecutor") Executor executor) {
        this.preferenceStore = preferenceStore;
        this.connectivityMonitor = connectivityMonitor;
        this.downloadEngine = downloadEngine;
        this.manualPauseLedger = manualPauseLedger;
        this.itemLocks = itemLocks;
        this.executor = executor;
    }

    /**
     * Start observing connectivity transitions.
     */
    public synchronized void init() {
        if (started) {
            return;
        }
        restrictedOnly = preferenceStore.isRestrictedOnly();
        connectivityMonitor.addListener(this);
        connectivityMonitor.start();
        started = true;
        log.info("Network policy started, restricted-only mode {}", restrictedOnly ? "enabled" : "disabled");

        if (restrictedOnly && !connectivityMonitor.isQualifyingNetworkAvailable()) {
            executor.execute(this::pauseActiveDownloads);
        }
    }

    /**
     * Release the connectivity observation.
     */
    public synchronized void shutdown() {
        if (!started) {
            return;
        }
        connectivityMonitor.removeListener(this);
        connectivityMonitor.stop();
        started = false;
        log.debug("Network policy stopped");
    }

    public boolean isRestrictedOnlyMode() {
        return restrictedOnly;
    }

    /**
     * Update the restricted-only preference and apply it to the current downloads.
     *
     * @param enabled Indicates if downloads may only run on a qualifying network.
     */
    public void setRestrictedOnlyMode(boolean enabled) {
        preferenceStore.setRestrictedOnly(enabled);
        restrictedOnly = enabled;
        log.info("Restricted-only mode {}", enabled ? "enabled" : "disabled");

        if (enabled && !connectivityMonitor.isQualifyingNetworkAvailable()) {
            executor.execute(this::pauseActiveDownloads);
        } else {
            executor.execute(this::resumePausedDownloads);
        }
    }

    @Override
    public void onAvailable() {
        if (restrictedOnly) {
            log.info("Qualifying network available, resuming paused downloads");
            executor.execute(this::resumePausedDownloads);
        }
    }

    @Override
    public void onLost() {
        if (restrictedOnly) {
            log.info("Qualifying network lost, pausing active downloads");
            executor.execute(this::pauseActiveDownloads);
        }
    }

    /**
     * Pause every download which is currently transferring.
     *
     * @return Returns the number of paused downloads.
     */
    public int pauseActiveDownloads() {
        List<ItemStatus> active = listByStatus(DownloadState.DOWNLOADING);
        int paused = 0;
        for (ItemStatus status : active) {
            try {
                downloadEngine.pause(status.getTaskId());
                paused++;
            } catch (DownloadEngineException e) {
                log.warn("Failed to pause {}: {}", status.getItemId(), e.getMessage());
            }
        }
        log.debug("Paused {} of {} active downloads", paused, active.size());
        return paused;
    }

    /**
     * Resume every paused download, except the ones the user paused explicitly.
     *
     * @return Returns the number of resumed downloads.
     */
    public int resumePausedDownloads() {
        List<ItemStatus> paused = listByStatus(DownloadState.PAUSED);
        int resumed = 0;
        for (ItemStatus status : paused) {
            if (itemLocks.withLock(status.getItemId(), () -> resumeUnlessManuallyPaused(status))) {
                resumed++;
            }
        }
        log.debug("Resumed {} of {} paused downloads", resumed, paused.size());
        return resumed;
    }

    private boolean resumeUnlessManuallyPaused(ItemStatus status) {
        try {
            if (manualPauseLedger.contains(status.getItemId())) {
                log.debug("Skipping {}, it was paused manually", status.getItemId());
                return false;
            }
        } catch (RuntimeException e) {
            log.warn("Skipping {}, manual pause state unavailable: {}", status.getItemId(), e.getMessage());
            return false;
        }
        try {
            downloadEngine.resume(status.getTaskId());
            return true;
        } catch (DownloadEngineException e) {
            log.warn("Failed to resume {}: {}", status.getItemId(), e.getMessage());
            return false;
        }
    }

    private List<ItemStatus> listByStatus(DownloadState state) {
        try {
            return downloadEngine.listByStatus(state);
        } catch (StatusQueryException e) {
            log.warn("Failed to list {} downloads: {}", state, e.getMessage());
            return List.of();
        }
    }
}
