package com.example.audiobook.adapters;

import com.example.audiobook.exception.DownloadEngineException;
import com.example.audiobook.exception.StatusQueryException;
import com.example.audiobook.utils.model.DownloadState;
import com.example.audiobook.utils.model.DownloadTaskRequest;
import com.example.audiobook.utils.model.ItemStatus;

import java.util.List;

/**
 * Queued download engine which owns byte transfer, resumption and task persistence.
 * The pipeline only observes and steers tasks through this contract.
 */
public interface DownloadEngine {
    /**
     * Queue a new download task.
     *
     * @param request The task to queue.
     * @return Returns the id of the created task.
     * @throws DownloadEngineException Is thrown when the engine refuses the task.
     */
    String enqueue(DownloadTaskRequest request) throws DownloadEngineException;

    /**
     * Get the current status of a task.
     *
     * @param taskId The task id returned by {@link #enqueue(DownloadTaskRequest)}.
     * @return Returns the status snapshot.
     * @throws StatusQueryException Is thrown when the engine is unreachable or the answer is unreadable.
     */
    ItemStatus getStatus(String taskId) throws StatusQueryException;

    /**
     * List all tasks in the given state.
     */
    List<ItemStatus> listByStatus(DownloadState state) throws StatusQueryException;

    void pause(String taskId) throws DownloadEngineException;

    void resume(String taskId) throws DownloadEngineException;

    void cancel(String taskId) throws DownloadEngineException;
}
