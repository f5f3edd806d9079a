package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.SyncStatusResponse;
import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.enumtype.SyncState;
import com.example.medialibrary.domain.model.SyncResult;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs syncs in the background on the single sync driver thread and keeps the status of the most
 * recent one in memory.
 */
@Service
public class LibrarySyncTaskService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncTaskService.class);

    private final LibrarySyncService librarySyncService;
    private final ExecutorService syncTaskExecutor;
    private final AppSyncProperties appSyncProperties;

    private volatile SyncTask current;

    public LibrarySyncTaskService(LibrarySyncService librarySyncService,
                                  @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor,
                                  AppSyncProperties appSyncProperties) {
        this.librarySyncService = librarySyncService;
        this.syncTaskExecutor = syncTaskExecutor;
        this.appSyncProperties = appSyncProperties;
    }

    /**
     * @throws BusinessException 409 while another sync is pending or running
     */
    public synchronized SyncStatusResponse start(Boolean deepScanOverride) {
        SyncTask previous = current;
        if ((previous != null && !previous.state.isTerminal()) || librarySyncService.isRunning()) {
            throw new BusinessException("409", "Library sync is already running");
        }
        SyncTask task = new SyncTask(UUID.randomUUID().toString());
        try {
            syncTaskExecutor.submit(() -> execute(task, deepScanOverride));
        } catch (RejectedExecutionException e) {
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "Sync could not be scheduled, retry later");
        }
        current = task;
        log.info("LIBRARY_SYNC_TASK_CREATED taskId={} deepScanOverride={}", task.taskId, deepScanOverride);
        return toResponse(task);
    }

    public SyncStatusResponse getStatus() {
        SyncTask task = current;
        return task == null ? null : toResponse(task);
    }

    /**
     * @return false when no sync is pending or running
     */
    public boolean cancel() {
        SyncTask task = current;
        if (task == null || task.state.isTerminal()) {
            return false;
        }
        task.cancelRequested.set(true);
        log.info("LIBRARY_SYNC_TASK_CANCEL_REQUESTED taskId={} state={}", task.taskId, task.state);
        return true;
    }

    private void execute(SyncTask task, Boolean deepScanOverride) {
        log.info("LIBRARY_SYNC_TASK_RUNNING taskId={}", task.taskId);
        try {
            task.result = librarySyncService.sync(deepScanOverride, task.cancelRequested::get, task);
            task.state = task.result.getState();
        } catch (BusinessException e) {
            log.info("LIBRARY_SYNC_TASK_SKIPPED taskId={} code={} reason={}", task.taskId, e.getCode(), e.getMessage());
            task.errorMessage = e.getMessage();
            task.state = SyncState.FAILED;
        } catch (Exception e) {
            log.error("LIBRARY_SYNC_TASK_FAILED taskId={}", task.taskId, e);
            task.errorMessage = e.getMessage();
            task.state = SyncState.FAILED;
        }
    }

    private SyncStatusResponse toResponse(SyncTask task) {
        SyncStatusResponse response = new SyncStatusResponse();
        response.setTaskId(task.taskId);
        response.setState(task.state.name());
        response.setCancelRequested(task.cancelRequested.get());
        response.setProcessed(task.processed);
        response.setTotal(task.total);
        SyncResult result = task.result;
        if (result != null) {
            response.setEnumeratedCount(result.getEnumeratedCount());
            response.setFilteredOutCount(result.getFilteredOutCount());
            response.setSongCount(result.getSongCount());
            response.setAlbumCount(result.getAlbumCount());
            response.setArtistCount(result.getArtistCount());
            response.setCrossRefCount(result.getCrossRefCount());
            response.setErrorMessage(result.getErrorMessage());
            response.setElapsedMs(result.getElapsedMs());
        } else {
            response.setErrorMessage(task.errorMessage);
        }
        return response;
    }

    private final class SyncTask implements SyncProgressListener {
        private final String taskId;
        private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
        private volatile SyncState state = SyncState.IDLE;
        private volatile int processed;
        private volatile int total;
        private volatile SyncResult result;
        private volatile String errorMessage;
        private int loggedBucket;

        private SyncTask(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public void onStateChanged(SyncState newState) {
            // terminal states are published together with the result in execute()
            if (!newState.isTerminal()) {
                state = newState;
            }
        }

        @Override
        public void onProgress(int processedCount, int totalCount) {
            processed = processedCount;
            total = totalCount;
            int interval = Math.max(1, appSyncProperties.getProgressLogInterval());
            int bucket = processedCount / interval;
            if (processedCount == totalCount || bucket != loggedBucket) {
                loggedBucket = bucket;
                log.info("LIBRARY_SYNC_PROGRESS taskId={} processed={} total={}", taskId, processedCount, totalCount);
            }
        }
    }
}
