package com.example.medialibrary.application.job;

import com.example.medialibrary.application.service.LibrarySyncTaskService;
import com.example.medialibrary.common.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic sync. Disabled unless {@code app.sync.cron} is set.
 */
@Service
public class LibrarySyncJob {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncJob.class);

    private final LibrarySyncTaskService librarySyncTaskService;

    public LibrarySyncJob(LibrarySyncTaskService librarySyncTaskService) {
        this.librarySyncTaskService = librarySyncTaskService;
    }

    @Scheduled(cron = "${app.sync.cron:-}")
    public void run() {
        try {
            librarySyncTaskService.start(null);
            log.info("Scheduled library sync triggered");
        } catch (BusinessException e) {
            if ("409".equals(e.getCode())) {
                log.info("Scheduled library sync skipped, a sync is already running");
            } else {
                log.warn("Scheduled library sync not started, code={}, msg={}", e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Scheduled library sync failed unexpectedly", e);
        }
    }
}
