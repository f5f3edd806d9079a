package com.example.medialibrary.application.service;

import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.enumtype.BatchWorkload;
import com.example.medialibrary.domain.enumtype.SyncState;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.domain.model.EnrichedRecord;
import com.example.medialibrary.domain.model.RawFileRecord;
import com.example.medialibrary.domain.model.SyncPreferences;
import com.example.medialibrary.domain.model.SyncResult;
import com.example.medialibrary.infrastructure.catalog.MediaCatalog;
import com.example.medialibrary.infrastructure.preference.LibraryPreferences;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Drives one library sync through
 * {@code IDLE -> ENUMERATING -> FILTERING -> (DEEP_SCANNING) -> MERGING -> PERSISTING -> DONE}.
 *
 * <p>Directory rules are applied to every record before any file is opened. Deep-scan extraction
 * runs in batches on the I/O pool, merging runs on the CPU pool, and everything is written in one
 * transaction. Per-file extraction problems degrade single fields; preference, enumeration, merge
 * and persistence failures end the sync in {@code FAILED}. A cancel request is honoured between
 * stages and between deep-scan batches and ends in {@code CANCELED} with nothing written.
 */
@Service
public class LibrarySyncService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncService.class);

    private final MediaCatalog mediaCatalog;
    private final LibraryPreferences libraryPreferences;
    private final ParallelBatchProcessor batchProcessor;
    private final AudioMetaService audioMetaService;
    private final AlbumArtService albumArtService;
    private final LibraryMergeService libraryMergeService;
    private final LibraryStore libraryStore;
    private final SyncMetrics syncMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public LibrarySyncService(MediaCatalog mediaCatalog,
                              LibraryPreferences libraryPreferences,
                              ParallelBatchProcessor batchProcessor,
                              AudioMetaService audioMetaService,
                              AlbumArtService albumArtService,
                              LibraryMergeService libraryMergeService,
                              LibraryStore libraryStore,
                              SyncMetrics syncMetrics) {
        this.mediaCatalog = mediaCatalog;
        this.libraryPreferences = libraryPreferences;
        this.batchProcessor = batchProcessor;
        this.audioMetaService = audioMetaService;
        this.albumArtService = albumArtService;
        this.libraryMergeService = libraryMergeService;
        this.libraryStore = libraryStore;
        this.syncMetrics = syncMetrics;
    }

    public SyncResult sync() {
        return sync(null, null, SyncProgressListener.NOOP);
    }

    /**
     * Runs a full sync on the calling thread.
     *
     * @param deepScanOverride forces the deep-scan flag when non-null, otherwise the preference wins
     * @param cancelSignal polled between stages and batches, may be null
     * @throws BusinessException with code 409 when another sync is already running
     */
    public SyncResult sync(Boolean deepScanOverride, BooleanSupplier cancelSignal, SyncProgressListener listener) {
        if (!running.compareAndSet(false, true)) {
            throw new BusinessException("409", "Library sync is already running");
        }
        SyncProgressListener progress = listener == null ? SyncProgressListener.NOOP : listener;
        String syncId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("syncId", syncId);
        SyncResult result = new SyncResult();
        long startedAt = System.nanoTime();
        try {
            doSync(result, deepScanOverride, cancelSignal, progress);
        } finally {
            result.setElapsedMs((System.nanoTime() - startedAt) / 1_000_000L);
            syncMetrics.incrementCounter("library.sync.runs", 1,
                    "state", result.getState().name().toLowerCase(Locale.ROOT));
            log.info("LIBRARY_SYNC_END state={} lastStage={} songs={} albums={} artists={} crossRefs={} elapsedMs={}",
                    result.getState(), result.getLastStage(), result.getSongCount(), result.getAlbumCount(),
                    result.getArtistCount(), result.getCrossRefCount(), result.getElapsedMs());
            MDC.remove("syncId");
            running.set(false);
        }
        return result;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void doSync(SyncResult result,
                        Boolean deepScanOverride,
                        BooleanSupplier cancelSignal,
                        SyncProgressListener progress) {
        SyncPreferences preferences;
        try {
            preferences = libraryPreferences.snapshot();
            if (deepScanOverride != null) {
                preferences = preferences.withDeepScan(deepScanOverride);
            }
        } catch (RuntimeException e) {
            fail(result, progress, "Preferences unavailable: " + e.getMessage(), e);
            return;
        }
        result.setDeepScan(preferences.isDeepScan());
        log.info("LIBRARY_SYNC_START deepScan={} blocked={} allowed={}", preferences.isDeepScan(),
                preferences.getBlockedDirectories().size(), preferences.getAllowedDirectories().size());

        try {
            checkCanceled(cancelSignal);
            long stageStart = enter(result, progress, SyncState.ENUMERATING);
            List<RawFileRecord> records = mediaCatalog.enumerate();
            result.setEnumeratedCount(records.size());
            syncMetrics.incrementCounter("library.sync.records", records.size(), "stage", "enumerated");
            leave(SyncState.ENUMERATING, stageStart);

            checkCanceled(cancelSignal);
            stageStart = enter(result, progress, SyncState.FILTERING);
            List<RawFileRecord> filtered = filter(records, DirectoryRuleResolver.from(preferences));
            result.setFilteredOutCount(records.size() - filtered.size());
            syncMetrics.incrementCounter("library.sync.records", result.getFilteredOutCount(), "stage", "filtered_out");
            leave(SyncState.FILTERING, stageStart);

            List<EnrichedRecord> enriched;
            if (preferences.isDeepScan()) {
                checkCanceled(cancelSignal);
                stageStart = enter(result, progress, SyncState.DEEP_SCANNING);
                enriched = batchProcessor.processWithProgress(
                        filtered,
                        batchProcessor.optimalBatchSize(filtered.size(), BatchWorkload.IO),
                        BatchWorkload.IO,
                        progress::onProgress,
                        cancelSignal,
                        this::enrich);
                result.setDeepScannedCount(enriched.size());
                leave(SyncState.DEEP_SCANNING, stageStart);
            } else {
                enriched = new ArrayList<>(filtered.size());
                for (RawFileRecord record : filtered) {
                    enriched.add(EnrichedRecord.plain(record));
                }
            }

            checkCanceled(cancelSignal);
            stageStart = enter(result, progress, SyncState.MERGING);
            final List<EnrichedRecord> mergeInput = enriched;
            MergeResult merged = batchProcessor.runOn(BatchWorkload.CPU,
                    () -> libraryMergeService.merge(mergeInput));
            leave(SyncState.MERGING, stageStart);

            checkCanceled(cancelSignal);
            stageStart = enter(result, progress, SyncState.PERSISTING);
            libraryStore.replaceAll(merged);
            leave(SyncState.PERSISTING, stageStart);

            result.setSongCount(merged.getSongs().size());
            result.setAlbumCount(merged.getAlbums().size());
            result.setArtistCount(merged.getArtists().size());
            result.setCrossRefCount(merged.getCrossRefs().size());
            syncMetrics.incrementCounter("library.sync.records", merged.getSongs().size(), "stage", "persisted");
            result.setState(SyncState.DONE);
            progress.onStateChanged(SyncState.DONE);
        } catch (CancellationException e) {
            log.info("LIBRARY_SYNC_CANCELED lastStage={}", result.getLastStage());
            result.setState(SyncState.CANCELED);
            result.setErrorMessage("Canceled");
            progress.onStateChanged(SyncState.CANCELED);
        } catch (RuntimeException e) {
            fail(result, progress, result.getLastStage() + " failed: " + e.getMessage(), e);
        }
    }

    private List<RawFileRecord> filter(List<RawFileRecord> records, DirectoryRuleResolver resolver) {
        if (!resolver.hasRules()) {
            return records;
        }
        List<RawFileRecord> allowed = new ArrayList<>(records.size());
        for (RawFileRecord record : records) {
            if (resolver.isAllowed(record.parentDirectory())) {
                allowed.add(record);
            }
        }
        return allowed;
    }

    private EnrichedRecord enrich(RawFileRecord record) {
        try {
            AudioMeta audioMeta = audioMetaService.getAudioMetadata(record.getId(), record.getPath(), true);
            String albumArtUri = albumArtService.getAlbumArtUri(
                    libraryMergeService.resolveAlbumId(record), record.getId(), record.getPath(), true);
            return new EnrichedRecord(record, audioMeta, albumArtUri);
        } catch (RuntimeException e) {
            log.warn("LIBRARY_SYNC_ENRICH_FAILED songId={} path={} reason={}",
                    record.getId(), record.getPath(), e.getMessage());
            return EnrichedRecord.plain(record);
        }
    }

    private long enter(SyncResult result, SyncProgressListener progress, SyncState state) {
        result.setState(state);
        result.setLastStage(state);
        progress.onStateChanged(state);
        log.debug("LIBRARY_SYNC_STAGE stage={}", state);
        return System.nanoTime();
    }

    private void leave(SyncState state, long stageStart) {
        syncMetrics.recordDuration("library.sync.stage.duration", System.nanoTime() - stageStart,
                "stage", state.name().toLowerCase(Locale.ROOT));
    }

    private void checkCanceled(BooleanSupplier cancelSignal) {
        if (cancelSignal != null && cancelSignal.getAsBoolean()) {
            throw new CancellationException("Library sync canceled");
        }
    }

    private void fail(SyncResult result, SyncProgressListener progress, String message, Exception e) {
        log.error("LIBRARY_SYNC_FAILED lastStage={} reason={}", result.getLastStage(), e.getMessage(), e);
        result.setState(SyncState.FAILED);
        result.setErrorMessage(message);
        progress.onStateChanged(SyncState.FAILED);
    }
}
