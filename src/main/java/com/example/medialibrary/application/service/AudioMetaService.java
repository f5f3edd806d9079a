package com.example.medialibrary.application.service;

import com.example.medialibrary.common.cache.LruCache;
import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.infrastructure.parser.AudioPropertiesReader;
import java.io.File;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Resolves mime type, bitrate and sample rate per song. Lookup order is the in-memory cache, the
 * stored row (trusted only outside deep scans and only when complete), the fast header reader,
 * then the container probe for fields the fast reader left empty during a deep scan.
 */
@Service
public class AudioMetaService {

    private static final Logger log = LoggerFactory.getLogger(AudioMetaService.class);

    static final String CACHE_NAME = "audio_meta";

    private final LruCache<Long, AudioMeta> cache;
    private final LibraryStore libraryStore;
    private final AudioPropertiesReader fastReader;
    private final AudioPropertiesReader containerProbe;
    private final SyncMetrics syncMetrics;

    public AudioMetaService(LibraryStore libraryStore,
                            @Qualifier("jaudiotaggerAudioPropertiesReader") AudioPropertiesReader fastReader,
                            @Qualifier("containerProbeAudioPropertiesReader") AudioPropertiesReader containerProbe,
                            AppSyncProperties appSyncProperties,
                            SyncMetrics syncMetrics) {
        this.libraryStore = libraryStore;
        this.fastReader = fastReader;
        this.containerProbe = containerProbe;
        this.syncMetrics = syncMetrics;
        this.cache = new LruCache<>(Math.max(1, appSyncProperties.getAudioMetaCacheCapacity()));
    }

    public AudioMeta getAudioMetadata(long songId, String path, boolean deepScan) {
        AudioMeta cached = cache.get(songId);
        if (cached != null) {
            syncMetrics.cacheHit(CACHE_NAME);
            return cached;
        }
        syncMetrics.cacheMiss(CACHE_NAME);

        AudioMeta stored = loadStored(songId);
        if (!deepScan && stored != null && stored.isComplete()) {
            cache.put(songId, stored);
            return stored;
        }

        File file = path == null ? null : new File(path);
        if (file == null || !file.isFile() || !file.canRead()) {
            log.debug("AUDIO_META_SOURCE_UNREADABLE songId={} path={}", songId, path);
            return stored != null ? stored : AudioMeta.EMPTY;
        }

        AudioMeta result = AudioMeta.EMPTY;
        try {
            AudioMeta fast = fastReader.read(file);
            if (fast != null) {
                result = fast;
            }
        } catch (Exception e) {
            log.warn("AUDIO_META_READ_FAILED songId={} path={} reason={}", songId, path, e.getMessage());
        }

        if (deepScan && (result.getMimeType() == null || result.getSampleRate() == null)) {
            try {
                result = result.fillMissingFrom(containerProbe.read(file));
            } catch (Exception e) {
                log.warn("AUDIO_META_PROBE_FAILED songId={} path={} reason={}", songId, path, e.getMessage());
            }
        }

        cache.put(songId, result);
        return result;
    }

    public void evict(long songId) {
        cache.remove(songId);
    }

    public void invalidate() {
        cache.clear();
    }

    int cachedCount() {
        return cache.size();
    }

    private AudioMeta loadStored(long songId) {
        try {
            return libraryStore.getAudioMetadataById(songId);
        } catch (RuntimeException e) {
            log.warn("AUDIO_META_STORE_LOOKUP_FAILED songId={} reason={}", songId, e.getMessage());
            return null;
        }
    }
}
