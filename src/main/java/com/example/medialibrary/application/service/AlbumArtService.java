package com.example.medialibrary.application.service;

import com.example.medialibrary.common.cache.LruCache;
import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.infrastructure.parser.EmbeddedPictureExtractor;
import com.example.medialibrary.infrastructure.storage.ArtworkStore;
import java.io.File;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds cover art for a song and hands out the stored artifact reference.
 *
 * <p>Hits are cached per album id. Songs whose files carry no picture are remembered per song id
 * so that ordinary syncs do not retry them; a deep scan clears that mark and tries again. Picture
 * extraction and artifact writes never run while a cache lock is held.
 */
@Service
public class AlbumArtService {

    private static final Logger log = LoggerFactory.getLogger(AlbumArtService.class);

    static final String CACHE_NAME = "album_art";

    private final LruCache<Long, String> artCache;
    private final LruCache<Long, Boolean> noArtSongs;
    private final EmbeddedPictureExtractor pictureExtractor;
    private final ArtworkStore artworkStore;
    private final SyncMetrics syncMetrics;

    public AlbumArtService(EmbeddedPictureExtractor pictureExtractor,
                           ArtworkStore artworkStore,
                           AppSyncProperties appSyncProperties,
                           SyncMetrics syncMetrics) {
        this.pictureExtractor = pictureExtractor;
        this.artworkStore = artworkStore;
        this.syncMetrics = syncMetrics;
        this.artCache = new LruCache<>(Math.max(1, appSyncProperties.getArtCacheCapacity()));
        this.noArtSongs = new LruCache<>(Math.max(1, appSyncProperties.getNoArtCacheCapacity()));
    }

    /**
     * @return artifact reference, or null when the song has no usable art
     */
    public String getAlbumArtUri(long albumId, long songId, String path, boolean deepScan) {
        String cached = artCache.get(albumId);
        if (cached != null) {
            syncMetrics.cacheHit(CACHE_NAME);
            return cached;
        }
        syncMetrics.cacheMiss(CACHE_NAME);

        if (!deepScan) {
            String existing = artworkStore.referenceFor(songId);
            if (existing != null) {
                return existing;
            }
        }

        if (noArtSongs.containsKey(songId)) {
            if (!deepScan) {
                return null;
            }
            noArtSongs.remove(songId);
            artworkStore.clearNoArtMarker(songId);
        }

        File file = path == null ? null : new File(path);
        if (file == null || !file.isFile() || !file.canRead()) {
            log.debug("ALBUM_ART_SOURCE_UNREADABLE songId={} path={}", songId, path);
            return null;
        }

        byte[] picture;
        try {
            picture = pictureExtractor.extract(file);
        } catch (Exception e) {
            log.warn("ALBUM_ART_EXTRACT_FAILED songId={} path={} reason={}", songId, path, e.getMessage());
            picture = null;
        }
        if (picture == null || picture.length == 0) {
            markNoArt(songId);
            return null;
        }

        String reference;
        try {
            reference = artworkStore.save(picture, songId);
        } catch (IOException e) {
            log.warn("ALBUM_ART_SAVE_FAILED songId={} reason={}", songId, e.getMessage());
            return null;
        }
        noArtSongs.remove(songId);
        artworkStore.clearNoArtMarker(songId);
        artCache.put(albumId, reference);
        return reference;
    }

    public boolean isMarkedNoArt(long songId) {
        return noArtSongs.containsKey(songId);
    }

    public void evictAlbum(long albumId) {
        artCache.remove(albumId);
    }

    public void invalidate() {
        artCache.clear();
        noArtSongs.clear();
    }

    int cachedCount() {
        return artCache.size();
    }

    private void markNoArt(long songId) {
        noArtSongs.put(songId, Boolean.TRUE);
        artworkStore.markNoArt(songId);
    }
}
