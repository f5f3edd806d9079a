package com.example.medialibrary.application.service;

import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.medialibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongArtistCrossRefEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import com.example.medialibrary.infrastructure.persistence.mapper.AlbumMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.ArtistMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.SongArtistCrossRefMapper;
import com.example.medialibrary.infrastructure.persistence.mapper.SongMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Backend access for the sync. Every multi-row statement is split into chunks whose bound
 * parameter count stays under {@code app.sync.max-sql-parameters}.
 */
@Service
public class LibraryStore {

    private static final Logger log = LoggerFactory.getLogger(LibraryStore.class);

    private final SongMapper songMapper;
    private final AlbumMapper albumMapper;
    private final ArtistMapper artistMapper;
    private final SongArtistCrossRefMapper crossRefMapper;
    private final AppSyncProperties appSyncProperties;
    private final SyncMetrics syncMetrics;

    public LibraryStore(SongMapper songMapper,
                        AlbumMapper albumMapper,
                        ArtistMapper artistMapper,
                        SongArtistCrossRefMapper crossRefMapper,
                        AppSyncProperties appSyncProperties,
                        SyncMetrics syncMetrics) {
        this.songMapper = songMapper;
        this.albumMapper = albumMapper;
        this.artistMapper = artistMapper;
        this.crossRefMapper = crossRefMapper;
        this.appSyncProperties = appSyncProperties;
        this.syncMetrics = syncMetrics;
    }

    public AudioMeta getAudioMetadataById(long songId) {
        return songMapper.selectAudioMetaById(songId);
    }

    public SongEntity findSongById(long songId) {
        return songMapper.selectById(songId);
    }

    public Map<Long, SongEntity> findSongsByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<Long, SongEntity> result = new HashMap<>(capacityFor(ids.size()));
        for (List<Long> chunk : partition(new ArrayList<>(ids), chunkSize(1))) {
            List<SongEntity> rows = songMapper.selectByIds(chunk);
            if (rows == null) {
                continue;
            }
            for (SongEntity row : rows) {
                result.put(row.getId(), row);
            }
        }
        return result;
    }

    /**
     * Ids of stored artists keyed by lowercased name. Input names are matched case-insensitively.
     */
    public Map<String, Long> findArtistIdsByNames(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return Collections.emptyMap();
        }
        List<String> lowerNames = new ArrayList<>(names.size());
        for (String name : names) {
            lowerNames.add(name.toLowerCase(Locale.ROOT));
        }
        Map<String, Long> result = new HashMap<>(capacityFor(lowerNames.size()));
        for (List<String> chunk : partition(lowerNames, chunkSize(1))) {
            List<ArtistEntity> rows = artistMapper.selectByLowerNames(chunk);
            if (rows == null) {
                continue;
            }
            for (ArtistEntity row : rows) {
                if (row.getName() != null) {
                    result.putIfAbsent(row.getName().toLowerCase(Locale.ROOT), row.getId());
                }
            }
        }
        return result;
    }

    /**
     * Writes a whole merge in one transaction. Cross references of the written songs are
     * replaced so that artist pairs removed from the tags disappear too.
     */
    @Transactional(rollbackFor = Exception.class)
    public PersistStats replaceAll(MergeResult mergeResult) {
        PersistStats stats = new PersistStats();
        stats.setArtists(insertArtists(mergeResult.getArtists()));
        stats.setAlbums(insertAlbums(mergeResult.getAlbums()));
        stats.setSongs(insertSongs(mergeResult.getSongs()));
        List<Long> songIds = new ArrayList<>(mergeResult.getSongs().size());
        for (SongEntity song : mergeResult.getSongs()) {
            songIds.add(song.getId());
        }
        stats.setDeletedCrossRefs(deleteCrossRefs(songIds));
        stats.setCrossRefs(insertCrossRefs(mergeResult.getCrossRefs()));
        log.info("LIBRARY_PERSIST_DONE songs={} albums={} artists={} crossRefs={}",
                mergeResult.getSongs().size(), mergeResult.getAlbums().size(),
                mergeResult.getArtists().size(), mergeResult.getCrossRefs().size());
        return stats;
    }

    public int insertSongs(List<SongEntity> songs) {
        return writeChunked("song", songs, SongEntity.COLUMN_COUNT, songMapper::batchUpsert);
    }

    public int insertAlbums(List<AlbumEntity> albums) {
        return writeChunked("album", albums, AlbumEntity.COLUMN_COUNT, albumMapper::batchUpsert);
    }

    public int insertArtists(List<ArtistEntity> artists) {
        return writeChunked("artist", artists, ArtistEntity.COLUMN_COUNT, artistMapper::batchUpsert);
    }

    public int insertCrossRefs(List<SongArtistCrossRefEntity> crossRefs) {
        return writeChunked("cross_ref", crossRefs, SongArtistCrossRefEntity.COLUMN_COUNT,
                crossRefMapper::batchInsertIgnore);
    }

    int deleteCrossRefs(List<Long> songIds) {
        return writeChunked("cross_ref_delete", songIds, 1, crossRefMapper::deleteBySongIds);
    }

    /**
     * Rows per statement for an entity binding {@code columnCount} parameters per row.
     */
    public int chunkSize(int columnCount) {
        int ceiling = Math.max(1, appSyncProperties.getMaxSqlParameters());
        return Math.max(1, ceiling / Math.max(1, columnCount));
    }

    private <T> int writeChunked(String entity, List<T> rows, int columnCount, Function<List<T>, Integer> writer) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        int affected = 0;
        int chunks = 0;
        for (List<T> chunk : partition(rows, chunkSize(columnCount))) {
            long start = System.nanoTime();
            Integer count = writer.apply(chunk);
            syncMetrics.recordDuration("library.sync.db.chunk.duration", System.nanoTime() - start, "entity", entity);
            affected += count == null ? 0 : count;
            chunks++;
        }
        log.debug("LIBRARY_PERSIST_CHUNKED entity={} rows={} chunks={}", entity, rows.size(), chunks);
        return affected;
    }

    static <T> List<List<T>> partition(List<T> rows, int size) {
        List<List<T>> chunks = new ArrayList<>((rows.size() + size - 1) / size);
        for (int start = 0; start < rows.size(); start += size) {
            chunks.add(rows.subList(start, Math.min(rows.size(), start + size)));
        }
        return chunks;
    }

    private static int capacityFor(int expected) {
        return Math.max(16, (int) (expected / 0.75f) + 1);
    }

    @Data
    public static class PersistStats {
        private int songs;
        private int albums;
        private int artists;
        private int crossRefs;
        private int deletedCrossRefs;
    }
}
