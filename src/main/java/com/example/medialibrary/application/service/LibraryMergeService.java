package com.example.medialibrary.application.service;

import com.example.medialibrary.common.util.HashUtil;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.domain.model.EnrichedRecord;
import com.example.medialibrary.domain.model.RawFileRecord;
import com.example.medialibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.medialibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongArtistCrossRefEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collapses the filtered records of one sync into canonical songs, albums, artists and
 * song-artist cross references.
 *
 * <p>Artist ids are reused from the store when the name is already known (case-insensitive) and
 * minted deterministically otherwise. Album ids are derived from the album title plus the album
 * artist, falling back to the primary track artist, so equal titles by different artists stay
 * apart. When a song already exists in the store, stored metadata survives wherever the fresh value
 * is null.
 */
@Service
public class LibraryMergeService {

    private static final Logger log = LoggerFactory.getLogger(LibraryMergeService.class);

    /** Rough ratio of distinct artists to songs in a personal library. */
    private static final int SONGS_PER_ARTIST_ESTIMATE = 4;

    private final ArtistNameParser artistNameParser;
    private final MetadataFallbackService metadataFallbackService;
    private final LibraryStore libraryStore;

    public LibraryMergeService(ArtistNameParser artistNameParser,
                               MetadataFallbackService metadataFallbackService,
                               LibraryStore libraryStore) {
        this.artistNameParser = artistNameParser;
        this.metadataFallbackService = metadataFallbackService;
        this.libraryStore = libraryStore;
    }

    /**
     * Album id the given record will be merged into. Stable across syncs for unchanged tags.
     */
    public long resolveAlbumId(RawFileRecord record) {
        RawFileRecord normalized = metadataFallbackService.applyFallback(record);
        return albumIdFor(normalized, artistsOf(normalized));
    }

    public MergeResult merge(List<EnrichedRecord> records) {
        if (records == null || records.isEmpty()) {
            return new MergeResult(Collections.emptyList(), Collections.emptyList(),
                    Collections.emptyList(), Collections.emptyList());
        }

        Map<Long, PreparedRecord> prepared = new LinkedHashMap<>(capacityFor(records.size()));
        Map<String, String> artistDisplayNames =
                new LinkedHashMap<>(capacityFor(records.size() / SONGS_PER_ARTIST_ESTIMATE));
        int duplicates = 0;
        for (EnrichedRecord enriched : records) {
            RawFileRecord record = enriched.getRecord();
            if (prepared.containsKey(record.getId())) {
                duplicates++;
                continue;
            }
            RawFileRecord normalized = metadataFallbackService.applyFallback(record);
            List<String> artists = artistsOf(normalized);
            for (String artist : artists) {
                artistDisplayNames.putIfAbsent(artistKey(artist), artist);
            }
            prepared.put(record.getId(), new PreparedRecord(enriched, normalized, artists));
        }
        if (duplicates > 0) {
            log.debug("LIBRARY_MERGE_DUPLICATE_RECORDS count={}", duplicates);
        }

        Map<String, Long> artistIds = resolveArtistIds(artistDisplayNames);
        Map<Long, SongEntity> storedSongs = libraryStore.findSongsByIds(prepared.keySet());

        List<SongEntity> songs = new ArrayList<>(prepared.size());
        Map<Long, AlbumEntity> albums = new LinkedHashMap<>();
        Map<Long, ArtistEntity> artists = new LinkedHashMap<>(capacityFor(artistIds.size()));
        List<SongArtistCrossRefEntity> crossRefs = new ArrayList<>(prepared.size());
        Set<String> emittedPairs = new HashSet<>(capacityFor(prepared.size()));

        for (PreparedRecord item : prepared.values()) {
            RawFileRecord normalized = item.normalized;
            long songId = normalized.getId();
            long primaryArtistId = artistIds.get(artistKey(item.artists.get(0)));
            long albumId = albumIdFor(normalized, item.artists);

            SongEntity song = toSong(item, songId, primaryArtistId, albumId);
            preserveStoredMetadata(song, storedSongs.get(songId));
            songs.add(song);

            AlbumEntity album = albums.get(albumId);
            if (album == null) {
                album = new AlbumEntity();
                album.setId(albumId);
                album.setTitle(normalized.getAlbum());
                String albumArtist = albumArtistOf(normalized, item.artists);
                album.setArtistName(albumArtist);
                // null when the album artist credits no track in this sync, e.g. "Various Artists"
                album.setArtistId(artistIds.get(artistKey(albumArtist)));
                album.setSongCount(0);
                albums.put(albumId, album);
            }
            album.setSongCount(album.getSongCount() + 1);
            if (album.getYear() == null) {
                album.setYear(song.getYear());
            }
            if (album.getAlbumArtUri() == null) {
                album.setAlbumArtUri(song.getAlbumArtUri());
            }

            for (int i = 0; i < item.artists.size(); i++) {
                String key = artistKey(item.artists.get(i));
                long artistId = artistIds.get(key);
                ArtistEntity artist = artists.get(artistId);
                if (artist == null) {
                    artist = new ArtistEntity();
                    artist.setId(artistId);
                    artist.setName(artistDisplayNames.get(key));
                    artist.setTrackCount(0);
                    artists.put(artistId, artist);
                }
                if (emittedPairs.add(songId + ":" + artistId)) {
                    artist.setTrackCount(artist.getTrackCount() + 1);
                    crossRefs.add(new SongArtistCrossRefEntity(songId, artistId, i == 0 ? 1 : 0));
                }
            }
        }

        log.info("LIBRARY_MERGE_DONE records={} songs={} albums={} artists={} crossRefs={}",
                records.size(), songs.size(), albums.size(), artists.size(), crossRefs.size());
        return new MergeResult(songs, new ArrayList<>(albums.values()),
                new ArrayList<>(artists.values()), crossRefs);
    }

    private Map<String, Long> resolveArtistIds(Map<String, String> artistDisplayNames) {
        Map<String, Long> existing = libraryStore.findArtistIdsByNames(artistDisplayNames.keySet());
        Map<String, Long> ids = new HashMap<>(capacityFor(artistDisplayNames.size()));
        for (String key : artistDisplayNames.keySet()) {
            Long id = existing.get(key);
            ids.put(key, id != null ? id : HashUtil.stableId("artist:" + key));
        }
        return ids;
    }

    private SongEntity toSong(PreparedRecord item, long songId, long primaryArtistId, long albumId) {
        RawFileRecord normalized = item.normalized;
        AudioMeta meta = item.enriched.getAudioMeta() == null ? AudioMeta.EMPTY : item.enriched.getAudioMeta();
        SongEntity song = new SongEntity();
        song.setId(songId);
        song.setTitle(normalized.getTitle());
        song.setArtistName(normalized.getArtist());
        song.setArtistId(primaryArtistId);
        song.setAlbumId(albumId);
        song.setAlbumName(normalized.getAlbum());
        song.setAlbumArtist(normalized.getAlbumArtist());
        song.setPath(normalized.getPath());
        song.setParentDirectory(normalized.parentDirectory());
        song.setDurationMs(normalized.getDurationMs());
        song.setTrackNo(normalized.getTrackNo());
        song.setYear(normalized.getYear());
        song.setGenre(normalized.getGenre());
        song.setMimeType(meta.getMimeType() != null ? meta.getMimeType() : normalized.getMimeType());
        song.setBitrate(meta.getBitrate());
        song.setSampleRate(meta.getSampleRate());
        song.setAlbumArtUri(item.enriched.getAlbumArtUri());
        song.setDateModified(normalized.getDateModified());
        return song;
    }

    /**
     * A fresh non-null value always wins; a fresh null never erases a stored value.
     */
    void preserveStoredMetadata(SongEntity fresh, SongEntity stored) {
        if (stored == null) {
            return;
        }
        if (fresh.getDurationMs() == null) {
            fresh.setDurationMs(stored.getDurationMs());
        }
        if (fresh.getTrackNo() == null) {
            fresh.setTrackNo(stored.getTrackNo());
        }
        if (fresh.getYear() == null) {
            fresh.setYear(stored.getYear());
        }
        if (fresh.getGenre() == null) {
            fresh.setGenre(stored.getGenre());
        }
        if (fresh.getMimeType() == null) {
            fresh.setMimeType(stored.getMimeType());
        }
        if (fresh.getBitrate() == null) {
            fresh.setBitrate(stored.getBitrate());
        }
        if (fresh.getSampleRate() == null) {
            fresh.setSampleRate(stored.getSampleRate());
        }
        if (fresh.getAlbumArtUri() == null) {
            fresh.setAlbumArtUri(stored.getAlbumArtUri());
        }
        if (fresh.getDateModified() == null) {
            fresh.setDateModified(stored.getDateModified());
        }
    }

    private List<String> artistsOf(RawFileRecord normalized) {
        List<String> artists = artistNameParser.split(normalized.getArtist());
        if (artists.isEmpty()) {
            return Collections.singletonList(MetadataFallbackService.UNKNOWN_ARTIST);
        }
        return artists;
    }

    private long albumIdFor(RawFileRecord normalized, List<String> artists) {
        String albumArtist = albumArtistOf(normalized, artists);
        return HashUtil.stableId("album:" + normalized.getAlbum().toLowerCase(Locale.ROOT)
                + "|" + albumArtist.toLowerCase(Locale.ROOT));
    }

    private String albumArtistOf(RawFileRecord normalized, List<String> artists) {
        return normalized.getAlbumArtist() != null ? normalized.getAlbumArtist() : artists.get(0);
    }

    private static String artistKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static int capacityFor(int expected) {
        return Math.max(16, (int) (expected / 0.75f) + 1);
    }

    private static final class PreparedRecord {
        private final EnrichedRecord enriched;
        private final RawFileRecord normalized;
        private final List<String> artists;

        private PreparedRecord(EnrichedRecord enriched, RawFileRecord normalized, List<String> artists) {
            this.enriched = enriched;
            this.normalized = normalized;
            this.artists = artists;
        }
    }
}
