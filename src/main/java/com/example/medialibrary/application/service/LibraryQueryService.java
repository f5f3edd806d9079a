package com.example.medialibrary.application.service;

import com.example.medialibrary.api.response.AlbumArtResponse;
import com.example.medialibrary.api.response.AudioPropertiesResponse;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.infrastructure.parser.AudioFormats;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import org.springframework.stereotype.Service;

/**
 * On-demand metadata for songs already in the library. Goes through the same caches as the sync;
 * {@code refresh} behaves like a deep scan for that one song.
 */
@Service
public class LibraryQueryService {

    private final LibraryStore libraryStore;
    private final AlbumArtService albumArtService;
    private final AudioMetaService audioMetaService;

    public LibraryQueryService(LibraryStore libraryStore,
                               AlbumArtService albumArtService,
                               AudioMetaService audioMetaService) {
        this.libraryStore = libraryStore;
        this.albumArtService = albumArtService;
        this.audioMetaService = audioMetaService;
    }

    public AlbumArtResponse albumArtFor(long songId, boolean refresh) {
        SongEntity song = requireSong(songId);
        if (refresh) {
            albumArtService.evictAlbum(song.getAlbumId());
        }
        String uri = albumArtService.getAlbumArtUri(song.getAlbumId(), songId, song.getPath(), refresh);
        return new AlbumArtResponse(songId, song.getAlbumId(), uri);
    }

    public AudioPropertiesResponse audioPropertiesFor(long songId, boolean refresh) {
        SongEntity song = requireSong(songId);
        if (refresh) {
            audioMetaService.evict(songId);
        }
        AudioMeta meta = audioMetaService.getAudioMetadata(songId, song.getPath(), refresh);
        return new AudioPropertiesResponse(songId, meta.getMimeType(),
                AudioFormats.mimeTypeToFormat(meta.getMimeType()), meta.getBitrate(), meta.getSampleRate());
    }

    private SongEntity requireSong(long songId) {
        SongEntity song = libraryStore.findSongById(songId);
        if (song == null) {
            throw new BusinessException("404", "Song not found: " + songId);
        }
        return song;
    }
}
