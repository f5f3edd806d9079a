package com.example.medialibrary.application.service;

import com.example.medialibrary.infrastructure.persistence.entity.AlbumEntity;
import com.example.medialibrary.infrastructure.persistence.entity.ArtistEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongArtistCrossRefEntity;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import java.util.List;
import lombok.Value;

/**
 * Normalized entity sets produced by one merge, ready to be written together.
 */
@Value
public class MergeResult {

    List<SongEntity> songs;

    List<AlbumEntity> albums;

    List<ArtistEntity> artists;

    List<SongArtistCrossRefEntity> crossRefs;

    public boolean isEmpty() {
        return songs.isEmpty() && albums.isEmpty() && artists.isEmpty() && crossRefs.isEmpty();
    }
}
