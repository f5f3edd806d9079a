package com.example.medialibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class SongEntity {

    /** Bound parameters per row in {@code SongMapper.batchUpsert}. */
    public static final int COLUMN_COUNT = 18;

    private Long id;

    private String title;

    /** Display form of the artist tag, e.g. "Alice & Bob". */
    private String artistName;

    /** Primary (first listed) artist. */
    private Long artistId;

    private Long albumId;

    private String albumName;

    private String albumArtist;

    private String path;

    private String parentDirectory;

    private Long durationMs;

    private Integer trackNo;

    private Integer year;

    private String genre;

    private String mimeType;

    private Integer bitrate;

    private Integer sampleRate;

    private String albumArtUri;

    private Long dateModified;
}
