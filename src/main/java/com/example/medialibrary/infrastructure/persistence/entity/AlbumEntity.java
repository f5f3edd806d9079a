package com.example.medialibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class AlbumEntity {

    public static final int COLUMN_COUNT = 7;

    private Long id;

    private String title;

    private String artistName;

    private Long artistId;

    private Integer year;

    private String albumArtUri;

    private Integer songCount;
}
