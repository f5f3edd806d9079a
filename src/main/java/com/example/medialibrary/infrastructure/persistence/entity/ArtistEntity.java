package com.example.medialibrary.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class ArtistEntity {

    public static final int COLUMN_COUNT = 3;

    private Long id;

    private String name;

    private Integer trackCount;
}
