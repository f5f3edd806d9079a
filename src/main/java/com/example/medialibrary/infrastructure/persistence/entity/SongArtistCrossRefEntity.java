package com.example.medialibrary.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SongArtistCrossRefEntity {

    public static final int COLUMN_COUNT = 3;

    private Long songId;

    private Long artistId;

    private Integer isPrimary;
}
