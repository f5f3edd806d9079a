package com.example.medialibrary.domain.model;

import lombok.Data;

@Data
public class AudioTags {

    private String title;

    private String artist;

    private String album;

    private String albumArtist;

    private Integer trackNo;

    private Integer year;

    private String genre;

    private Integer durationSec;
}
