package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.RawFileRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MetadataFallbackServiceTest {

    private MetadataFallbackService metadataFallbackService;

    @BeforeEach
    void setUp() {
        metadataFallbackService = new MetadataFallbackService();
    }

    @Test
    void shouldKeepExistingTagsTrimmed() {
        RawFileRecord record = RawFileRecord.builder()
                .id(1L)
                .path("/music/pop/shape-of-you.mp3")
                .title("  Shape of You ")
                .artist(" Ed Sheeran ")
                .album(" Divide ")
                .albumArtist("Ed Sheeran")
                .build();

        RawFileRecord result = metadataFallbackService.applyFallback(record);

        Assertions.assertEquals("Shape of You", result.getTitle());
        Assertions.assertEquals("Ed Sheeran", result.getArtist());
        Assertions.assertEquals("Divide", result.getAlbum());
        Assertions.assertEquals("Ed Sheeran", result.getAlbumArtist());
        Assertions.assertEquals(1L, result.getId());
    }

    @Test
    void shouldFallbackFromFileNamePatternWhenTagsMissing() {
        RawFileRecord record = RawFileRecord.builder()
                .id(2L)
                .path("/music/Downloads/Daft Punk - Around the World.flac")
                .build();

        RawFileRecord result = metadataFallbackService.applyFallback(record);

        Assertions.assertEquals("Around the World", result.getTitle());
        Assertions.assertEquals("Daft Punk", result.getArtist());
        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_ALBUM, result.getAlbum());
        Assertions.assertNull(result.getAlbumArtist());
    }

    @Test
    void shouldFallbackToBaseNameAndParentDirectory() {
        RawFileRecord record = RawFileRecord.builder()
                .id(3L)
                .path("/music/Brave Shine/brave_shine.m4a")
                .artist("Aimer")
                .album("   ")
                .build();

        RawFileRecord result = metadataFallbackService.applyFallback(record);

        Assertions.assertEquals("brave_shine", result.getTitle());
        Assertions.assertEquals("Aimer", result.getArtist());
        Assertions.assertEquals("Brave Shine", result.getAlbum());
    }

    @Test
    void shouldUseUnknownArtistWhenNothingCanBeInferred() {
        RawFileRecord record = RawFileRecord.builder()
                .id(4L)
                .path("/track01.wav")
                .build();

        RawFileRecord result = metadataFallbackService.applyFallback(record);

        Assertions.assertEquals("track01", result.getTitle());
        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_ARTIST, result.getArtist());
        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_ALBUM, result.getAlbum());
    }

    @Test
    void shouldHandleMissingPath() {
        RawFileRecord result = metadataFallbackService.applyFallback(RawFileRecord.builder().id(5L).build());

        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_TITLE, result.getTitle());
        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_ARTIST, result.getArtist());
        Assertions.assertEquals(MetadataFallbackService.UNKNOWN_ALBUM, result.getAlbum());
    }
}
