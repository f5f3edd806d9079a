package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.common.exception.CatalogException;
import com.example.medialibrary.common.exception.SyncConfigurationException;
import com.example.medialibrary.domain.enumtype.SyncState;
import com.example.medialibrary.domain.model.AudioMeta;
import com.example.medialibrary.domain.model.RawFileRecord;
import com.example.medialibrary.domain.model.SyncPreferences;
import com.example.medialibrary.domain.model.SyncResult;
import com.example.medialibrary.infrastructure.catalog.MediaCatalog;
import com.example.medialibrary.infrastructure.parser.AudioPropertiesReader;
import com.example.medialibrary.infrastructure.parser.EmbeddedPictureExtractor;
import com.example.medialibrary.infrastructure.persistence.entity.SongEntity;
import com.example.medialibrary.infrastructure.preference.LibraryPreferences;
import com.example.medialibrary.infrastructure.preference.PropertiesLibraryPreferences;
import com.example.medialibrary.infrastructure.storage.FileSystemArtworkStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibrarySyncServiceTest {

    @TempDir
    Path tempDir;

    private ExecutorService ioExecutor;
    private ExecutorService cpuExecutor;
    private MediaCatalog mediaCatalog;
    private LibraryPreferences libraryPreferences;
    private AudioPropertiesReader fastReader;
    private AudioPropertiesReader containerProbe;
    private EmbeddedPictureExtractor pictureExtractor;
    private InMemoryLibraryMappers mappers;
    private SimpleMeterRegistry meterRegistry;
    private LibrarySyncService service;

    @BeforeEach
    void setUp() throws Exception {
        ioExecutor = Executors.newFixedThreadPool(4);
        cpuExecutor = Executors.newFixedThreadPool(2);
        mediaCatalog = mock(MediaCatalog.class);
        libraryPreferences = mock(LibraryPreferences.class);
        fastReader = mock(AudioPropertiesReader.class);
        containerProbe = mock(AudioPropertiesReader.class);
        pictureExtractor = mock(EmbeddedPictureExtractor.class);
        mappers = new InMemoryLibraryMappers();
        meterRegistry = new SimpleMeterRegistry();

        service = newService(libraryPreferences);

        when(libraryPreferences.snapshot()).thenReturn(preferences(false));
    }

    private LibrarySyncService newService(LibraryPreferences preferences) {
        AppSyncProperties properties = new AppSyncProperties();
        properties.setIoBatchSize(2);
        SyncMetrics metrics = new SyncMetrics(meterRegistry);
        LibraryStore store = new LibraryStore(mappers.songMapper, mappers.albumMapper, mappers.artistMapper,
                mappers.crossRefMapper, properties, metrics);
        LibraryMergeService mergeService = new LibraryMergeService(
                new ArtistNameParser(properties), new MetadataFallbackService(), store);
        return new LibrarySyncService(
                mediaCatalog,
                preferences,
                new ParallelBatchProcessor(ioExecutor, cpuExecutor, properties),
                new AudioMetaService(store, fastReader, containerProbe, properties, metrics),
                new AlbumArtService(pictureExtractor, new FileSystemArtworkStore(tempDir.resolve("art")),
                        properties, metrics),
                mergeService,
                store,
                metrics);
    }

    @AfterEach
    void tearDown() {
        ioExecutor.shutdownNow();
        cpuExecutor.shutdownNow();
    }

    @Test
    void blockedRecordsAreDroppedAndRemainingOnePersisted() {
        when(mediaCatalog.enumerate()).thenReturn(Arrays.asList(
                record(1L, "/music/ringtones/beep.mp3", "Beep", "Phone"),
                record(2L, "/music/ringtones/old/ring.mp3", "Ring", "Phone"),
                record(3L, "/music/albums/song.mp3", "Song", "Alice")));
        List<SyncState> states = new ArrayList<>();

        SyncResult result = service.sync(null, null, new SyncProgressListener() {
            @Override
            public void onStateChanged(SyncState state) {
                states.add(state);
            }
        });

        assertEquals(SyncState.DONE, result.getState());
        assertTrue(result.isSuccess());
        assertEquals(3, result.getEnumeratedCount());
        assertEquals(2, result.getFilteredOutCount());
        assertEquals(1, result.getSongCount());
        assertEquals(1, result.getArtistCount());
        assertEquals(1, result.getAlbumCount());
        assertEquals(1, result.getCrossRefCount());
        assertEquals(1, mappers.songs.size());
        assertEquals(1, mappers.artists.size());
        assertEquals(1, mappers.albums.size());
        assertEquals(1, mappers.crossRefs.size());
        assertEquals(Arrays.asList(SyncState.ENUMERATING, SyncState.FILTERING, SyncState.MERGING,
                SyncState.PERSISTING, SyncState.DONE), states);
        assertEquals(1.0D, meterRegistry.find("library.sync.runs").tag("state", "done").counter().count());
    }

    @Test
    void directoryListedAsBothAllowedAndBlockedStaysBlocked() {
        AppLibraryProperties libraryProperties = new AppLibraryProperties();
        libraryProperties.setBlockedDirectories(Collections.singletonList("/music/a"));
        libraryProperties.setAllowedDirectories(Arrays.asList("/music/a", "/music/b"));
        LibrarySyncService configured = newService(new PropertiesLibraryPreferences(libraryProperties));
        when(mediaCatalog.enumerate()).thenReturn(Arrays.asList(
                record(1L, "/music/a/x.mp3", "X", "Alice"),
                record(2L, "/music/b/y.mp3", "Y", "Bob")));

        SyncResult result = configured.sync();

        assertEquals(SyncState.DONE, result.getState());
        assertEquals(1, result.getFilteredOutCount());
        assertEquals(1, result.getSongCount());
        assertTrue(mappers.songs.containsKey(2L));
        assertFalse(mappers.songs.containsKey(1L));
    }

    @Test
    void secondSyncOfUnchangedSourceIsIdempotent() {
        when(mediaCatalog.enumerate()).thenReturn(Arrays.asList(
                record(1L, "/music/a/duet.mp3", "Duet", "Alice & Bob"),
                record(2L, "/music/a/solo.mp3", "Solo", "Alice")));

        service.sync();
        HashMap<Long, SongEntity> firstSongs = new HashMap<>(mappers.songs);
        LinkedHashSet<String> firstRefs = new LinkedHashSet<>(mappers.crossRefs.keySet());
        HashMap<Long, Object> firstArtists = new HashMap<>(mappers.artists);
        HashMap<Long, Object> firstAlbums = new HashMap<>(mappers.albums);

        SyncResult second = service.sync();

        assertEquals(SyncState.DONE, second.getState());
        assertEquals(firstSongs, mappers.songs);
        assertEquals(firstRefs, mappers.crossRefs.keySet());
        assertEquals(firstArtists, new HashMap<Long, Object>(mappers.artists));
        assertEquals(firstAlbums, new HashMap<Long, Object>(mappers.albums));
        assertEquals(3, mappers.crossRefs.size());
    }

    @Test
    void removedArtistDisappearsFromCrossRefsOnResync() {
        when(mediaCatalog.enumerate())
                .thenReturn(Collections.singletonList(record(1L, "/music/a/duet.mp3", "Duet", "Alice & Bob")))
                .thenReturn(Collections.singletonList(record(1L, "/music/a/duet.mp3", "Duet", "Alice")));

        service.sync();
        service.sync();

        assertEquals(1, mappers.crossRefs.size());
    }

    @Test
    void persistenceFailureFailsWholeSync() {
        when(mediaCatalog.enumerate()).thenReturn(Collections.singletonList(
                record(1L, "/music/a/song.mp3", "Song", "Alice")));
        when(mappers.songMapper.batchUpsert(anyList())).thenThrow(new IllegalStateException("connection reset"));

        SyncResult result = service.sync();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(SyncState.PERSISTING, result.getLastStage());
        assertNotNull(result.getErrorMessage());
    }

    @Test
    void enumerationFailureFailsSync() {
        when(mediaCatalog.enumerate()).thenThrow(new CatalogException("root missing"));

        SyncResult result = service.sync();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(SyncState.ENUMERATING, result.getLastStage());
    }

    @Test
    void configurationFailureStopsBeforeEnumerating() {
        when(libraryPreferences.snapshot()).thenThrow(new SyncConfigurationException("bad rules"));

        SyncResult result = service.sync();

        assertEquals(SyncState.FAILED, result.getState());
        assertEquals(SyncState.IDLE, result.getLastStage());
        verify(mediaCatalog, never()).enumerate();
    }

    @Test
    void deepScanEnrichesRecords() throws Exception {
        Path file = writeAudio("deep/track.flac");
        when(libraryPreferences.snapshot()).thenReturn(preferences(true));
        when(mediaCatalog.enumerate()).thenReturn(Collections.singletonList(
                record(7L, file.toString(), "Track", "Alice")));
        when(fastReader.read(any(File.class))).thenReturn(new AudioMeta("audio/flac", 900000, 96000));
        when(pictureExtractor.extract(any(File.class))).thenReturn(new byte[]{1, 2, 3});

        SyncResult result = service.sync();

        assertEquals(SyncState.DONE, result.getState());
        assertEquals(1, result.getDeepScannedCount());
        SongEntity song = mappers.songs.get(7L);
        assertEquals(Integer.valueOf(900000), song.getBitrate());
        assertEquals(Integer.valueOf(96000), song.getSampleRate());
        assertTrue(song.getAlbumArtUri().endsWith("song_art_7.jpg"));
        assertEquals(song.getAlbumArtUri(), mappers.albums.get(song.getAlbumId()).getAlbumArtUri());
    }

    @Test
    void deepScanOverrideWinsOverPreference() throws Exception {
        Path file = writeAudio("override/track.mp3");
        when(mediaCatalog.enumerate()).thenReturn(Collections.singletonList(
                record(8L, file.toString(), "Track", "Alice")));
        when(fastReader.read(any(File.class))).thenReturn(new AudioMeta("audio/mpeg", 128000, 44100));

        SyncResult result = service.sync(Boolean.TRUE, null, SyncProgressListener.NOOP);

        assertTrue(result.isDeepScan());
        assertEquals(Integer.valueOf(128000), mappers.songs.get(8L).getBitrate());
    }

    @Test
    void extractionFailureDegradesFieldsOnly() throws Exception {
        Path file = writeAudio("broken/track.mp3");
        when(libraryPreferences.snapshot()).thenReturn(preferences(true));
        when(mediaCatalog.enumerate()).thenReturn(Collections.singletonList(
                record(9L, file.toString(), "Track", "Alice")));
        when(fastReader.read(any(File.class))).thenThrow(new IOException("bad header"));
        when(containerProbe.read(any(File.class))).thenThrow(new IOException("bad container"));
        when(pictureExtractor.extract(any(File.class))).thenThrow(new IOException("bad frame"));

        SyncResult result = service.sync();

        assertEquals(SyncState.DONE, result.getState());
        SongEntity song = mappers.songs.get(9L);
        assertEquals("audio/mpeg", song.getMimeType());
        assertNull(song.getBitrate());
        assertNull(song.getAlbumArtUri());
    }

    @Test
    void cancelBetweenBatchesPersistsNothing() throws Exception {
        when(libraryPreferences.snapshot()).thenReturn(preferences(true));
        List<RawFileRecord> records = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            records.add(record(100L + i, writeAudio("cancel/" + i + ".mp3").toString(), "T" + i, "Alice"));
        }
        when(mediaCatalog.enumerate()).thenReturn(records);
        when(fastReader.read(any(File.class))).thenReturn(new AudioMeta("audio/mpeg", 1, 1));
        AtomicInteger batches = new AtomicInteger();
        AtomicBoolean cancel = new AtomicBoolean(false);

        SyncResult result = service.sync(null, cancel::get, new SyncProgressListener() {
            @Override
            public void onProgress(int processed, int total) {
                if (batches.incrementAndGet() == 1) {
                    cancel.set(true);
                }
            }
        });

        assertEquals(SyncState.CANCELED, result.getState());
        assertEquals(SyncState.DEEP_SCANNING, result.getLastStage());
        assertEquals(1, batches.get());
        assertTrue(mappers.songs.isEmpty());
    }

    @Test
    void cancelBeforeStartDoesNotEnumerate() {
        SyncResult result = service.sync(null, () -> true, null);

        assertEquals(SyncState.CANCELED, result.getState());
        verify(mediaCatalog, never()).enumerate();
    }

    @Test
    void concurrentSyncIsRejected() {
        List<BusinessException> rejected = new ArrayList<>();
        when(mediaCatalog.enumerate()).thenAnswer(invocation -> {
            rejected.add(assertThrows(BusinessException.class, () -> service.sync()));
            return Collections.emptyList();
        });

        SyncResult result = service.sync();

        assertEquals(SyncState.DONE, result.getState());
        assertEquals(1, rejected.size());
        assertEquals("409", rejected.get(0).getCode());
        assertFalse(service.isRunning());
    }

    private Path writeAudio(String relative) throws IOException {
        Path file = tempDir.resolve("library").resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[]{'I', 'D', '3', 0});
        return file;
    }

    private static SyncPreferences preferences(boolean deepScan) {
        return new SyncPreferences(
                new LinkedHashSet<>(Collections.singletonList("/music/ringtones")),
                Collections.<String>emptySet(),
                deepScan);
    }

    private static RawFileRecord record(long id, String path, String title, String artist) {
        return RawFileRecord.builder()
                .id(id)
                .path(path)
                .title(title)
                .artist(artist)
                .album("Album")
                .mimeType(path.endsWith(".flac") ? "audio/flac" : "audio/mpeg")
                .build();
    }
}
