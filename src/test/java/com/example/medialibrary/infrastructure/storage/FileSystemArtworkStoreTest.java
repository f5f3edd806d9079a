package com.example.medialibrary.infrastructure.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemArtworkStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void saveWritesArtifactAndReturnsReference() throws Exception {
        FileSystemArtworkStore store = new FileSystemArtworkStore(tempDir.resolve("art"));
        byte[] bytes = {1, 2, 3};

        String reference = store.save(bytes, 42L);

        assertEquals(reference, store.referenceFor(42L));
        assertArrayEquals(bytes, Files.readAllBytes(Paths.get(URI.create(reference))));
        assertNull(store.referenceFor(43L));
    }

    @Test
    void saveOverwritesPreviousArtifact() throws Exception {
        FileSystemArtworkStore store = new FileSystemArtworkStore(tempDir);
        store.save(new byte[]{1}, 1L);

        String reference = store.save(new byte[]{9, 9}, 1L);

        assertArrayEquals(new byte[]{9, 9}, Files.readAllBytes(Paths.get(URI.create(reference))));
    }

    @Test
    void noArtMarkerLifecycle() {
        FileSystemArtworkStore store = new FileSystemArtworkStore(tempDir.resolve("markers"));

        assertFalse(store.hasNoArtMarker(5L));
        store.markNoArt(5L);
        store.markNoArt(5L);
        assertTrue(store.hasNoArtMarker(5L));
        assertNull(store.referenceFor(5L));
        store.clearNoArtMarker(5L);
        assertFalse(store.hasNoArtMarker(5L));
    }
}
