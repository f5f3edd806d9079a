package com.example.medialibrary.infrastructure.storage;

import com.example.medialibrary.common.config.AppSyncProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class FileSystemArtworkStore implements ArtworkStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtworkStore.class);

    private final Path baseDir;

    @Autowired
    public FileSystemArtworkStore(AppSyncProperties appSyncProperties) {
        this(Paths.get(appSyncProperties.getArtworkDir()));
    }

    public FileSystemArtworkStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public String save(byte[] bytes, long songId) throws IOException {
        Files.createDirectories(baseDir);
        Path target = artPath(songId);
        Path temp = Files.createTempFile(baseDir, "song_art_" + songId, ".part");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        return target.toUri().toString();
    }

    @Override
    public String referenceFor(long songId) {
        Path path = artPath(songId);
        return Files.isRegularFile(path) ? path.toUri().toString() : null;
    }

    @Override
    public void markNoArt(long songId) {
        try {
            Files.createDirectories(baseDir);
            Path marker = markerPath(songId);
            if (!Files.exists(marker)) {
                Files.createFile(marker);
            }
        } catch (IOException e) {
            log.debug("No-art marker write failed, songId={}", songId, e);
        }
    }

    @Override
    public void clearNoArtMarker(long songId) {
        try {
            Files.deleteIfExists(markerPath(songId));
        } catch (IOException e) {
            log.debug("No-art marker delete failed, songId={}", songId, e);
        }
    }

    @Override
    public boolean hasNoArtMarker(long songId) {
        return Files.exists(markerPath(songId));
    }

    private Path artPath(long songId) {
        return baseDir.resolve("song_art_" + songId + ".jpg");
    }

    private Path markerPath(long songId) {
        return baseDir.resolve("song_art_" + songId + "_no.jpg");
    }
}
