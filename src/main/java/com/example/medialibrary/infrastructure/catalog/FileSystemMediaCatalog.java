package com.example.medialibrary.infrastructure.catalog;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.CatalogException;
import com.example.medialibrary.common.util.DirectoryPaths;
import com.example.medialibrary.common.util.HashUtil;
import com.example.medialibrary.domain.model.AudioTags;
import com.example.medialibrary.domain.model.RawFileRecord;
import com.example.medialibrary.infrastructure.parser.AudioFormats;
import com.example.medialibrary.infrastructure.parser.AudioTagReader;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the configured library roots and reports every audio file with its container tags.
 * Record ids are derived from the absolute path, so they stay stable between syncs.
 */
@Component
public class FileSystemMediaCatalog implements MediaCatalog {

    private static final Logger log = LoggerFactory.getLogger(FileSystemMediaCatalog.class);

    private final AppLibraryProperties appLibraryProperties;
    private final AudioTagReader audioTagReader;

    public FileSystemMediaCatalog(AppLibraryProperties appLibraryProperties, AudioTagReader audioTagReader) {
        this.appLibraryProperties = appLibraryProperties;
        this.audioTagReader = audioTagReader;
    }

    @Override
    public List<RawFileRecord> enumerate() {
        Set<String> extensions = appLibraryProperties.normalizedAudioExtensions();
        if (extensions.isEmpty()) {
            throw new CatalogException("app.library.audio-extensions is empty");
        }
        List<RawFileRecord> records = new ArrayList<>();
        for (String root : appLibraryProperties.getRootPaths()) {
            if (root == null || root.trim().isEmpty()) {
                continue;
            }
            Path rootPath = Paths.get(root.trim());
            if (!Files.isDirectory(rootPath)) {
                throw new CatalogException("Library root is not a readable directory: " + rootPath);
            }
            List<Path> files = listAudioFiles(rootPath, extensions);
            for (Path file : files) {
                records.add(toRecord(file));
            }
        }
        return records;
    }

    private List<Path> listAudioFiles(Path rootPath, Set<String> extensions) {
        AudioFileCollector collector = new AudioFileCollector(rootPath, extensions);
        try {
            Files.walkFileTree(rootPath, collector);
        } catch (IOException e) {
            throw new CatalogException("Library root walk failed: " + rootPath, e);
        }
        List<Path> files = collector.getFiles();
        files.sort(Comparator.comparing(Path::toString));
        log.info("CATALOG_ROOT_LISTED root={} audioFiles={} skipped={}", rootPath, files.size(),
                collector.getSkipped());
        return files;
    }

    /**
     * Collects audio files under one root. Entries that cannot be opened below the root are logged
     * and skipped; only a failure on the root itself aborts the walk.
     */
    static final class AudioFileCollector extends SimpleFileVisitor<Path> {

        private final Path rootPath;
        private final Set<String> extensions;
        private final List<Path> files = new ArrayList<>();
        private int skipped;

        AudioFileCollector(Path rootPath, Set<String> extensions) {
            this.rootPath = rootPath;
            this.extensions = extensions;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()
                    && extensions.contains(AudioFormats.extensionOf(file.getFileName().toString()))) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(rootPath)) {
                throw exc;
            }
            skipped++;
            log.warn("CATALOG_ENTRY_SKIPPED path={} reason={}", file,
                    exc.getClass().getSimpleName() + ": " + exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        List<Path> getFiles() {
            return files;
        }

        int getSkipped() {
            return skipped;
        }
    }

    private RawFileRecord toRecord(Path file) {
        String path = DirectoryPaths.normalize(file.toAbsolutePath().toString());
        RawFileRecord.RawFileRecordBuilder builder = RawFileRecord.builder()
                .id(HashUtil.stableId(path))
                .path(path)
                .mimeType(AudioFormats.mimeTypeForExtension(AudioFormats.extensionOf(path)));
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            builder.fileSize(attributes.size()).dateModified(attributes.lastModifiedTime().toMillis());
        } catch (IOException e) {
            log.debug("File attributes unreadable, path={}", path, e);
        }
        try {
            AudioTags tags = audioTagReader.read(file.toFile());
            builder.title(tags.getTitle())
                    .artist(tags.getArtist())
                    .album(tags.getAlbum())
                    .albumArtist(tags.getAlbumArtist())
                    .trackNo(tags.getTrackNo())
                    .year(tags.getYear())
                    .genre(tags.getGenre())
                    .durationMs(tags.getDurationSec() == null ? null : tags.getDurationSec() * 1000L);
        } catch (Exception e) {
            log.warn("Tag read fallback, path={}, reason={}", path, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return builder.build();
    }
}
