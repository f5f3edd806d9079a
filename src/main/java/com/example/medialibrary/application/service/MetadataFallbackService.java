package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.model.RawFileRecord;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Fills tag gaps from the file layout so every song ends up with a title, an artist and an album.
 */
@Service
public class MetadataFallbackService {

    public static final String UNKNOWN_ARTIST = "Unknown Artist";
    public static final String UNKNOWN_ALBUM = "Unknown Album";
    static final String UNKNOWN_TITLE = "unknown-track";

    private static final Pattern DASH_PATTERN = Pattern.compile("^\\s*(.+?)\\s*-\\s*(.+?)\\s*$");

    private static final Set<String> GENERIC_DIR_NAMES = new HashSet<>(Arrays.asList(
            "music", "audio", "songs", "download", "downloads", "media", "mp3", "flac",
            "lossless", "hi-res", "ost", "soundtrack", "various", "misc", "unsorted", "incoming"
    ));

    public RawFileRecord applyFallback(RawFileRecord record) {
        String fileBaseName = extractFileBaseName(record.fileName());
        String parentDir = lastSegment(record.parentDirectory());

        String guessedArtist = null;
        String guessedTitle = null;
        if (fileBaseName != null) {
            Matcher matcher = DASH_PATTERN.matcher(fileBaseName);
            if (matcher.matches()) {
                guessedArtist = matcher.group(1).trim();
                guessedTitle = matcher.group(2).trim();
            }
        }

        String title = trimToNull(record.getTitle());
        if (title == null) {
            if (StringUtils.hasText(guessedTitle)) {
                title = guessedTitle;
            } else {
                title = StringUtils.hasText(fileBaseName) ? fileBaseName : UNKNOWN_TITLE;
            }
        }

        String artist = trimToNull(record.getArtist());
        if (artist == null) {
            artist = StringUtils.hasText(guessedArtist) ? guessedArtist : UNKNOWN_ARTIST;
        }

        String album = trimToNull(record.getAlbum());
        if (album == null) {
            album = isGeneric(parentDir) ? UNKNOWN_ALBUM : parentDir;
        }

        return record.toBuilder()
                .title(title)
                .artist(artist)
                .album(album)
                .albumArtist(trimToNull(record.getAlbumArtist()))
                .build();
    }

    private boolean isGeneric(String dirName) {
        return !StringUtils.hasText(dirName) || GENERIC_DIR_NAMES.contains(dirName.toLowerCase(Locale.ROOT));
    }

    private String extractFileBaseName(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return null;
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return trimToNull(base);
    }

    private String lastSegment(String directory) {
        if (!StringUtils.hasText(directory) || "/".equals(directory)) {
            return null;
        }
        int slash = directory.lastIndexOf('/');
        String segment = slash >= 0 ? directory.substring(slash + 1) : directory;
        if (segment.endsWith(":")) {
            return null;
        }
        return trimToNull(segment);
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
