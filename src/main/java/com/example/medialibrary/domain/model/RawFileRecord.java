package com.example.medialibrary.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One audio file as reported by the catalog. Lives for a single sync pass.
 */
@Value
@Builder(toBuilder = true)
public class RawFileRecord {

    long id;

    String path;

    String title;

    /** Artist tag exactly as stored in the container, possibly listing several artists. */
    String artist;

    String album;

    String albumArtist;

    Long durationMs;

    Integer trackNo;

    Integer year;

    String genre;

    String mimeType;

    Long fileSize;

    Long dateModified;

    public String parentDirectory() {
        if (path == null) {
            return null;
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        if (slash < 0) {
            return "";
        }
        return slash == 0 ? "/" : normalized.substring(0, slash);
    }

    public String fileName() {
        if (path == null) {
            return null;
        }
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
