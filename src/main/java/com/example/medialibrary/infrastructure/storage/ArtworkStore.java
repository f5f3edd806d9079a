package com.example.medialibrary.infrastructure.storage;

import java.io.IOException;

/**
 * Content artifact store for extracted cover art. References are opaque strings handed to the
 * presentation layer; one artifact exists per song id.
 */
public interface ArtworkStore {

    String save(byte[] bytes, long songId) throws IOException;

    /**
     * Reference of an artifact persisted earlier, or null. Never extracts anything.
     */
    String referenceFor(long songId);

    void markNoArt(long songId);

    void clearNoArtMarker(long songId);

    boolean hasNoArtMarker(long songId);
}
