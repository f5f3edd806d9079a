package com.example.medialibrary.application.service;

import com.example.medialibrary.domain.enumtype.SyncState;

/**
 * Observer for a running sync. Callbacks arrive on the sync driver thread.
 */
public interface SyncProgressListener {

    SyncProgressListener NOOP = new SyncProgressListener() {
    };

    default void onStateChanged(SyncState state) {
    }

    /**
     * Called after every deep-scan batch.
     */
    default void onProgress(int processed, int total) {
    }
}
