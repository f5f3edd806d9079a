package com.example.medialibrary.domain.enumtype;

public enum SyncState {
    IDLE,
    ENUMERATING,
    FILTERING,
    DEEP_SCANNING,
    MERGING,
    PERSISTING,
    DONE,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELED;
    }
}
