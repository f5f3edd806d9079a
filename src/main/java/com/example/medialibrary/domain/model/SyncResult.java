package com.example.medialibrary.domain.model;

import com.example.medialibrary.domain.enumtype.SyncState;
import lombok.Data;

@Data
public class SyncResult {

    private SyncState state = SyncState.IDLE;

    /** Last non-terminal state reached; tells where a failed or canceled sync stopped. */
    private SyncState lastStage = SyncState.IDLE;

    private boolean deepScan;

    private int enumeratedCount;

    private int filteredOutCount;

    private int deepScannedCount;

    private int songCount;

    private int albumCount;

    private int artistCount;

    private int crossRefCount;

    private String errorMessage;

    private long elapsedMs;

    public boolean isSuccess() {
        return state == SyncState.DONE;
    }
}
