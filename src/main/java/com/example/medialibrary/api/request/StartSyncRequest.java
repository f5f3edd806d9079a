package com.example.medialibrary.api.request;

import lombok.Data;

@Data
public class StartSyncRequest {

    /** Overrides the configured deep-scan flag for this run when set. */
    private Boolean deepScan;
}
