package com.example.medialibrary.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Value;

/**
 * Snapshot of the user preferences taken at sync start and used unchanged for the whole sync.
 */
@Value
public class SyncPreferences {

    Set<String> blockedDirectories;

    Set<String> allowedDirectories;

    boolean deepScan;

    public SyncPreferences(Set<String> blockedDirectories, Set<String> allowedDirectories, boolean deepScan) {
        this.blockedDirectories = blockedDirectories == null
                ? Collections.<String>emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(blockedDirectories));
        this.allowedDirectories = allowedDirectories == null
                ? Collections.<String>emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(allowedDirectories));
        this.deepScan = deepScan;
    }

    public SyncPreferences withDeepScan(boolean value) {
        return new SyncPreferences(blockedDirectories, allowedDirectories, value);
    }
}
