package com.example.medialibrary.infrastructure.preference;

import com.example.medialibrary.common.exception.SyncConfigurationException;
import com.example.medialibrary.domain.model.SyncPreferences;

public interface LibraryPreferences {

    /**
     * Reads the directory rules and the deep-scan flag as they are right now.
     *
     * @throws SyncConfigurationException when the preferences cannot be read or contradict each other
     */
    SyncPreferences snapshot();
}
