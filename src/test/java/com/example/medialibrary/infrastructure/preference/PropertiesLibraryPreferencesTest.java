package com.example.medialibrary.infrastructure.preference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.SyncConfigurationException;
import com.example.medialibrary.domain.model.SyncPreferences;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import org.junit.jupiter.api.Test;

class PropertiesLibraryPreferencesTest {

    @Test
    void snapshotNormalizesDirectories() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setBlockedDirectories(Arrays.asList("/music/ringtones/", "\\music\\\\notifications"));
        properties.setAllowedDirectories(Collections.singletonList("/music"));
        properties.setDeepScan(true);

        SyncPreferences snapshot = new PropertiesLibraryPreferences(properties).snapshot();

        assertEquals(new LinkedHashSet<>(Arrays.asList("/music/ringtones", "/music/notifications")),
                snapshot.getBlockedDirectories());
        assertEquals(Collections.singleton("/music"), snapshot.getAllowedDirectories());
        assertTrue(snapshot.isDeepScan());
    }

    @Test
    void snapshotIsDetachedFromLaterChanges() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setBlockedDirectories(new ArrayList<>(Collections.singletonList("/a")));
        PropertiesLibraryPreferences preferences = new PropertiesLibraryPreferences(properties);

        SyncPreferences snapshot = preferences.snapshot();
        properties.getBlockedDirectories().add("/b");

        assertEquals(Collections.singleton("/a"), snapshot.getBlockedDirectories());
    }

    @Test
    void blankEntryIsRejected() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setBlockedDirectories(Arrays.asList("/a", " "));

        assertThrows(SyncConfigurationException.class, () -> new PropertiesLibraryPreferences(properties).snapshot());
    }

    @Test
    void directoryInBothListsIsKeptInBoth() {
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setBlockedDirectories(Collections.singletonList("/music/a/"));
        properties.setAllowedDirectories(Arrays.asList("/music/a", "/music/b"));

        SyncPreferences snapshot = new PropertiesLibraryPreferences(properties).snapshot();

        assertEquals(Collections.singleton("/music/a"), snapshot.getBlockedDirectories());
        assertEquals(new LinkedHashSet<>(Arrays.asList("/music/a", "/music/b")), snapshot.getAllowedDirectories());
    }
}
