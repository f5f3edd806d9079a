package com.example.medialibrary.infrastructure.preference;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.exception.SyncConfigurationException;
import com.example.medialibrary.common.util.DirectoryPaths;
import com.example.medialibrary.domain.model.SyncPreferences;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class PropertiesLibraryPreferences implements LibraryPreferences {

    private final AppLibraryProperties appLibraryProperties;

    public PropertiesLibraryPreferences(AppLibraryProperties appLibraryProperties) {
        this.appLibraryProperties = appLibraryProperties;
    }

    @Override
    public SyncPreferences snapshot() {
        Set<String> blocked = normalize(appLibraryProperties.getBlockedDirectories(), "blocked-directories");
        Set<String> allowed = normalize(appLibraryProperties.getAllowedDirectories(), "allowed-directories");
        return new SyncPreferences(blocked, allowed, appLibraryProperties.isDeepScan());
    }

    private Set<String> normalize(List<String> values, String name) {
        Set<String> result = new LinkedHashSet<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            if (value == null || value.trim().isEmpty()) {
                throw new SyncConfigurationException("Blank entry in app.library." + name);
            }
            result.add(DirectoryPaths.normalize(value));
        }
        return result;
    }
}
