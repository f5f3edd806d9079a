package com.example.medialibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default backing for library preferences: catalog roots plus the directory allow/block lists
 * and the deep-scan switch.
 */
@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    private List<String> rootPaths = new ArrayList<>();

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList(
            "mp3", "flac", "m4a", "aac", "ogg", "opus", "wav", "wma", "aiff"));

    private List<String> blockedDirectories = new ArrayList<>();

    private List<String> allowedDirectories = new ArrayList<>();

    private boolean deepScan = false;

    public Set<String> normalizedAudioExtensions() {
        return audioExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
