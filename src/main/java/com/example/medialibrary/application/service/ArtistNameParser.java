package com.example.medialibrary.application.service;

import com.example.medialibrary.common.config.AppSyncProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Splits a raw artist tag such as "Alice & Bob feat. Carol" into individual names. Separators are
 * matched case-insensitively; names are trimmed and deduplicated ignoring case, first spelling wins.
 */
@Component
public class ArtistNameParser {

    private final Pattern separatorPattern;

    public ArtistNameParser(AppSyncProperties appSyncProperties) {
        this(appSyncProperties.normalizedArtistSeparators());
    }

    ArtistNameParser(List<String> separators) {
        if (separators == null || separators.isEmpty()) {
            this.separatorPattern = null;
        } else {
            this.separatorPattern = Pattern.compile(
                    separators.stream().map(Pattern::quote).collect(Collectors.joining("|")),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        }
    }

    /**
     * @return distinct artist names in tag order, empty when the tag holds no name
     */
    public List<String> split(String rawArtist) {
        if (!StringUtils.hasText(rawArtist)) {
            return Collections.emptyList();
        }
        String[] parts = separatorPattern == null
                ? new String[]{rawArtist}
                : separatorPattern.split(rawArtist);
        Map<String, String> distinct = new LinkedHashMap<>();
        for (String part : parts) {
            String name = part.trim();
            if (!name.isEmpty()) {
                distinct.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
            }
        }
        return new ArrayList<>(distinct.values());
    }
}
