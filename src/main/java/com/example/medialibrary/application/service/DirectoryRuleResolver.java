package com.example.medialibrary.application.service;

import com.example.medialibrary.common.util.DirectoryPaths;
import com.example.medialibrary.domain.model.SyncPreferences;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether a file's parent directory takes part in a sync.
 *
 * <p>A directory under a blocked prefix is excluded unless an allowed prefix matches it more
 * specifically. With a non-empty allow list a directory must also be under one of the allowed
 * prefixes; otherwise everything not blocked is allowed. Instances are immutable and built once per
 * sync from the preference snapshot.
 */
public final class DirectoryRuleResolver {

    private final List<String> blocked;
    private final List<String> allowed;

    public DirectoryRuleResolver(Collection<String> blocked, Collection<String> allowed) {
        this.blocked = normalizeAll(blocked);
        this.allowed = normalizeAll(allowed);
    }

    public static DirectoryRuleResolver from(SyncPreferences preferences) {
        return new DirectoryRuleResolver(preferences.getBlockedDirectories(), preferences.getAllowedDirectories());
    }

    public boolean isAllowed(String parentPath) {
        String path = DirectoryPaths.normalize(parentPath);
        if (path == null) {
            return allowed.isEmpty();
        }
        int blockedMatch = longestMatch(path, blocked);
        int allowedMatch = longestMatch(path, allowed);
        if (blockedMatch >= 0 && allowedMatch <= blockedMatch) {
            return false;
        }
        return allowed.isEmpty() || allowedMatch >= 0;
    }

    public boolean hasRules() {
        return !blocked.isEmpty() || !allowed.isEmpty();
    }

    private int longestMatch(String path, List<String> prefixes) {
        int longest = -1;
        for (String prefix : prefixes) {
            if (prefix.length() > longest && DirectoryPaths.isUnder(path, prefix)) {
                longest = prefix.length();
            }
        }
        return longest;
    }

    private static List<String> normalizeAll(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            String normalized = DirectoryPaths.normalize(value);
            if (normalized != null && !normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
