package com.example.medialibrary.common.util;

public final class DirectoryPaths {

    private DirectoryPaths() {
    }

    /**
     * Forward slashes, no duplicate or trailing slash. The root stays "/".
     */
    public static String normalize(String path) {
        if (path == null) {
            return null;
        }
        String normalized = path.trim().replace('\\', '/').replaceAll("/{2,}", "/");
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * True when {@code path} equals {@code prefix} or lies below it. Both must be normalized.
     * "/music/rock" is under "/music" but "/musicals" is not.
     */
    public static boolean isUnder(String path, String prefix) {
        if (path == null || prefix == null) {
            return false;
        }
        if ("/".equals(prefix)) {
            return path.startsWith("/");
        }
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length() || path.charAt(prefix.length()) == '/';
    }
}
