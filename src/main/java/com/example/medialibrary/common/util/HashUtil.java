package com.example.medialibrary.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    private HashUtil() {
    }

    /**
     * Positive, non-zero id derived from the first 8 bytes of the MD5 of {@code key}. The same key
     * always yields the same id, across runs and processes.
     */
    public static long stableId(String key) {
        byte[] bytes = md5(key);
        long value = 0L;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (bytes[i] & 0xFFL);
        }
        value &= Long.MAX_VALUE;
        return value == 0L ? 1L : value;
    }

    private static byte[] md5(String text) {
        try {
            MessageDigest messageDigest = MessageDigest.getInstance("MD5");
            return messageDigest.digest(text.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 algorithm not found", e);
        }
    }
}
