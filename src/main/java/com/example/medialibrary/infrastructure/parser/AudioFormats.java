package com.example.medialibrary.infrastructure.parser;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Mime type and container detection shared by the metadata readers.
 */
public final class AudioFormats {

    private static final Map<String, String> MIME_BY_EXTENSION;

    static {
        Map<String, String> map = new HashMap<>();
        map.put("mp3", "audio/mpeg");
        map.put("flac", "audio/flac");
        map.put("ogg", "audio/ogg");
        map.put("opus", "audio/ogg");
        map.put("wav", "audio/x-wav");
        map.put("m4a", "audio/mp4");
        map.put("mp4", "audio/mp4");
        map.put("aac", "audio/aac");
        map.put("amr", "audio/amr");
        map.put("wma", "audio/x-ms-wma");
        map.put("aif", "audio/aiff");
        map.put("aiff", "audio/aiff");
        MIME_BY_EXTENSION = Collections.unmodifiableMap(map);
    }

    private static final int SNIFF_LENGTH = 12;

    private AudioFormats() {
    }

    public static String mimeTypeForExtension(String extension) {
        if (extension == null) {
            return null;
        }
        return MIME_BY_EXTENSION.get(extension.trim().toLowerCase(Locale.ROOT));
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return null;
        }
        int dotIdx = fileName.lastIndexOf('.');
        int slashIdx = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (dotIdx < 0 || dotIdx < slashIdx || dotIdx >= fileName.length() - 1) {
            return null;
        }
        return fileName.substring(dotIdx + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Short label shown for a mime type, "-" when unknown.
     */
    public static String mimeTypeToFormat(String mimeType) {
        if (mimeType == null) {
            return "-";
        }
        switch (mimeType.toLowerCase(Locale.ROOT)) {
            case "audio/mpeg":
                return "mp3";
            case "audio/flac":
                return "flac";
            case "audio/x-wav":
            case "audio/wav":
                return "wav";
            case "audio/ogg":
                return "ogg";
            case "audio/mp4":
            case "audio/m4a":
                return "m4a";
            case "audio/aac":
                return "aac";
            case "audio/amr":
                return "amr";
            default:
                return "-";
        }
    }

    /**
     * Detects the container from the leading bytes of the stream and returns the matching file
     * extension, or null when the signature is not recognized. Reads at most a few bytes.
     */
    public static String sniffExtension(InputStream in) throws IOException {
        byte[] head = new byte[SNIFF_LENGTH];
        int read = 0;
        while (read < head.length) {
            int n = in.read(head, read, head.length - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        return sniffExtension(head, read);
    }

    static String sniffExtension(byte[] head, int length) {
        if (length >= 4 && startsWith(head, "fLaC")) {
            return "flac";
        }
        if (length >= 4 && startsWith(head, "OggS")) {
            return "ogg";
        }
        if (length >= 3 && startsWith(head, "ID3")) {
            return "mp3";
        }
        if (length >= 12 && startsWith(head, "RIFF") && matchesAt(head, 8, "WAVE")) {
            return "wav";
        }
        if (length >= 12 && startsWith(head, "FORM") && (matchesAt(head, 8, "AIFF") || matchesAt(head, 8, "AIFC"))) {
            return "aiff";
        }
        if (length >= 8 && matchesAt(head, 4, "ftyp")) {
            return "m4a";
        }
        if (length >= 5 && startsWith(head, "#!AMR")) {
            return "amr";
        }
        if (length >= 4 && (head[0] & 0xFF) == 0x30 && (head[1] & 0xFF) == 0x26
                && (head[2] & 0xFF) == 0xB2 && (head[3] & 0xFF) == 0x75) {
            return "wma";
        }
        if (length >= 2 && (head[0] & 0xFF) == 0xFF) {
            int second = head[1] & 0xFF;
            if ((second & 0xF6) == 0xF0) {
                return "aac";
            }
            if ((second & 0xE0) == 0xE0) {
                return "mp3";
            }
        }
        return null;
    }

    private static boolean startsWith(byte[] head, String signature) {
        return matchesAt(head, 0, signature);
    }

    private static boolean matchesAt(byte[] head, int offset, String signature) {
        if (head.length < offset + signature.length()) {
            return false;
        }
        for (int i = 0; i < signature.length(); i++) {
            if (head[offset + i] != (byte) signature.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
