package com.example.medialibrary.domain.model;

import lombok.Value;

@Value
public class AudioMeta {

    public static final AudioMeta EMPTY = new AudioMeta(null, null, null);

    String mimeType;

    /** Bits per second. */
    Integer bitrate;

    /** Hz. */
    Integer sampleRate;

    public boolean isComplete() {
        return mimeType != null && bitrate != null && sampleRate != null;
    }

    /**
     * Keeps every field already present and takes only the missing ones from {@code other}.
     */
    public AudioMeta fillMissingFrom(AudioMeta other) {
        if (other == null) {
            return this;
        }
        return new AudioMeta(
                mimeType != null ? mimeType : other.getMimeType(),
                bitrate != null ? bitrate : other.getBitrate(),
                sampleRate != null ? sampleRate : other.getSampleRate());
    }
}
