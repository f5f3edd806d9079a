package com.example.medialibrary.domain.model;

import lombok.Value;

/**
 * A catalog record plus whatever the deep scan extracted for it. Both extras may be null when
 * no deep scan ran or extraction found nothing.
 */
@Value
public class EnrichedRecord {

    RawFileRecord record;

    AudioMeta audioMeta;

    String albumArtUri;

    public static EnrichedRecord plain(RawFileRecord record) {
        return new EnrichedRecord(record, null, null);
    }
}
