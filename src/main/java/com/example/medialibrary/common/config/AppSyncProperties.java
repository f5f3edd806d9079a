package com.example.medialibrary.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * Max album-art references kept in memory, keyed by album id.
     */
    private int artCacheCapacity = 200;

    /**
     * Max audio-property entries kept in memory, keyed by song id.
     */
    private int audioMetaCacheCapacity = 1000;

    /**
     * Max song ids remembered as having no extractable art.
     */
    private int noArtCacheCapacity = 5000;

    /**
     * Batch size for I/O-bound work (file probing, picture extraction).
     */
    private int ioBatchSize = 100;

    /**
     * Batch size for CPU-bound work.
     */
    private int cpuBatchSize = 50;

    /**
     * Inputs smaller than this run as a single batch with concurrency equal to their size.
     */
    private int smallInputThreshold = 10;

    private int ioThreadCount = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

    private int cpuThreadCount = Math.max(1, Runtime.getRuntime().availableProcessors());

    /**
     * Per-statement bind parameter ceiling of the backend store. Chunk sizes are derived from it
     * per entity type: chunkSize * columnCount never exceeds this value.
     */
    private int maxSqlParameters = 999;

    /**
     * Directory where extracted cover art and "no art" markers are written.
     */
    private String artworkDir = System.getProperty("java.io.tmpdir") + "/media-library/artwork";

    /**
     * Delimiters splitting a raw artist tag into individual artists. Matched case-insensitively.
     */
    private List<String> artistSeparators = new ArrayList<>(Arrays.asList(
            "\u0000", ";", " / ", " & ", " feat. ", " ft. ", " featuring "));

    /**
     * Cron for scheduled syncs. "-" disables scheduling.
     */
    private String cron = "-";

    /**
     * Log a progress line every N deep-scanned records.
     */
    private int progressLogInterval = 500;

    public List<String> normalizedArtistSeparators() {
        return artistSeparators.stream()
                .filter(item -> item != null && !item.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
