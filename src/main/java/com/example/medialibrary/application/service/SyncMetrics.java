package com.example.medialibrary.application.service;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Optional Micrometer recording. Without a registry, or when a meter update fails, calls are no-ops.
 */
@Component
public class SyncMetrics {

    private static final Logger log = LoggerFactory.getLogger(SyncMetrics.class);

    private final MeterRegistry meterRegistry;

    @Autowired
    public SyncMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public static SyncMetrics noop() {
        return new SyncMetrics((MeterRegistry) null);
    }

    SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    public void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }

    public void cacheHit(String cache) {
        incrementCounter("library.cache.hit", 1, "cache", cache);
    }

    public void cacheMiss(String cache) {
        incrementCounter("library.cache.miss", 1, "cache", cache);
    }
}
