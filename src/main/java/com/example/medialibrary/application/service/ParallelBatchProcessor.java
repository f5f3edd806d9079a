package com.example.medialibrary.application.service;

import com.example.medialibrary.common.config.AppSyncProperties;
import com.example.medialibrary.domain.enumtype.BatchWorkload;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Applies a transform to every item of a list in consecutive batches. Items of one batch run
 * concurrently on the pool matching the workload; the next batch starts only after the current one
 * has fully completed. Output order always matches input order.
 *
 * <p>A cancel signal is polled before each batch. When it fires, no further batch starts and a
 * {@link CancellationException} is thrown; the batch already in flight is allowed to finish.
 */
@Component
public class ParallelBatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(ParallelBatchProcessor.class);

    private final ExecutorService ioExecutor;
    private final ExecutorService cpuExecutor;
    private final AppSyncProperties appSyncProperties;

    public ParallelBatchProcessor(@Qualifier("ioExecutor") ExecutorService ioExecutor,
                                  @Qualifier("cpuExecutor") ExecutorService cpuExecutor,
                                  AppSyncProperties appSyncProperties) {
        this.ioExecutor = ioExecutor;
        this.cpuExecutor = cpuExecutor;
        this.appSyncProperties = appSyncProperties;
    }

    public <T, R> List<R> process(List<T> items, BatchWorkload workload, Function<T, R> transform) {
        return processWithProgress(items, optimalBatchSize(sizeOf(items), workload), workload,
                null, null, transform);
    }

    public <T, R> List<R> process(List<T> items, int batchSize, BatchWorkload workload,
                                  Function<T, R> transform) {
        return processWithProgress(items, batchSize, workload, null, null, transform);
    }

    /**
     * Same as {@link #process} but reports {@code (processedSoFar, total)} after every batch and
     * honours the cancel signal between batches.
     */
    public <T, R> List<R> processWithProgress(List<T> items,
                                              int batchSize,
                                              BatchWorkload workload,
                                              ProgressCallback onProgress,
                                              BooleanSupplier cancelSignal,
                                              Function<T, R> transform) {
        Objects.requireNonNull(transform, "transform");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        if (items == null || items.isEmpty()) {
            return Collections.emptyList();
        }
        ExecutorService executor = executorFor(workload);
        int total = items.size();
        List<R> results = new ArrayList<>(total);
        for (int start = 0; start < total; start += batchSize) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                log.info("BATCH_CANCELED processed={} total={}", start, total);
                throw new CancellationException("Batch processing canceled after " + start + " of " + total);
            }
            int end = Math.min(total, start + batchSize);
            results.addAll(runBatch(executor, items.subList(start, end), transform));
            if (onProgress != null) {
                onProgress.onProgress(end, total);
            }
        }
        return results;
    }

    public <T, R> List<R> processAndFilterNulls(List<T> items, BatchWorkload workload, Function<T, R> transform) {
        List<R> results = process(items, workload, transform);
        List<R> filtered = new ArrayList<>(results.size());
        for (R result : results) {
            if (result != null) {
                filtered.add(result);
            }
        }
        return filtered;
    }

    /**
     * Runs one task on the pool for the workload and waits for it.
     */
    public <R> R runOn(BatchWorkload workload, Callable<R> task) {
        Future<R> future = executorFor(workload).submit(withLoggingContext(task));
        return await(future);
    }

    /**
     * Batch size for {@code size} items: tiny inputs run as a single batch, inputs below the
     * workload preset are split in two, anything larger uses the preset.
     */
    public int optimalBatchSize(int size, BatchWorkload workload) {
        int preset = workload == BatchWorkload.CPU
                ? appSyncProperties.getCpuBatchSize()
                : appSyncProperties.getIoBatchSize();
        preset = Math.max(1, preset);
        int threshold = Math.max(1, appSyncProperties.getSmallInputThreshold());
        if (size < threshold) {
            return Math.max(1, size);
        }
        if (size < preset) {
            return Math.max(1, size / 2);
        }
        return preset;
    }

    private <T, R> List<R> runBatch(ExecutorService executor, List<T> batch, Function<T, R> transform) {
        List<Callable<R>> tasks = new ArrayList<>(batch.size());
        for (T item : batch) {
            tasks.add(withLoggingContext(() -> transform.apply(item)));
        }
        List<Future<R>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for batch");
        }
        List<R> results = new ArrayList<>(futures.size());
        for (Future<R> future : futures) {
            results.add(await(future));
        }
        return results;
    }

    /**
     * Carries the caller's MDC (the sync id among others) onto the pool thread for the task's duration.
     */
    static <R> Callable<R> withLoggingContext(Callable<R> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (context == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(context);
            }
            try {
                return task.call();
            } finally {
                if (previous == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(previous);
                }
            }
        };
    }

    private <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancellationException("Interrupted while waiting for task");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CompletionException(cause);
        }
    }

    private ExecutorService executorFor(BatchWorkload workload) {
        return workload == BatchWorkload.CPU ? cpuExecutor : ioExecutor;
    }

    private static int sizeOf(List<?> items) {
        return items == null ? 0 : items.size();
    }

    @FunctionalInterface
    public interface ProgressCallback {
        void onProgress(int processed, int total);
    }
}
