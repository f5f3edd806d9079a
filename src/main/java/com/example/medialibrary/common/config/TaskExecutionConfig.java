package com.example.medialibrary.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService syncTaskExecutor;
    private ExecutorService ioExecutor;
    private ExecutorService cpuExecutor;

    /**
     * Single-slot driver pool for whole syncs. Only one sync runs at a time; the queue absorbs a
     * short burst of scheduled/manual triggers which the task service then rejects itself.
     */
    @Bean
    public ExecutorService syncTaskExecutor() {
        this.syncTaskExecutor = new ThreadPoolExecutor(
                1,
                1,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(4),
                new NamedThreadFactory("library-sync-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.syncTaskExecutor;
    }

    @Bean
    public ExecutorService ioExecutor(AppSyncProperties appSyncProperties) {
        this.ioExecutor = Executors.newFixedThreadPool(
                Math.max(1, appSyncProperties.getIoThreadCount()), new NamedThreadFactory("library-io-"));
        return this.ioExecutor;
    }

    @Bean
    public ExecutorService cpuExecutor(AppSyncProperties appSyncProperties) {
        this.cpuExecutor = Executors.newFixedThreadPool(
                Math.max(1, appSyncProperties.getCpuThreadCount()), new NamedThreadFactory("library-cpu-"));
        return this.cpuExecutor;
    }

    @PreDestroy
    public void shutdown() {
        shutdownQuietly(syncTaskExecutor);
        shutdownQuietly(ioExecutor);
        shutdownQuietly(cpuExecutor);
    }

    private void shutdownQuietly(ExecutorService executor) {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        public NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
