package com.example.iptvcatalog.common.config;

import java.util.concurrent.ExecutorService;
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
    private ExecutorService playlistFetchExecutor;

    @Bean
    public ExecutorService syncTaskExecutor(AppSyncProperties appSyncProperties) {
        int core = Math.max(1, appSyncProperties.getExecutorThreadCount());
        int queueSize = Math.max(1, appSyncProperties.getExecutorQueueSize());
        this.syncTaskExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueSize),
                new NamedThreadFactory("m3u-sync-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.syncTaskExecutor;
    }

    /**
     * Fixed worker pool for batch playlist downloads; its size is the in-flight request bound.
     */
    @Bean
    public ExecutorService playlistFetchExecutor(AppPlaylistFetchProperties fetchProperties) {
        int workers = Math.max(1, fetchProperties.getBatchConcurrency());
        this.playlistFetchExecutor = new ThreadPoolExecutor(
                workers,
                workers,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("m3u-fetch-"));
        return this.playlistFetchExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (syncTaskExecutor != null) {
            syncTaskExecutor.shutdown();
        }
        if (playlistFetchExecutor != null) {
            playlistFetchExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
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
