package com.example.iptvcatalog.infrastructure.http;

import com.example.iptvcatalog.common.config.AppPlaylistFetchProperties;
import com.example.iptvcatalog.common.exception.PlaylistDownloadException;
import com.example.iptvcatalog.domain.model.PlaylistFetchResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class HttpPlaylistDownloader implements PlaylistDownloader {

    private static final Logger log = LoggerFactory.getLogger(HttpPlaylistDownloader.class);

    private final CloseableHttpClient httpClient;
    private final AppPlaylistFetchProperties fetchProperties;
    private final ExecutorService playlistFetchExecutor;
    private final MeterRegistry meterRegistry;

    public HttpPlaylistDownloader(CloseableHttpClient playlistHttpClient,
                                  AppPlaylistFetchProperties fetchProperties,
                                  @Qualifier("playlistFetchExecutor") ExecutorService playlistFetchExecutor,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.httpClient = playlistHttpClient;
        this.fetchProperties = fetchProperties;
        this.playlistFetchExecutor = playlistFetchExecutor;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @Override
    public String fetch(String url) {
        int maxAttempts = Math.max(1, fetchProperties.getMaxAttempts());
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String body = executeGet(url);
                recordCounter("iptv.playlist.fetch.attempt", "outcome", "success");
                if (attempt > 1) {
                    log.info("PLAYLIST_FETCH_RECOVERED url={} attempt={}/{}", url, attempt, maxAttempts);
                }
                return body;
            } catch (IOException | PlaylistHttpStatusException e) {
                lastError = e;
                recordCounter("iptv.playlist.fetch.attempt", "outcome", "failed");
                log.warn("PLAYLIST_FETCH_ATTEMPT_FAILED url={} attempt={}/{} reason={}",
                        url, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleepRetryBackoff(attempt);
                }
            }
        }
        String message = "Failed to download playlist after " + maxAttempts + " attempts: "
                + (lastError == null ? "unknown error" : lastError.getMessage());
        throw new PlaylistDownloadException(message, url, maxAttempts, lastError);
    }

    @Override
    public List<PlaylistFetchResult> fetchAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return Collections.emptyList();
        }
        List<CompletableFuture<PlaylistFetchResult>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchQuietly(url), playlistFetchExecutor));
        }
        List<PlaylistFetchResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(awaitResult(urls.get(i), futures.get(i)));
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("PLAYLIST_BATCH_FETCH_FINISH total={} failed={}", results.size(), failed);
        return results;
    }

    private PlaylistFetchResult fetchQuietly(String url) {
        try {
            return PlaylistFetchResult.success(url, fetch(url));
        } catch (PlaylistDownloadException e) {
            return PlaylistFetchResult.failure(url, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("PLAYLIST_FETCH_UNEXPECTED url={} reason={}", url, e.getMessage(), e);
            return PlaylistFetchResult.failure(url, e.getMessage());
        }
    }

    private PlaylistFetchResult awaitResult(String url, CompletableFuture<PlaylistFetchResult> future) {
        try {
            return future.join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return PlaylistFetchResult.failure(url, cause.getMessage());
        }
    }

    private String executeGet(String url) throws IOException {
        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (statusCode != HttpStatus.SC_OK) {
                EntityUtils.consumeQuietly(entity);
                throw new PlaylistHttpStatusException(statusCode);
            }
            if (entity == null) {
                return "";
            }
            return EntityUtils.toString(entity, StandardCharsets.UTF_8);
        }
    }

    private void sleepRetryBackoff(int attempt) {
        long backoff = Math.max(0L, fetchProperties.getRetryBackoffMs());
        long sleepMs = backoff * (1L << (attempt - 1));
        if (sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Playlist download retry interrupted");
        }
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Playlist fetch metric counter failed, name={}", name, ex);
        }
    }

    private static class PlaylistHttpStatusException extends RuntimeException {

        private PlaylistHttpStatusException(int statusCode) {
            super("HTTP " + statusCode);
        }
    }
}
