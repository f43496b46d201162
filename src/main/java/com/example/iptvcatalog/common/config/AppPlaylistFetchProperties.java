package com.example.iptvcatalog.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.playlist.fetch")
public class AppPlaylistFetchProperties {

    private int maxAttempts = 3;

    /**
     * First backoff delay; doubled after every failed attempt.
     */
    private long retryBackoffMs = 1000;

    /**
     * Applied to connect, socket read and pool lease.
     */
    private int timeoutMs = 60000;

    private int batchConcurrency = 5;

    private int maxPreviewUrls = 20;

    private int maxConnections = 20;

    private String userAgent = "iptv-catalog/0.1";
}
