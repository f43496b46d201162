package com.example.iptvcatalog.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * Channel rows written per insert statement; source existence is re-checked before each chunk.
     */
    private int channelChunkSize = 500;

    /**
     * Episode rows written per insert statement within one series.
     */
    private int episodeChunkSize = 500;

    private int executorThreadCount = 4;

    private int executorQueueSize = 50;

    private boolean refreshEnabled = true;

    private String refreshCron = "0 0 4 * * ?";

    /**
     * Sources whose last successful fetch is older than this are re-synced by the refresh job.
     */
    private int refreshStaleHours = 24;

    private int errorMessageMaxLength = 1000;
}
