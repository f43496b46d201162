package com.example.iptvcatalog.common.config;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HttpClientConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient playlistHttpClient(AppPlaylistFetchProperties fetchProperties) {
        int timeoutMs = Math.max(1000, fetchProperties.getTimeoutMs());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setRedirectsEnabled(true)
                .build();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        int maxConnections = Math.max(fetchProperties.getBatchConcurrency(), fetchProperties.getMaxConnections());
        connectionManager.setMaxTotal(maxConnections);
        connectionManager.setDefaultMaxPerRoute(maxConnections);

        // Attempt counting and backoff live in HttpPlaylistDownloader.
        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent(fetchProperties.getUserAgent())
                .disableAutomaticRetries()
                .build();
    }
}
