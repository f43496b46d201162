package com.example.iptvcatalog.common.exception;

/**
 * Terminal failure to fetch a playlist after the retry budget was spent.
 */
public class PlaylistDownloadException extends RuntimeException {

    private final String url;
    private final int attempts;

    public PlaylistDownloadException(String message, String url, int attempts, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
