package com.example.iptvcatalog.domain.model;

import lombok.Value;

/**
 * Per-URL outcome of a batch download; a failed URL carries the terminal error message.
 */
@Value
public class PlaylistFetchResult {

    String url;

    boolean success;

    String content;

    String errorMessage;

    public static PlaylistFetchResult success(String url, String content) {
        return new PlaylistFetchResult(url, true, content, null);
    }

    public static PlaylistFetchResult failure(String url, String errorMessage) {
        return new PlaylistFetchResult(url, false, null, errorMessage);
    }
}
