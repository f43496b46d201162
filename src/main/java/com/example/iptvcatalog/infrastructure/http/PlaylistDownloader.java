package com.example.iptvcatalog.infrastructure.http;

import com.example.iptvcatalog.domain.model.PlaylistFetchResult;
import java.util.List;

public interface PlaylistDownloader {

    /**
     * Fetches the playlist body, retrying transient failures.
     *
     * @throws com.example.iptvcatalog.common.exception.PlaylistDownloadException once every attempt failed
     */
    String fetch(String url);

    /**
     * Fetches several playlists with bounded concurrency. Results follow the input order and a failed URL
     * never aborts its siblings.
     */
    List<PlaylistFetchResult> fetchAll(List<String> urls);
}
