package com.example.iptvcatalog.application.service;

import com.example.iptvcatalog.api.response.PlaylistPreviewResponse;
import com.example.iptvcatalog.common.config.AppPlaylistFetchProperties;
import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.domain.model.ClassifiedSet;
import com.example.iptvcatalog.domain.model.ParsedPlaylist;
import com.example.iptvcatalog.domain.model.PlaylistFetchResult;
import com.example.iptvcatalog.infrastructure.http.PlaylistDownloader;
import com.example.iptvcatalog.infrastructure.parser.PlaylistParser;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Downloads, parses and classifies several playlists without persisting anything.
 */
@Service
public class PlaylistPreviewService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistPreviewService.class);

    private final PlaylistDownloader playlistDownloader;
    private final PlaylistParser playlistParser;
    private final ContentCategorizer contentCategorizer;
    private final AppPlaylistFetchProperties fetchProperties;

    public PlaylistPreviewService(PlaylistDownloader playlistDownloader,
                                  PlaylistParser playlistParser,
                                  ContentCategorizer contentCategorizer,
                                  AppPlaylistFetchProperties fetchProperties) {
        this.playlistDownloader = playlistDownloader;
        this.playlistParser = playlistParser;
        this.contentCategorizer = contentCategorizer;
        this.fetchProperties = fetchProperties;
    }

    public List<PlaylistPreviewResponse> preview(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new BusinessException("400", "At least one playlist URL is required");
        }
        int limit = fetchProperties.getMaxPreviewUrls();
        if (urls.size() > limit) {
            throw new BusinessException("400", "Too many playlist URLs, at most " + limit + " per request",
                    "Split the URLs into smaller batches");
        }
        List<PlaylistFetchResult> fetched = playlistDownloader.fetchAll(urls);
        List<PlaylistPreviewResponse> responses = new ArrayList<>(fetched.size());
        for (PlaylistFetchResult result : fetched) {
            ParsedPlaylist parsed = result.isSuccess()
                    ? playlistParser.parse(result.getContent(), result.getUrl())
                    : ParsedPlaylist.failed(result.getUrl(), result.getErrorMessage());
            responses.add(toResponse(result, parsed));
        }
        log.info("PLAYLIST_PREVIEW_FINISH urls={} failed={}",
                responses.size(), responses.stream().filter(r -> !r.isSuccess()).count());
        return responses;
    }

    private PlaylistPreviewResponse toResponse(PlaylistFetchResult result, ParsedPlaylist parsed) {
        PlaylistPreviewResponse.PlaylistPreviewResponseBuilder builder = PlaylistPreviewResponse.builder()
                .sourceUrl(result.getUrl())
                .success(result.isSuccess())
                .totalEntries(parsed.getTotalEntries())
                .errorCount(parsed.getErrors().size());
        if (!result.isSuccess()) {
            return builder.errorMessage(result.getErrorMessage()).build();
        }
        ClassifiedSet classified = contentCategorizer.categorize(parsed.getEntries());
        return builder
                .livestreams(classified.getLivestreams().size())
                .movies(classified.getMovies().size())
                .series(classified.getSeriesGroups().size())
                .episodes(classified.episodeCount())
                .build();
    }
}
