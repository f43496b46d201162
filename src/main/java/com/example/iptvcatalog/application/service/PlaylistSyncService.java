package com.example.iptvcatalog.application.service;

import com.example.iptvcatalog.common.config.AppSyncProperties;
import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.domain.enumtype.SourceSyncState;
import com.example.iptvcatalog.domain.model.ClassifiedEntry;
import com.example.iptvcatalog.domain.model.ClassifiedSet;
import com.example.iptvcatalog.domain.model.ParseError;
import com.example.iptvcatalog.domain.model.ParsedPlaylist;
import com.example.iptvcatalog.domain.model.SeriesGroup;
import com.example.iptvcatalog.domain.model.SyncResult;
import com.example.iptvcatalog.infrastructure.http.PlaylistDownloader;
import com.example.iptvcatalog.infrastructure.parser.PlaylistParser;
import com.example.iptvcatalog.infrastructure.persistence.entity.M3uSourceEntity;
import com.example.iptvcatalog.infrastructure.persistence.entity.SeriesEntity;
import com.example.iptvcatalog.infrastructure.persistence.mapper.M3uSourceMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Runs one full synchronization of an M3U source into its profile's catalog.
 *
 * <p>Deleting the source row while a run is in flight aborts it at the next chunk boundary without touching
 * the status columns. Every other failure is persisted as {@code FAILED} with the error message.
 */
@Service
public class PlaylistSyncService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistSyncService.class);

    static final String MDC_SOURCE_ID = "sourceId";

    private final M3uSourceMapper m3uSourceMapper;
    private final PlaylistDownloader playlistDownloader;
    private final PlaylistParser playlistParser;
    private final ContentCategorizer contentCategorizer;
    private final CatalogWriteService catalogWriteService;
    private final AppSyncProperties appSyncProperties;
    private final MeterRegistry meterRegistry;

    public PlaylistSyncService(M3uSourceMapper m3uSourceMapper,
                               PlaylistDownloader playlistDownloader,
                               PlaylistParser playlistParser,
                               ContentCategorizer contentCategorizer,
                               CatalogWriteService catalogWriteService,
                               AppSyncProperties appSyncProperties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.m3uSourceMapper = m3uSourceMapper;
        this.playlistDownloader = playlistDownloader;
        this.playlistParser = playlistParser;
        this.contentCategorizer = contentCategorizer;
        this.catalogWriteService = catalogWriteService;
        this.appSyncProperties = appSyncProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public SyncResult sync(Long sourceId) {
        M3uSourceEntity source = m3uSourceMapper.selectById(sourceId);
        if (source == null) {
            throw BusinessException.notFound("Playlist source not found: " + sourceId);
        }
        long startedAtNanos = System.nanoTime();
        MDC.put(MDC_SOURCE_ID, String.valueOf(sourceId));
        try {
            SyncResult result = runSync(source, startedAtNanos);
            recordCounter("iptv.sync.result", "outcome", result.getOutcome().name());
            return result;
        } finally {
            recordDuration("iptv.sync.latency", System.nanoTime() - startedAtNanos);
            MDC.remove(MDC_SOURCE_ID);
        }
    }

    private SyncResult runSync(M3uSourceEntity source, long startedAtNanos) {
        Long sourceId = source.getId();
        Long profileId = source.getProfileId();
        SourceSyncState previous = SourceSyncState.fromValue(source.getLastStatus());
        if (!previous.canTransitionTo(SourceSyncState.FETCHING)) {
            log.warn("SYNC_RESTART_FROM_STALE sourceId={} previousStatus={}", sourceId, previous);
        }
        log.info("SYNC_START sourceId={} profileId={} url={}", sourceId, profileId, source.getUrl());

        try {
            m3uSourceMapper.updateStatus(sourceId, SourceSyncState.FETCHING.name());
            String content = playlistDownloader.fetch(source.getUrl());

            m3uSourceMapper.updateStatus(sourceId, SourceSyncState.PARSING.name());
            ParsedPlaylist parsed = playlistParser.parse(content, source.getUrl());
            logParseErrors(sourceId, parsed);
            ClassifiedSet classified = contentCategorizer.categorize(parsed.getEntries());
            log.info("SYNC_CLASSIFIED sourceId={} entries={} livestreams={} movies={} series={} episodes={}",
                    sourceId, parsed.getTotalEntries(), classified.getLivestreams().size(),
                    classified.getMovies().size(), classified.getSeriesGroups().size(), classified.episodeCount());

            catalogWriteService.deleteProfileCatalog(profileId);

            if (!writeChannels(sourceId, profileId, classified) || !writeSeries(sourceId, profileId, classified)) {
                log.warn("SYNC_ABORTED_SOURCE_DELETED sourceId={} profileId={}", sourceId, profileId);
                return SyncResult.sourceDeleted(elapsedMillis(startedAtNanos));
            }

            m3uSourceMapper.markSuccess(sourceId, SourceSyncState.SUCCESS.name(), parsed.getTotalEntries());
            SyncResult result = SyncResult.success(parsed.getTotalEntries(), classified, elapsedMillis(startedAtNanos));
            log.info("SYNC_RESULT sourceId={} status={} entries={} livestreams={} movies={} series={} episodes={} "
                            + "parseErrors={} costMs={}",
                    sourceId, SourceSyncState.SUCCESS.name(), result.getTotalEntries(), result.getLivestreams(),
                    result.getMovies(), result.getSeries(), result.getEpisodes(), parsed.getErrors().size(),
                    result.getDurationMs());
            return result;
        } catch (Exception e) {
            String message = errorMessage(e);
            log.error("SYNC_FAILED sourceId={} profileId={} reason={}", sourceId, profileId, message, e);
            m3uSourceMapper.markFailed(sourceId, SourceSyncState.FAILED.name(),
                    truncate(message, appSyncProperties.getErrorMessageMaxLength()));
            return SyncResult.failure(message, elapsedMillis(startedAtNanos));
        }
    }

    /**
     * @return false when the source disappeared before a chunk was written
     */
    private boolean writeChannels(Long sourceId, Long profileId, ClassifiedSet classified) {
        List<ClassifiedEntry> channels = new ArrayList<>(
                classified.getLivestreams().size() + classified.getMovies().size());
        channels.addAll(classified.getLivestreams());
        channels.addAll(classified.getMovies());

        int chunkSize = Math.max(1, appSyncProperties.getChannelChunkSize());
        int written = 0;
        for (int from = 0; from < channels.size(); from += chunkSize) {
            if (!sourceExists(sourceId)) {
                return false;
            }
            int to = Math.min(from + chunkSize, channels.size());
            written += catalogWriteService.insertChannels(channels.subList(from, to), profileId);
        }
        log.info("SYNC_CHANNELS_WRITTEN sourceId={} channels={}", sourceId, written);
        return true;
    }

    private boolean writeSeries(Long sourceId, Long profileId, ClassifiedSet classified) {
        int episodesWritten = 0;
        for (SeriesGroup group : classified.seriesGroupsByName()) {
            if (!sourceExists(sourceId)) {
                return false;
            }
            SeriesEntity series = catalogWriteService.findOrCreateSeries(group, profileId);
            episodesWritten += catalogWriteService.insertEpisodes(series.getId(), group.getEpisodes());
        }
        log.info("SYNC_SERIES_WRITTEN sourceId={} series={} episodes={}",
                sourceId, classified.getSeriesGroups().size(), episodesWritten);
        return true;
    }

    private boolean sourceExists(Long sourceId) {
        return m3uSourceMapper.countById(sourceId) > 0;
    }

    private void logParseErrors(Long sourceId, ParsedPlaylist parsed) {
        List<ParseError> errors = parsed.getErrors();
        if (errors == null || errors.isEmpty()) {
            return;
        }
        log.info("SYNC_PARSE_ERRORS sourceId={} count={}", sourceId, errors.size());
        if (log.isDebugEnabled()) {
            for (ParseError error : errors) {
                log.debug("SYNC_PARSE_ERROR sourceId={} line={} reason={} raw={}",
                        sourceId, error.getLineNumber(), error.getReason(), error.getRawLine());
            }
        }
    }

    private String errorMessage(Exception e) {
        String message = e.getMessage();
        return message == null || message.trim().isEmpty() ? e.getClass().getSimpleName() : message;
    }

    private String truncate(String value, int maxLength) {
        if (value == null || maxLength <= 0) {
            return value;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private long elapsedMillis(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Sync metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Sync metric timer failed, name={}", name, ex);
        }
    }
}
