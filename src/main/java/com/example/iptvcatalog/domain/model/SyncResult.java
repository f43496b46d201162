package com.example.iptvcatalog.domain.model;

import com.example.iptvcatalog.domain.enumtype.SyncOutcome;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one sync run. Counts are zero unless the run succeeded.
 */
@Value
@Builder
public class SyncResult {

    boolean success;

    SyncOutcome outcome;

    int totalEntries;

    int livestreams;

    int movies;

    int series;

    int episodes;

    long durationMs;

    /** Null on success. */
    List<String> errors;

    public static SyncResult success(int totalEntries, ClassifiedSet classified, long durationMs) {
        return SyncResult.builder()
                .success(true)
                .outcome(SyncOutcome.SUCCESS)
                .totalEntries(totalEntries)
                .livestreams(classified.getLivestreams().size())
                .movies(classified.getMovies().size())
                .series(classified.getSeriesGroups().size())
                .episodes(classified.episodeCount())
                .durationMs(durationMs)
                .build();
    }

    public static SyncResult failure(String errorMessage, long durationMs) {
        return SyncResult.builder()
                .success(false)
                .outcome(SyncOutcome.FAILED)
                .durationMs(durationMs)
                .errors(Collections.singletonList(errorMessage))
                .build();
    }

    public static SyncResult sourceDeleted(long durationMs) {
        return SyncResult.builder()
                .success(false)
                .outcome(SyncOutcome.SOURCE_DELETED)
                .durationMs(durationMs)
                .errors(Collections.singletonList("Source deleted during sync"))
                .build();
    }
}
