package com.example.iptvcatalog.application.service;

import com.example.iptvcatalog.common.config.AppSyncProperties;
import com.example.iptvcatalog.domain.model.ClassifiedEntry;
import com.example.iptvcatalog.domain.model.EpisodeMetadata;
import com.example.iptvcatalog.domain.model.PlaylistEntry;
import com.example.iptvcatalog.domain.model.SeriesGroup;
import com.example.iptvcatalog.infrastructure.persistence.entity.ChannelEntity;
import com.example.iptvcatalog.infrastructure.persistence.entity.EpisodeEntity;
import com.example.iptvcatalog.infrastructure.persistence.entity.SeriesEntity;
import com.example.iptvcatalog.infrastructure.persistence.mapper.ChannelMapper;
import com.example.iptvcatalog.infrastructure.persistence.mapper.EpisodeMapper;
import com.example.iptvcatalog.infrastructure.persistence.mapper.SeriesMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Write side of the per-profile catalog: channels, series and episodes.
 */
@Service
public class CatalogWriteService {

    private static final Logger log = LoggerFactory.getLogger(CatalogWriteService.class);

    /** Width of {@code series.name} and {@code series.normalized_name}. */
    static final int SERIES_NAME_MAX_LENGTH = 512;

    private final ChannelMapper channelMapper;
    private final SeriesMapper seriesMapper;
    private final EpisodeMapper episodeMapper;
    private final AppSyncProperties appSyncProperties;
    private final ObjectMapper objectMapper;

    public CatalogWriteService(ChannelMapper channelMapper,
                               SeriesMapper seriesMapper,
                               EpisodeMapper episodeMapper,
                               AppSyncProperties appSyncProperties,
                               ObjectMapper objectMapper) {
        this.channelMapper = channelMapper;
        this.seriesMapper = seriesMapper;
        this.episodeMapper = episodeMapper;
        this.appSyncProperties = appSyncProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Removes every channel, series and episode of the profile as one unit of work.
     */
    @Transactional(rollbackFor = Exception.class)
    public void deleteProfileCatalog(Long profileId) {
        int channels = channelMapper.deleteByProfileId(profileId);
        int episodes = episodeMapper.deleteByProfileId(profileId);
        int series = seriesMapper.deleteByProfileId(profileId);
        log.info("CATALOG_CLEARED profileId={} channels={} series={} episodes={}",
                profileId, channels, series, episodes);
    }

    public int insertChannels(List<ClassifiedEntry> chunk, Long profileId) {
        if (chunk == null || chunk.isEmpty()) {
            return 0;
        }
        List<ChannelEntity> rows = new ArrayList<>(chunk.size());
        for (ClassifiedEntry classified : chunk) {
            rows.add(toChannelEntity(classified, profileId));
        }
        return channelMapper.batchInsert(rows);
    }

    /**
     * Looks the series up by its lowercase name within the profile and creates it when absent. A concurrent
     * insert of the same series is resolved by reading the winner's row.
     */
    public SeriesEntity findOrCreateSeries(SeriesGroup group, Long profileId) {
        String seriesName = truncate(group.getSeriesName(), SERIES_NAME_MAX_LENGTH);
        String normalizedName = normalizeSeriesName(seriesName);
        SeriesEntity existing = seriesMapper.selectByNormalizedName(normalizedName, profileId);
        if (existing != null) {
            return existing;
        }
        SeriesEntity entity = new SeriesEntity();
        entity.setName(seriesName);
        entity.setNormalizedName(normalizedName);
        entity.setLogo(group.getLogo());
        entity.setGroupTitle(group.getGroupTitle());
        entity.setProfileId(profileId);
        try {
            seriesMapper.insert(entity);
            return entity;
        } catch (DuplicateKeyException e) {
            SeriesEntity winner = seriesMapper.selectByNormalizedName(normalizedName, profileId);
            if (winner == null) {
                throw e;
            }
            log.info("SERIES_CREATE_RACE profileId={} normalizedName={} seriesId={}",
                    profileId, normalizedName, winner.getId());
            return winner;
        }
    }

    /**
     * Inserts the episodes of one series. Duplicates within the batch collapse to the last occurrence and keys
     * already stored for the series are skipped, so repeating the call inserts nothing.
     *
     * @return number of rows inserted
     */
    public int insertEpisodes(Long seriesId, List<ClassifiedEntry> episodes) {
        if (episodes == null || episodes.isEmpty()) {
            return 0;
        }
        Map<String, EpisodeEntity> unique = new LinkedHashMap<>();
        for (ClassifiedEntry classified : episodes) {
            EpisodeEntity row = toEpisodeEntity(seriesId, classified);
            unique.put(episodeKey(row.getSeasonNumber(), row.getEpisodeNumber()), row);
        }

        Set<String> existingKeys = new HashSet<>();
        for (EpisodeEntity stored : episodeMapper.selectKeysBySeriesId(seriesId)) {
            existingKeys.add(episodeKey(stored.getSeasonNumber(), stored.getEpisodeNumber()));
        }

        List<EpisodeEntity> toInsert = new ArrayList<>();
        for (Map.Entry<String, EpisodeEntity> entry : unique.entrySet()) {
            if (!existingKeys.contains(entry.getKey())) {
                toInsert.add(entry.getValue());
            }
        }
        if (toInsert.isEmpty()) {
            return 0;
        }

        int chunkSize = Math.max(1, appSyncProperties.getEpisodeChunkSize());
        int inserted = 0;
        for (int from = 0; from < toInsert.size(); from += chunkSize) {
            int to = Math.min(from + chunkSize, toInsert.size());
            inserted += episodeMapper.batchInsert(toInsert.subList(from, to));
        }
        log.debug("EPISODES_INSERTED seriesId={} incoming={} unique={} inserted={}",
                seriesId, episodes.size(), unique.size(), inserted);
        return inserted;
    }

    static String normalizeSeriesName(String seriesName) {
        return seriesName == null ? "" : seriesName.toLowerCase(Locale.ROOT);
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private ChannelEntity toChannelEntity(ClassifiedEntry classified, Long profileId) {
        PlaylistEntry entry = classified.getEntry();
        ChannelEntity row = new ChannelEntity();
        row.setTvgId(entry.getTvgId());
        row.setTvgName(entry.getTvgName());
        row.setDisplayName(entry.getDisplayName());
        row.setLogo(entry.getTvgLogo());
        row.setUrl(entry.getUrl());
        row.setGroupTitle(entry.getGroupTitle());
        row.setContentType(classified.getContentType().name());
        row.setMetadata(toJson(classified));
        row.setProfileId(profileId);
        return row;
    }

    private EpisodeEntity toEpisodeEntity(Long seriesId, ClassifiedEntry classified) {
        EpisodeMetadata metadata = classified.episodeMetadata();
        EpisodeEntity row = new EpisodeEntity();
        row.setSeriesId(seriesId);
        row.setSeasonNumber(metadata.getSeasonNumber());
        row.setEpisodeNumber(metadata.getEpisodeNumber());
        row.setTitle(metadata.getEpisodeTitle() != null
                ? metadata.getEpisodeTitle()
                : "Episode " + metadata.getEpisodeNumber());
        row.setUrl(classified.getEntry().getUrl());
        row.setTvgName(classified.getEntry().getTvgName());
        return row;
    }

    private String toJson(ClassifiedEntry classified) {
        try {
            return objectMapper.writeValueAsString(classified.getMetadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Channel metadata serialization failed: "
                    + classified.getEntry().getDisplayName(), e);
        }
    }

    private String episodeKey(Integer seasonNumber, Integer episodeNumber) {
        return seasonNumber + "-" + episodeNumber;
    }
}
