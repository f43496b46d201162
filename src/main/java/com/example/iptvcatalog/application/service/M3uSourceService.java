package com.example.iptvcatalog.application.service;

import com.example.iptvcatalog.api.request.CreateM3uSourceRequest;
import com.example.iptvcatalog.api.response.AddSourceResponse;
import com.example.iptvcatalog.api.response.M3uSourceResponse;
import com.example.iptvcatalog.api.response.SourceSyncStatusResponse;
import com.example.iptvcatalog.api.response.SyncJobResponse;
import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.domain.enumtype.SourceSyncState;
import com.example.iptvcatalog.domain.model.SyncResult;
import com.example.iptvcatalog.infrastructure.persistence.entity.M3uSourceEntity;
import com.example.iptvcatalog.infrastructure.persistence.mapper.M3uSourceMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Source registration and the fire-and-forget sync trigger. Progress of a triggered run is only observable
 * through the persisted source status.
 */
@Service
public class M3uSourceService {

    private static final Logger log = LoggerFactory.getLogger(M3uSourceService.class);

    static final String DEFAULT_SOURCE_NAME = "Playlist";

    private final M3uSourceMapper m3uSourceMapper;
    private final PlaylistSyncService playlistSyncService;
    private final ExecutorService syncTaskExecutor;
    private final Set<Long> runningSources = ConcurrentHashMap.newKeySet();

    public M3uSourceService(M3uSourceMapper m3uSourceMapper,
                            PlaylistSyncService playlistSyncService,
                            @Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor) {
        this.m3uSourceMapper = m3uSourceMapper;
        this.playlistSyncService = playlistSyncService;
        this.syncTaskExecutor = syncTaskExecutor;
    }

    public SyncJobResponse startSync(Long profileId, Long sourceId) {
        M3uSourceEntity source = requireOwnedSource(profileId, sourceId);
        submitSync(source.getId());
        return new SyncJobResponse(source.getId(), SourceSyncState.fromValue(source.getLastStatus()).name());
    }

    public SourceSyncStatusResponse getSyncStatus(Long profileId, Long sourceId) {
        M3uSourceEntity source = requireOwnedSource(profileId, sourceId);
        return new SourceSyncStatusResponse(
                source.getId(),
                SourceSyncState.fromValue(source.getLastStatus()).name(),
                source.getLastFetched(),
                source.getTotalEntries(),
                source.getLastError());
    }

    public AddSourceResponse addSource(Long profileId, CreateM3uSourceRequest request) {
        M3uSourceEntity entity = new M3uSourceEntity();
        entity.setProfileId(profileId);
        entity.setUrl(request.getUrl().trim());
        entity.setName(StringUtils.hasText(request.getName()) ? request.getName().trim() : DEFAULT_SOURCE_NAME);
        entity.setLastStatus(SourceSyncState.IDLE.name());
        entity.setTotalEntries(0);
        m3uSourceMapper.insert(entity);
        log.info("SOURCE_CREATED sourceId={} profileId={} url={}", entity.getId(), profileId, entity.getUrl());

        Long jobId = null;
        try {
            submitSync(entity.getId());
            jobId = entity.getId();
        } catch (BusinessException e) {
            log.warn("SOURCE_SYNC_TRIGGER_FAILED sourceId={} code={} reason={}",
                    entity.getId(), e.getCode(), e.getMessage());
        }
        M3uSourceEntity stored = m3uSourceMapper.selectById(entity.getId());
        return new AddSourceResponse(toResponse(stored == null ? entity : stored), jobId);
    }

    /**
     * Deleting the row also stops a sync that is currently writing this source's catalog.
     */
    public void removeSource(Long profileId, Long sourceId) {
        requireOwnedSource(profileId, sourceId);
        m3uSourceMapper.deleteById(sourceId);
        log.info("SOURCE_REMOVED sourceId={} profileId={} syncRunning={}",
                sourceId, profileId, runningSources.contains(sourceId));
    }

    public List<M3uSourceResponse> listSources(Long profileId) {
        List<M3uSourceEntity> entities = m3uSourceMapper.selectByProfileId(profileId);
        List<M3uSourceResponse> responses = new ArrayList<>(entities.size());
        for (M3uSourceEntity entity : entities) {
            responses.add(toResponse(entity));
        }
        return responses;
    }

    public boolean isSyncRunning(Long sourceId) {
        return runningSources.contains(sourceId);
    }

    private void submitSync(Long sourceId) {
        if (!runningSources.add(sourceId)) {
            throw BusinessException.conflict("Sync already running for source " + sourceId,
                    "Wait for the current sync to finish");
        }
        try {
            syncTaskExecutor.submit(() -> executeSync(sourceId));
        } catch (RejectedExecutionException e) {
            runningSources.remove(sourceId);
            log.warn("SYNC_SUBMIT_REJECTED sourceId={} reason={}", sourceId, e.getMessage());
            throw BusinessException.unavailable("SYNC_EXECUTOR_REJECTED", "Sync could not be scheduled", "Retry later");
        }
        log.info("SYNC_SUBMITTED sourceId={}", sourceId);
    }

    private void executeSync(Long sourceId) {
        try {
            SyncResult result = playlistSyncService.sync(sourceId);
            log.info("SYNC_TASK_FINISHED sourceId={} outcome={} costMs={}",
                    sourceId, result.getOutcome(), result.getDurationMs());
        } catch (BusinessException e) {
            log.warn("SYNC_TASK_SKIPPED sourceId={} code={} reason={}", sourceId, e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("SYNC_TASK_CRASHED sourceId={}", sourceId, e);
        } finally {
            runningSources.remove(sourceId);
        }
    }

    private M3uSourceEntity requireOwnedSource(Long profileId, Long sourceId) {
        M3uSourceEntity source = m3uSourceMapper.selectById(sourceId);
        if (source == null || !source.getProfileId().equals(profileId)) {
            throw BusinessException.notFound("Playlist source not found: " + sourceId);
        }
        return source;
    }

    private M3uSourceResponse toResponse(M3uSourceEntity entity) {
        return new M3uSourceResponse(
                entity.getId(),
                entity.getProfileId(),
                entity.getUrl(),
                entity.getName(),
                SourceSyncState.fromValue(entity.getLastStatus()).name(),
                entity.getLastFetched(),
                entity.getTotalEntries(),
                entity.getLastError(),
                entity.getCreatedAt());
    }
}
