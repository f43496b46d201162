package com.example.iptvcatalog.application.job;

import com.example.iptvcatalog.application.service.M3uSourceService;
import com.example.iptvcatalog.common.config.AppSyncProperties;
import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.infrastructure.persistence.entity.M3uSourceEntity;
import com.example.iptvcatalog.infrastructure.persistence.mapper.M3uSourceMapper;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SourceRefreshJob {

    private static final Logger log = LoggerFactory.getLogger(SourceRefreshJob.class);

    private final AppSyncProperties appSyncProperties;
    private final M3uSourceMapper m3uSourceMapper;
    private final M3uSourceService m3uSourceService;

    public SourceRefreshJob(AppSyncProperties appSyncProperties,
                            M3uSourceMapper m3uSourceMapper,
                            M3uSourceService m3uSourceService) {
        this.appSyncProperties = appSyncProperties;
        this.m3uSourceMapper = m3uSourceMapper;
        this.m3uSourceService = m3uSourceService;
    }

    @Scheduled(cron = "${app.sync.refresh-cron:0 0 4 * * ?}")
    public void refreshStaleSources() {
        if (!appSyncProperties.isRefreshEnabled()) {
            return;
        }
        LocalDateTime olderThan = LocalDateTime.now().minusHours(Math.max(1, appSyncProperties.getRefreshStaleHours()));
        List<M3uSourceEntity> stale = m3uSourceMapper.selectNeedingRefresh(olderThan);
        if (stale.isEmpty()) {
            log.debug("SOURCE_REFRESH_SKIPPED reason=no_stale_sources");
            return;
        }
        int submitted = 0;
        for (M3uSourceEntity source : stale) {
            try {
                m3uSourceService.startSync(source.getProfileId(), source.getId());
                submitted++;
            } catch (BusinessException e) {
                if ("409".equals(e.getCode())) {
                    log.info("SOURCE_REFRESH_SKIPPED sourceId={} reason=sync_running", source.getId());
                } else {
                    log.warn("SOURCE_REFRESH_FAILED sourceId={} code={} reason={}",
                            source.getId(), e.getCode(), e.getMessage());
                }
            } catch (Exception e) {
                log.warn("SOURCE_REFRESH_FAILED sourceId={}", source.getId(), e);
            }
        }
        log.info("SOURCE_REFRESH_SUBMITTED stale={} submitted={}", stale.size(), submitted);
    }
}
