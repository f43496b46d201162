package com.example.iptvcatalog.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.iptvcatalog.common.config.AppSyncProperties;
import com.example.iptvcatalog.common.exception.BusinessException;
import com.example.iptvcatalog.common.exception.PlaylistDownloadException;
import com.example.iptvcatalog.domain.enumtype.ContentType;
import com.example.iptvcatalog.domain.enumtype.SyncOutcome;
import com.example.iptvcatalog.domain.model.ClassifiedEntry;
import com.example.iptvcatalog.domain.model.SeriesGroup;
import com.example.iptvcatalog.domain.model.SyncResult;
import com.example.iptvcatalog.infrastructure.http.PlaylistDownloader;
import com.example.iptvcatalog.infrastructure.parser.M3uEntryValidator;
import com.example.iptvcatalog.infrastructure.parser.M3uPlaylistParser;
import com.example.iptvcatalog.infrastructure.persistence.entity.M3uSourceEntity;
import com.example.iptvcatalog.infrastructure.persistence.entity.SeriesEntity;
import com.example.iptvcatalog.infrastructure.persistence.mapper.M3uSourceMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.dao.DataAccessResourceFailureException;

class PlaylistSyncServiceTest {

    private static final Long SOURCE_ID = 7L;
    private static final Long PROFILE_ID = 3L;
    private static final String SOURCE_URL = "http://lists.example/main.m3u";

    private static final String PLAYLIST = "#EXTM3U\n"
            + "#EXTINF:-1 group-title=\"News\",News 24\n"
            + "http://live.example/news\n"
            + "#EXTINF:-1 group-title=\"Sports\",Sport HD\n"
            + "http://live.example/sport\n"
            + "#EXTINF:-1 group-title=\"Movies\",Movie Title (2023)\n"
            + "http://vod.example/movie.mp4\n"
            + "#EXTINF:-1 tvg-logo=\"http://logo/lost.png\" group-title=\"Series\",Lost S01E01\n"
            + "http://vod.example/lost/1\n"
            + "#EXTINF:-1 group-title=\"Series\",Lost S01E02\n"
            + "http://vod.example/lost/2\n"
            + "http://orphan.example/x\n";

    private M3uSourceMapper m3uSourceMapper;
    private PlaylistDownloader playlistDownloader;
    private CatalogWriteService catalogWriteService;
    private AppSyncProperties appSyncProperties;
    private SimpleMeterRegistry meterRegistry;
    private PlaylistSyncService service;

    @BeforeEach
    void setUp() {
        m3uSourceMapper = mock(M3uSourceMapper.class);
        playlistDownloader = mock(PlaylistDownloader.class);
        catalogWriteService = mock(CatalogWriteService.class);
        appSyncProperties = new AppSyncProperties();
        meterRegistry = new SimpleMeterRegistry();

        when(m3uSourceMapper.selectById(SOURCE_ID)).thenReturn(source());
        when(m3uSourceMapper.countById(SOURCE_ID)).thenReturn(1);
        when(playlistDownloader.fetch(SOURCE_URL)).thenReturn(PLAYLIST);
        when(catalogWriteService.insertChannels(anyList(), eq(PROFILE_ID)))
                .thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        SeriesEntity lost = new SeriesEntity();
        lost.setId(50L);
        when(catalogWriteService.findOrCreateSeries(any(SeriesGroup.class), eq(PROFILE_ID))).thenReturn(lost);
        when(catalogWriteService.insertEpisodes(eq(50L), anyList()))
                .thenAnswer(invocation -> ((List<?>) invocation.getArgument(1)).size());

        service = new PlaylistSyncService(
                m3uSourceMapper,
                playlistDownloader,
                new M3uPlaylistParser(new M3uEntryValidator()),
                new ContentCategorizer(),
                catalogWriteService,
                appSyncProperties,
                beanProvider(meterRegistry));
    }

    @Test
    void syncShouldWriteCatalogAndMarkSuccess() {
        SyncResult result = service.sync(SOURCE_ID);

        assertTrue(result.isSuccess());
        assertEquals(SyncOutcome.SUCCESS, result.getOutcome());
        assertEquals(5, result.getTotalEntries());
        assertEquals(2, result.getLivestreams());
        assertEquals(1, result.getMovies());
        assertEquals(1, result.getSeries());
        assertEquals(2, result.getEpisodes());
        assertNull(result.getErrors());

        InOrder order = inOrder(m3uSourceMapper, playlistDownloader, catalogWriteService);
        order.verify(m3uSourceMapper).updateStatus(SOURCE_ID, "FETCHING");
        order.verify(playlistDownloader).fetch(SOURCE_URL);
        order.verify(m3uSourceMapper).updateStatus(SOURCE_ID, "PARSING");
        order.verify(catalogWriteService).deleteProfileCatalog(PROFILE_ID);
        order.verify(catalogWriteService).insertChannels(anyList(), eq(PROFILE_ID));
        order.verify(catalogWriteService).findOrCreateSeries(any(SeriesGroup.class), eq(PROFILE_ID));
        order.verify(catalogWriteService).insertEpisodes(eq(50L), anyList());
        order.verify(m3uSourceMapper).markSuccess(SOURCE_ID, "SUCCESS", 5);
        verify(m3uSourceMapper, never()).markFailed(anyLong(), anyString(), anyString());
        assertEquals(1.0, meterRegistry.counter("iptv.sync.result", "outcome", "SUCCESS").count());
        assertNull(MDC.get("sourceId"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void channelsShouldBeWrittenLivestreamsFirstThenMovies() {
        ArgumentCaptor<List<ClassifiedEntry>> captor = ArgumentCaptor.forClass(List.class);

        service.sync(SOURCE_ID);

        verify(catalogWriteService).insertChannels(captor.capture(), eq(PROFILE_ID));
        List<ClassifiedEntry> written = captor.getValue();
        assertEquals(3, written.size());
        assertEquals(ContentType.LIVESTREAM, written.get(0).getContentType());
        assertEquals(ContentType.LIVESTREAM, written.get(1).getContentType());
        assertEquals(ContentType.MOVIE, written.get(2).getContentType());
    }

    @Test
    void sourceDeletedAfterFirstChunkShouldStopWithoutStatusWrite() {
        appSyncProperties.setChannelChunkSize(1);
        when(m3uSourceMapper.countById(SOURCE_ID)).thenReturn(1, 0);

        SyncResult result = service.sync(SOURCE_ID);

        assertFalse(result.isSuccess());
        assertEquals(SyncOutcome.SOURCE_DELETED, result.getOutcome());
        assertEquals(Collections.singletonList("Source deleted during sync"), result.getErrors());
        verify(catalogWriteService, times(1)).insertChannels(anyList(), eq(PROFILE_ID));
        verify(catalogWriteService, never()).findOrCreateSeries(any(SeriesGroup.class), anyLong());
        verify(m3uSourceMapper, never()).markSuccess(anyLong(), anyString(), anyInt());
        verify(m3uSourceMapper, never()).markFailed(anyLong(), anyString(), anyString());
        verify(m3uSourceMapper, times(2)).updateStatus(eq(SOURCE_ID), anyString());
    }

    @Test
    void sourceDeletedBeforeSeriesShouldStopWithoutStatusWrite() {
        when(m3uSourceMapper.countById(SOURCE_ID)).thenReturn(1, 0);

        SyncResult result = service.sync(SOURCE_ID);

        assertEquals(SyncOutcome.SOURCE_DELETED, result.getOutcome());
        verify(catalogWriteService, times(1)).insertChannels(anyList(), eq(PROFILE_ID));
        verify(catalogWriteService, never()).findOrCreateSeries(any(SeriesGroup.class), anyLong());
        verify(m3uSourceMapper, never()).markSuccess(anyLong(), anyString(), anyInt());
    }

    @Test
    void downloadFailureShouldMarkFailedWithMessage() {
        String message = "Failed to download playlist after 3 attempts: HTTP 500";
        when(playlistDownloader.fetch(SOURCE_URL)).thenThrow(
                new PlaylistDownloadException(message, SOURCE_URL, 3, new IOException("HTTP 500")));

        SyncResult result = service.sync(SOURCE_ID);

        assertFalse(result.isSuccess());
        assertEquals(SyncOutcome.FAILED, result.getOutcome());
        assertEquals(Collections.singletonList(message), result.getErrors());
        verify(m3uSourceMapper).markFailed(SOURCE_ID, "FAILED", message);
        verify(catalogWriteService, never()).deleteProfileCatalog(anyLong());
        verify(m3uSourceMapper, never()).markSuccess(anyLong(), anyString(), anyInt());
        assertEquals(1.0, meterRegistry.counter("iptv.sync.result", "outcome", "FAILED").count());
    }

    @Test
    void persistenceFailureShouldRecordTruncatedError() {
        appSyncProperties.setErrorMessageMaxLength(10);
        doThrow(new DataAccessResourceFailureException("database unavailable"))
                .when(catalogWriteService).deleteProfileCatalog(PROFILE_ID);
        AtomicReference<String> recorded = new AtomicReference<>();
        when(m3uSourceMapper.markFailed(eq(SOURCE_ID), eq("FAILED"), anyString())).thenAnswer(invocation -> {
            recorded.set(invocation.getArgument(2));
            return 1;
        });

        SyncResult result = service.sync(SOURCE_ID);

        assertEquals(SyncOutcome.FAILED, result.getOutcome());
        assertEquals("database unavailable", result.getErrors().get(0));
        assertEquals("database u", recorded.get());
        verify(catalogWriteService, never()).insertChannels(anyList(), anyLong());
    }

    @Test
    void missingSourceShouldThrowNotFoundWithoutStateChange() {
        when(m3uSourceMapper.selectById(99L)).thenReturn(null);

        BusinessException error = assertThrows(BusinessException.class, () -> service.sync(99L));

        assertEquals("404", error.getCode());
        verify(m3uSourceMapper, never()).updateStatus(anyLong(), anyString());
        verify(playlistDownloader, never()).fetch(anyString());
    }

    @Test
    void staleInProgressSourceShouldStillBeResynced() {
        M3uSourceEntity stuck = source();
        stuck.setLastStatus("PARSING");
        when(m3uSourceMapper.selectById(SOURCE_ID)).thenReturn(stuck);

        SyncResult result = service.sync(SOURCE_ID);

        assertTrue(result.isSuccess());
        verify(m3uSourceMapper).updateStatus(SOURCE_ID, "FETCHING");
    }

    private M3uSourceEntity source() {
        M3uSourceEntity entity = new M3uSourceEntity();
        entity.setId(SOURCE_ID);
        entity.setProfileId(PROFILE_ID);
        entity.setUrl(SOURCE_URL);
        entity.setName("Main");
        entity.setLastStatus("IDLE");
        return entity;
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
