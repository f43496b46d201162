package com.example.iptvcatalog.api.controller;

import com.example.iptvcatalog.api.request.CreateM3uSourceRequest;
import com.example.iptvcatalog.api.response.AddSourceResponse;
import com.example.iptvcatalog.api.response.ApiResponse;
import com.example.iptvcatalog.api.response.M3uSourceResponse;
import com.example.iptvcatalog.api.response.SourceSyncStatusResponse;
import com.example.iptvcatalog.api.response.SyncJobResponse;
import com.example.iptvcatalog.application.service.M3uSourceService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/profiles/{profileId}/sources")
public class M3uSourceController {

    private final M3uSourceService m3uSourceService;

    public M3uSourceController(M3uSourceService m3uSourceService) {
        this.m3uSourceService = m3uSourceService;
    }

    @GetMapping
    public ApiResponse<List<M3uSourceResponse>> listSources(@PathVariable("profileId") Long profileId) {
        return ApiResponse.success(m3uSourceService.listSources(profileId));
    }

    @PostMapping
    public ApiResponse<AddSourceResponse> addSource(@PathVariable("profileId") Long profileId,
                                                    @Valid @RequestBody CreateM3uSourceRequest request) {
        return ApiResponse.success(m3uSourceService.addSource(profileId, request));
    }

    @DeleteMapping("/{sourceId}")
    public ApiResponse<String> removeSource(@PathVariable("profileId") Long profileId,
                                            @PathVariable("sourceId") Long sourceId) {
        m3uSourceService.removeSource(profileId, sourceId);
        return ApiResponse.success("REMOVED");
    }

    @PostMapping("/{sourceId}/sync")
    public ApiResponse<SyncJobResponse> startSync(@PathVariable("profileId") Long profileId,
                                                  @PathVariable("sourceId") Long sourceId) {
        return ApiResponse.success(m3uSourceService.startSync(profileId, sourceId));
    }

    @GetMapping("/{sourceId}/status")
    public ApiResponse<SourceSyncStatusResponse> getSyncStatus(@PathVariable("profileId") Long profileId,
                                                               @PathVariable("sourceId") Long sourceId) {
        return ApiResponse.success(m3uSourceService.getSyncStatus(profileId, sourceId));
    }
}
