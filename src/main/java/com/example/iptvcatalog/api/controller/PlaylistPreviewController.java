package com.example.iptvcatalog.api.controller;

import com.example.iptvcatalog.api.request.PlaylistPreviewRequest;
import com.example.iptvcatalog.api.response.ApiResponse;
import com.example.iptvcatalog.api.response.PlaylistPreviewResponse;
import com.example.iptvcatalog.application.service.PlaylistPreviewService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/playlists")
public class PlaylistPreviewController {

    private final PlaylistPreviewService playlistPreviewService;

    public PlaylistPreviewController(PlaylistPreviewService playlistPreviewService) {
        this.playlistPreviewService = playlistPreviewService;
    }

    @PostMapping("/preview")
    public ApiResponse<List<PlaylistPreviewResponse>> preview(@Valid @RequestBody PlaylistPreviewRequest request) {
        return ApiResponse.success(playlistPreviewService.preview(request.getUrls()));
    }
}
