package com.example.iptvcatalog.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlaylistPreviewResponse {

    private String sourceUrl;
    private boolean success;
    private int totalEntries;
    private int errorCount;
    private int livestreams;
    private int movies;
    private int series;
    private int episodes;
    private String errorMessage;
}
