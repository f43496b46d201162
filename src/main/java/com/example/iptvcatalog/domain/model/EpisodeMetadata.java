package com.example.iptvcatalog.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EpisodeMetadata implements EntryMetadata {

    private String seriesName;

    private int seasonNumber;

    private int episodeNumber;

    private String episodeTitle;

    public EpisodeMetadata(String seriesName, int seasonNumber, int episodeNumber) {
        this(seriesName, seasonNumber, episodeNumber, null);
    }
}
