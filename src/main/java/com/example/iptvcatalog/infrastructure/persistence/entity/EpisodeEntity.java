package com.example.iptvcatalog.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class EpisodeEntity {

    private Long id;

    private Long seriesId;

    private Integer seasonNumber;

    private Integer episodeNumber;

    private String title;

    private String url;

    private String tvgName;

    private LocalDateTime createdAt;
}
