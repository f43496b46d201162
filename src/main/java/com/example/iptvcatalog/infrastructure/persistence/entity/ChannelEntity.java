package com.example.iptvcatalog.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ChannelEntity {

    private Long id;

    private String tvgId;

    private String tvgName;

    private String displayName;

    private String logo;

    private String url;

    private String groupTitle;

    private String contentType;

    /** JSON document of the classification metadata. */
    private String metadata;

    private Long profileId;

    private LocalDateTime createdAt;
}
