package com.example.iptvcatalog.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SeriesEntity {

    private Long id;

    private String name;

    private String normalizedName;

    private String logo;

    private String groupTitle;

    private Long profileId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
