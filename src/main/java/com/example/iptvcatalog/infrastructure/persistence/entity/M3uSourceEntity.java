package com.example.iptvcatalog.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class M3uSourceEntity {

    private Long id;

    private String url;

    private String name;

    private LocalDateTime lastFetched;

    private String lastStatus;

    private Integer totalEntries;

    private String lastError;

    private Long profileId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
