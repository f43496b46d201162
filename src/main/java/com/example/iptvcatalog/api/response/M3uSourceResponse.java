package com.example.iptvcatalog.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class M3uSourceResponse {

    private Long id;
    private Long profileId;
    private String url;
    private String name;
    private String lastStatus;
    private LocalDateTime lastFetched;
    private Integer totalEntries;
    private String lastError;
    private LocalDateTime createdAt;
}
