package com.example.iptvcatalog.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceSyncStatusResponse {

    private Long sourceId;
    private String status;
    private LocalDateTime lastFetched;
    private Integer totalEntries;
    private String lastError;
}
