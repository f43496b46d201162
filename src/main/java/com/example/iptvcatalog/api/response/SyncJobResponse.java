package com.example.iptvcatalog.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncJobResponse {

    /** Same value as the source id; progress is read back through the source status. */
    private Long jobId;
    private String status;
}
