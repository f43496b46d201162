package com.example.iptvcatalog.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LivestreamMetadata implements EntryMetadata {

    private String channelName;

    /** Taken verbatim from the entry's group-title. */
    private String category;
}
