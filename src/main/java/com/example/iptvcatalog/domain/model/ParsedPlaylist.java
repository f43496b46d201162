package com.example.iptvcatalog.domain.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ParsedPlaylist {

    private String sourceUrl;

    private List<PlaylistEntry> entries;

    private LocalDateTime parsedAt;

    private int totalEntries;

    private List<ParseError> errors;

    /**
     * Placeholder for a playlist that could not be fetched at all.
     */
    public static ParsedPlaylist failed(String sourceUrl, String reason) {
        return new ParsedPlaylist(
                sourceUrl,
                Collections.emptyList(),
                LocalDateTime.now(),
                0,
                Collections.singletonList(new ParseError(0, "", reason)));
    }
}
