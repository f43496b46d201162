package com.example.iptvcatalog.domain.model;

import com.example.iptvcatalog.domain.enumtype.ContentType;
import lombok.Value;

@Value
public class ClassifiedEntry {

    PlaylistEntry entry;

    ContentType contentType;

    EntryMetadata metadata;

    public EpisodeMetadata episodeMetadata() {
        if (!(metadata instanceof EpisodeMetadata)) {
            throw new IllegalStateException("Entry is not an episode: " + entry.getDisplayName());
        }
        return (EpisodeMetadata) metadata;
    }
}
