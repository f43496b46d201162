package com.example.iptvcatalog.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One playlist record: an {@code #EXTINF:} line plus the URL line that terminated it.
 * The id is random per parse, so two parses of the same text never share ids.
 */
@Value
@Builder
public class PlaylistEntry {

    String id;

    String tvgId;

    String tvgName;

    String tvgLogo;

    String groupTitle;

    String displayName;

    String url;

    String rawMetadataLine;
}
