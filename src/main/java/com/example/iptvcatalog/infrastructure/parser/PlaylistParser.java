package com.example.iptvcatalog.infrastructure.parser;

import com.example.iptvcatalog.domain.model.ParsedPlaylist;

public interface PlaylistParser {

    ParsedPlaylist parse(String content, String sourceUrl);

    default ParsedPlaylist parse(String content) {
        return parse(content, "");
    }
}
