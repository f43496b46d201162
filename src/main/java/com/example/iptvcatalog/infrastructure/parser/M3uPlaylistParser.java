package com.example.iptvcatalog.infrastructure.parser;

import com.example.iptvcatalog.domain.model.ParseError;
import com.example.iptvcatalog.domain.model.ParsedPlaylist;
import com.example.iptvcatalog.domain.model.PlaylistEntry;
import com.example.iptvcatalog.domain.model.ValidationResult;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Line-oriented extended M3U parser. Structural problems are collected as {@link ParseError}s and never abort
 * the pass.
 */
@Component
public class M3uPlaylistParser implements PlaylistParser {

    private static final Logger log = LoggerFactory.getLogger(M3uPlaylistParser.class);

    static final String EXTINF_PREFIX = "#EXTINF:";
    static final String UNKNOWN_DISPLAY_NAME = "Unknown";
    static final String URL_WITHOUT_METADATA = "URL without metadata";

    private static final Pattern LINE_SPLIT_PATTERN = Pattern.compile("\\r?\\n");
    private static final Pattern TVG_ID_PATTERN = attributePattern("tvg-id");
    private static final Pattern TVG_NAME_PATTERN = attributePattern("tvg-name");
    private static final Pattern TVG_LOGO_PATTERN = attributePattern("tvg-logo");
    private static final Pattern GROUP_TITLE_PATTERN = attributePattern("group-title");

    private final M3uEntryValidator validator;

    public M3uPlaylistParser(M3uEntryValidator validator) {
        this.validator = validator;
    }

    @Override
    public ParsedPlaylist parse(String content, String sourceUrl) {
        List<PlaylistEntry> entries = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        String[] lines = LINE_SPLIT_PATTERN.split(content == null ? "" : content, -1);

        String pendingMetadata = null;
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(EXTINF_PREFIX)) {
                pendingMetadata = line;
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }
            if (pendingMetadata == null) {
                errors.add(new ParseError(lineNumber, line, URL_WITHOUT_METADATA));
                continue;
            }
            PlaylistEntry entry = buildEntry(pendingMetadata, line);
            pendingMetadata = null;
            ValidationResult validation = validator.validate(entry);
            if (validation.isValid()) {
                entries.add(entry);
            } else {
                errors.add(new ParseError(lineNumber, line, validation.getReason()));
            }
        }

        log.debug("PLAYLIST_PARSED sourceUrl={} entries={} errors={}", sourceUrl, entries.size(), errors.size());
        return new ParsedPlaylist(sourceUrl, entries, LocalDateTime.now(), entries.size(), errors);
    }

    private PlaylistEntry buildEntry(String metadataLine, String url) {
        return PlaylistEntry.builder()
                .id(UUID.randomUUID().toString())
                .tvgId(extractAttribute(TVG_ID_PATTERN, metadataLine))
                .tvgName(extractAttribute(TVG_NAME_PATTERN, metadataLine))
                .tvgLogo(extractAttribute(TVG_LOGO_PATTERN, metadataLine))
                .groupTitle(extractAttribute(GROUP_TITLE_PATTERN, metadataLine))
                .displayName(extractDisplayName(metadataLine))
                .url(url)
                .rawMetadataLine(metadataLine)
                .build();
    }

    private String extractAttribute(Pattern pattern, String metadataLine) {
        Matcher matcher = pattern.matcher(metadataLine);
        return matcher.find() ? matcher.group(1) : "";
    }

    private String extractDisplayName(String metadataLine) {
        int idx = metadataLine.lastIndexOf(',');
        if (idx < 0) {
            return UNKNOWN_DISPLAY_NAME;
        }
        return metadataLine.substring(idx + 1).trim();
    }

    private static Pattern attributePattern(String key) {
        return Pattern.compile(Pattern.quote(key) + "=\"([^\"]*)\"", Pattern.CASE_INSENSITIVE);
    }
}
