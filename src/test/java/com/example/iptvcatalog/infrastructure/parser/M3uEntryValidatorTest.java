package com.example.iptvcatalog.infrastructure.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.iptvcatalog.domain.model.PlaylistEntry;
import com.example.iptvcatalog.domain.model.ValidationResult;
import org.junit.jupiter.api.Test;

class M3uEntryValidatorTest {

    private final M3uEntryValidator validator = new M3uEntryValidator();

    @Test
    void absoluteUrlWithNameShouldBeValid() {
        ValidationResult result = validator.validate(entry("rtmp://live.example/app/stream", "Live"));

        assertTrue(result.isValid());
        assertNull(result.getReason());
    }

    @Test
    void relativeOrMalformedUrlShouldBeRejected() {
        assertEquals("Invalid URL", validator.validate(entry("/relative/path.ts", "Name")).getReason());
        assertEquals("Invalid URL", validator.validate(entry("http://bad host/x", "Name")).getReason());
        assertEquals("Invalid URL", validator.validate(entry("", "Name")).getReason());
    }

    @Test
    void urlRuleShouldWinOverDisplayNameRule() {
        ValidationResult result = validator.validate(entry("nope", " "));

        assertFalse(result.isValid());
        assertEquals("Invalid URL", result.getReason());
    }

    @Test
    void blankDisplayNameShouldBeRejected() {
        ValidationResult result = validator.validate(entry("http://stream.example/x", "   "));

        assertFalse(result.isValid());
        assertEquals("Missing display name", result.getReason());
    }

    @Test
    void unencodedPathCharactersShouldBeTolerated() {
        assertTrue(validator.validate(entry("http://vod.example/movie/My Movie (2020).mkv", "My Movie")).isValid());
        assertTrue(validator.validate(entry("http://live.example/ch.m3u8|User-Agent=VLC", "Ch")).isValid());
        assertTrue(validator.validate(entry("http://live.example/100%/ch.ts", "Ch")).isValid());
    }

    private PlaylistEntry entry(String url, String displayName) {
        return PlaylistEntry.builder()
                .id("id")
                .url(url)
                .displayName(displayName)
                .build();
    }
}
