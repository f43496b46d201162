package com.example.iptvcatalog.infrastructure.parser;

import com.example.iptvcatalog.domain.model.PlaylistEntry;
import com.example.iptvcatalog.domain.model.ValidationResult;
import java.net.URI;
import java.net.URISyntaxException;
import org.springframework.stereotype.Component;

/**
 * Rejects entries that cannot be played or listed. Rules are checked in order and the first failure wins.
 */
@Component
public class M3uEntryValidator {

    private static final String UNSAFE_CHARACTERS = " \"<>\\^`{|}";
    private static final String HEX_DIGITS = "0123456789ABCDEFabcdef";

    public ValidationResult validate(PlaylistEntry entry) {
        if (!isAbsoluteUrl(entry.getUrl())) {
            return ValidationResult.invalid("Invalid URL");
        }
        String displayName = entry.getDisplayName();
        if (displayName == null || displayName.trim().isEmpty()) {
            return ValidationResult.invalid("Missing display name");
        }
        return ValidationResult.ok();
    }

    private boolean isAbsoluteUrl(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(encodeUnsafeCharacters(url));
            return uri.isAbsolute() && uri.getScheme() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Percent-encodes characters players tolerate after the host (spaces in VOD paths, a {@code |User-Agent=}
     * suffix, stray {@code %}) so that only the scheme and authority are held to URI syntax.
     */
    static String encodeUnsafeCharacters(String url) {
        int schemeEnd = url.indexOf("://");
        int pathStart = schemeEnd < 0 ? 0 : indexOfPathStart(url, schemeEnd + 3);
        if (pathStart < 0) {
            return url;
        }
        StringBuilder encoded = new StringBuilder(url.length() + 16).append(url, 0, pathStart);
        for (int i = pathStart; i < url.length(); i++) {
            char c = url.charAt(i);
            if (UNSAFE_CHARACTERS.indexOf(c) >= 0 || (c == '%' && !isEscape(url, i))) {
                encoded.append('%').append(String.format("%02X", (int) c));
            } else {
                encoded.append(c);
            }
        }
        return encoded.toString();
    }

    private static int indexOfPathStart(String url, int from) {
        for (int i = from; i < url.length(); i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                return i;
            }
        }
        return -1;
    }

    private static boolean isEscape(String url, int percentIndex) {
        return percentIndex + 2 < url.length()
                && HEX_DIGITS.indexOf(url.charAt(percentIndex + 1)) >= 0
                && HEX_DIGITS.indexOf(url.charAt(percentIndex + 2)) >= 0;
    }
}
