package com.example.iptvcatalog.application.service;

import com.example.iptvcatalog.domain.enumtype.ContentType;
import com.example.iptvcatalog.domain.model.ClassifiedEntry;
import com.example.iptvcatalog.domain.model.ClassifiedSet;
import com.example.iptvcatalog.domain.model.EpisodeMetadata;
import com.example.iptvcatalog.domain.model.LivestreamMetadata;
import com.example.iptvcatalog.domain.model.MovieMetadata;
import com.example.iptvcatalog.domain.model.PlaylistEntry;
import com.example.iptvcatalog.domain.model.SeriesGroup;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Name-based heuristics that split parsed entries into live channels, movies and series episodes.
 *
 * <p>Stateless; safe to share across concurrent syncs. Entries are visited in input order: the series test
 * wins over the movie test, and anything left is a live channel. A channel literally named after a year
 * (e.g. "2024") is classified as a movie.
 */
@Component
public class ContentCategorizer {

    static final Pattern SERIES_PATTERN = Pattern.compile("[Ss](\\d+)[Ee](\\d+)");
    static final Pattern SEASON_PATTERN = Pattern.compile("season\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    static final Pattern EPISODE_PATTERN = Pattern.compile("episode?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    static final Pattern YEAR_PATTERN = Pattern.compile("\\b(19|20)\\d{2}\\b");
    static final List<String> MOVIE_EXTENSIONS = Arrays.asList(".mp4", ".mkv", ".avi");
    static final List<String> MOVIE_GROUP_KEYWORDS = Arrays.asList("movie", "film", "cinema", "vod");

    private static final Pattern BRACKETED_YEAR_PATTERN =
            Pattern.compile("[(\\[]?\\s*\\b(?:19|20)\\d{2}\\b\\s*[)\\]]?");
    private static final Pattern SERIES_NAME_SEPARATOR_PATTERN = Pattern.compile("[._]");
    private static final Pattern EDGE_PUNCTUATION_PATTERN = Pattern.compile("^[-_.\\s]+|[-_.\\s]+$");

    public ClassifiedSet categorize(List<PlaylistEntry> entries) {
        List<ClassifiedEntry> livestreams = new ArrayList<>();
        List<ClassifiedEntry> movies = new ArrayList<>();
        Map<String, SeriesGroup> seriesGroups = new HashMap<>();
        Map<String, SeriesGroup> groupsByLowerName = new HashMap<>();

        for (PlaylistEntry entry : entries) {
            EpisodeMetadata episode = extractEpisode(entry.getDisplayName());
            if (episode == null) {
                episode = extractEpisode(entry.getTvgName());
            }
            if (episode != null) {
                // series rows are keyed case-insensitively, so "Lost" and "lost" share one group
                String seriesName = episode.getSeriesName();
                SeriesGroup group = groupsByLowerName.computeIfAbsent(seriesName.toLowerCase(Locale.ROOT),
                        key -> new SeriesGroup(seriesName, entry.getTvgLogo(), entry.getGroupTitle()));
                seriesGroups.putIfAbsent(group.getSeriesName(), group);
                group.getEpisodes().add(new ClassifiedEntry(entry, ContentType.EPISODE, episode));
            } else if (isMovie(entry)) {
                movies.add(new ClassifiedEntry(entry, ContentType.MOVIE, toMovieMetadata(entry)));
            } else {
                LivestreamMetadata metadata = new LivestreamMetadata(entry.getDisplayName(), entry.getGroupTitle());
                livestreams.add(new ClassifiedEntry(entry, ContentType.LIVESTREAM, metadata));
            }
        }
        return new ClassifiedSet(livestreams, movies, seriesGroups);
    }

    EpisodeMetadata extractEpisode(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        Matcher marker = SERIES_PATTERN.matcher(name);
        if (marker.find()) {
            return toEpisode(name.substring(0, marker.start()), marker.group(1), marker.group(2));
        }
        Matcher season = SEASON_PATTERN.matcher(name);
        Matcher episode = EPISODE_PATTERN.matcher(name);
        if (season.find() && episode.find()) {
            return toEpisode(name.substring(0, season.start()), season.group(1), episode.group(1));
        }
        return null;
    }

    /**
     * Numbers that overflow an int do not count as a series marker.
     */
    private EpisodeMetadata toEpisode(String rawSeriesName, String seasonDigits, String episodeDigits) {
        try {
            return new EpisodeMetadata(
                    normalizeSeriesName(rawSeriesName),
                    Integer.parseInt(seasonDigits),
                    Integer.parseInt(episodeDigits));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    boolean isMovie(PlaylistEntry entry) {
        String group = nullToEmpty(entry.getGroupTitle()).toLowerCase(Locale.ROOT);
        for (String keyword : MOVIE_GROUP_KEYWORDS) {
            if (group.contains(keyword)) {
                return true;
            }
        }
        if (hasMovieExtension(urlPath(entry.getUrl()))) {
            return true;
        }
        return YEAR_PATTERN.matcher(nullToEmpty(entry.getDisplayName())).find();
    }

    private MovieMetadata toMovieMetadata(PlaylistEntry entry) {
        Integer year = extractYear(entry.getDisplayName());
        if (year == null) {
            year = extractYear(entry.getTvgName());
        }
        return new MovieMetadata(extractTitle(entry.getDisplayName()), year);
    }

    private Integer extractYear(String name) {
        if (name == null) {
            return null;
        }
        Matcher matcher = YEAR_PATTERN.matcher(name);
        return matcher.find() ? Integer.valueOf(matcher.group()) : null;
    }

    String extractTitle(String displayName) {
        String title = BRACKETED_YEAR_PATTERN.matcher(nullToEmpty(displayName)).replaceFirst("").trim();
        String lower = title.toLowerCase(Locale.ROOT);
        for (String ext : MOVIE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                title = title.substring(0, title.length() - ext.length());
                break;
            }
        }
        return EDGE_PUNCTUATION_PATTERN.matcher(title).replaceAll("");
    }

    private String normalizeSeriesName(String raw) {
        return SERIES_NAME_SEPARATOR_PATTERN.matcher(raw).replaceAll(" ").trim();
    }

    private boolean hasMovieExtension(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (String ext : MOVIE_EXTENSIONS) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private String urlPath(String url) {
        if (url == null) {
            return "";
        }
        try {
            String path = new URI(url).getPath();
            return path == null ? url : path;
        } catch (URISyntaxException e) {
            return url;
        }
    }

    private String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
