package com.example.iptvcatalog.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ClassifiedSet {

    private List<ClassifiedEntry> livestreams;

    private List<ClassifiedEntry> movies;

    /** Keyed by normalized series name; iteration order is unspecified. */
    private Map<String, SeriesGroup> seriesGroups;

    public int episodeCount() {
        int count = 0;
        for (SeriesGroup group : seriesGroups.values()) {
            count += group.getEpisodes().size();
        }
        return count;
    }

    public List<SeriesGroup> seriesGroupsByName() {
        List<SeriesGroup> groups = new ArrayList<>(seriesGroups.values());
        groups.sort(Comparator.comparing(SeriesGroup::getSeriesName));
        return groups;
    }
}
