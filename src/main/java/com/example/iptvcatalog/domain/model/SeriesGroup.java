package com.example.iptvcatalog.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SeriesGroup {

    private final String seriesName;

    /** Logo and group title come from the first episode added to the group. */
    private final String logo;

    private final String groupTitle;

    private final List<ClassifiedEntry> episodes = new ArrayList<>();
}
