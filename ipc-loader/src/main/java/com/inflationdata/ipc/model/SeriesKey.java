package com.inflationdata.ipc.model;

import java.util.Comparator;

/**
 * Identifies one published series: a region plus a category/classification pair.
 */
public record SeriesKey(String region, String categoryName, String classification) {

    public static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::region)
            .thenComparing(SeriesKey::categoryName)
            .thenComparing(SeriesKey::classification);

    public boolean isHeadline() {
        return CategoryNames.HEADLINE.equals(categoryName);
    }

    public boolean isDivision() {
        return CategoryNames.DIVISION.equals(categoryName);
    }

    @Override
    public String toString() {
        return region + "/" + categoryName + "/" + classification;
    }
}
