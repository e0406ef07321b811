package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Parameters shared by every district of a job.
 */
@Getter
@ToString
public class AnalysisParameters {
    private final String preset;
    private final PoiFilter filter;
    private final int radiusMeters;
    private final double maxAssignMeters;
    private final int topN;

    public AnalysisParameters(String preset, PoiFilter filter, int radiusMeters, double maxAssignMeters, int topN) {
        if (filter == null) {
            throw new IllegalArgumentException("POI filter is required");
        }
        this.preset = preset;
        this.filter = filter;
        this.radiusMeters = radiusMeters;
        this.maxAssignMeters = maxAssignMeters;
        this.topN = topN;
    }
}
