package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of processing one district. Failed results keep the same shape with
 * zeroed counts and empty street lists.
 */
@Getter
@ToString
public class DistrictResult {
    private final District district;
    private final boolean success;
    private final String error;
    private final int totalPois;
    private final int totalStreets;
    private final List<StreetCount> topStreets;
    private final List<StreetCount> allStreets;

    private DistrictResult(District district, boolean success, String error, int totalPois, int totalStreets,
            List<StreetCount> topStreets, List<StreetCount> allStreets) {
        this.district = district;
        this.success = success;
        this.error = error;
        this.totalPois = totalPois;
        this.totalStreets = totalStreets;
        this.topStreets = List.copyOf(topStreets);
        this.allStreets = List.copyOf(allStreets);
    }

    public static DistrictResult success(District district, StreetRanking ranking) {
        return new DistrictResult(district, true, null, ranking.getTotalPois(), ranking.getTotalStreets(),
            ranking.getTopStreets(), ranking.getAllStreets());
    }

    public static DistrictResult empty(District district) {
        return new DistrictResult(district, true, null, 0, 0, List.of(), List.of());
    }

    public static DistrictResult failure(District district, String error) {
        return new DistrictResult(district, false, error, 0, 0, List.of(), List.of());
    }
}
