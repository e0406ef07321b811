package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Output of ranking one district's attributions.
 */
@Getter
@ToString
public class StreetRanking {
    private final List<StreetCount> topStreets;
    private final List<StreetCount> allStreets;
    private final int totalPois;
    private final int totalStreets;

    public StreetRanking(List<StreetCount> topStreets, List<StreetCount> allStreets, int totalPois) {
        this.topStreets = List.copyOf(topStreets);
        this.allStreets = List.copyOf(allStreets);
        this.totalPois = totalPois;
        this.totalStreets = allStreets.size();
    }
}
