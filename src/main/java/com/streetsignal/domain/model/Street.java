package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Named highway segment. Several segments may carry the same name; attribution
 * and ranking work on the name.
 */
@Getter
@ToString
public class Street {
    private final long id;
    private final String name;
    private final Coordinate coordinate;
    private final String highwayType;

    public Street(long id, String name, Coordinate coordinate, String highwayType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Street name must not be blank");
        }
        if (coordinate == null) {
            throw new IllegalArgumentException("Street coordinate is required");
        }
        this.id = id;
        this.name = name;
        this.coordinate = coordinate;
        this.highwayType = highwayType;
    }
}
