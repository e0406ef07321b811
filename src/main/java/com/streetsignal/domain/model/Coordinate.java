package com.streetsignal.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a WGS84 latitude/longitude pair in degrees.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Coordinate {
    private final double lat;
    private final double lon;

    @JsonCreator
    public Coordinate(@JsonProperty("lat") double lat, @JsonProperty("lon") double lon) {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
        this.lat = lat;
        this.lon = lon;
    }
}
