package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Street assigned to a single POI. {@code streetName} is null when the POI
 * could not be attributed.
 */
@Getter
@ToString
public class Attribution {

    public enum Method {
        TAG,
        NEAREST_STREET,
        NONE
    }

    private final Poi poi;
    private final String streetName;
    private final Method method;
    private final Double distanceMeters;

    private Attribution(Poi poi, String streetName, Method method, Double distanceMeters) {
        this.poi = poi;
        this.streetName = streetName;
        this.method = method;
        this.distanceMeters = distanceMeters;
    }

    public static Attribution byTag(Poi poi, String streetName) {
        return new Attribution(poi, streetName, Method.TAG, null);
    }

    public static Attribution byNearestStreet(Poi poi, String streetName, double distanceMeters) {
        return new Attribution(poi, streetName, Method.NEAREST_STREET, distanceMeters);
    }

    public static Attribution unattributed(Poi poi, Double nearestDistanceMeters) {
        return new Attribution(poi, null, Method.NONE, nearestDistanceMeters);
    }

    public boolean isAttributed() {
        return streetName != null;
    }
}
