package com.streetsignal.domain.service;

import com.streetsignal.domain.model.Coordinate;

/**
 * Great-circle distance on a spherical Earth (haversine formula).
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoDistance() {
    }

    /**
     * @return distance in meters, never negative
     */
    public static double haversineMeters(Coordinate from, Coordinate to) {
        double phi1 = Math.toRadians(from.getLat());
        double phi2 = Math.toRadians(to.getLat());
        double deltaPhi = Math.toRadians(to.getLat() - from.getLat());
        double deltaLambda = Math.toRadians(to.getLon() - from.getLon());

        double a = Math.sin(deltaPhi / 2) * Math.sin(deltaPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(deltaLambda / 2) * Math.sin(deltaLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }
}
