package com.streetsignal.domain.service;

import com.streetsignal.domain.model.Attribution;
import com.streetsignal.domain.model.Poi;
import com.streetsignal.domain.model.Street;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Domain service assigning each POI to a street name.
 *
 * Rules, in order:
 * - an explicit addr:street tag wins, no distance check
 * - otherwise the nearest named street, if it lies within the assignment distance
 *
 * The nearest-street search is a linear scan over the district's streets. The
 * street list for one search radius stays in the low hundreds, so a spatial
 * index would only be worth adding if radii grow considerably.
 */
@Service
public class StreetAttributor {

    /**
     * Attribute every POI, preserving input order.
     *
     * @param pois POIs of one district
     * @param streets named streets of the same district
     * @param maxAssignMeters max distance for nearest-street attribution
     * @return one attribution per POI
     */
    public List<Attribution> attribute(List<Poi> pois, List<Street> streets, double maxAssignMeters) {
        List<Attribution> attributions = new ArrayList<>(pois.size());
        for (Poi poi : pois) {
            attributions.add(attribute(poi, streets, maxAssignMeters));
        }
        return attributions;
    }

    Attribution attribute(Poi poi, List<Street> streets, double maxAssignMeters) {
        Optional<String> explicitStreet = poi.getExplicitStreet();
        if (explicitStreet.isPresent()) {
            return Attribution.byTag(poi, explicitStreet.get());
        }

        Street nearest = null;
        double minDistance = Double.POSITIVE_INFINITY;
        for (Street street : streets) {
            double distance = GeoDistance.haversineMeters(poi.getCoordinate(), street.getCoordinate());
            // strict comparison: the first of several equidistant streets is kept
            if (distance < minDistance) {
                minDistance = distance;
                nearest = street;
            }
        }

        if (nearest != null && minDistance <= maxAssignMeters) {
            return Attribution.byNearestStreet(poi, nearest.getName(), minDistance);
        }
        return Attribution.unattributed(poi, nearest == null ? null : minDistance);
    }
}
