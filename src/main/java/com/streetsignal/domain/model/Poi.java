package com.streetsignal.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

/**
 * Point of interest returned by the POI query. Tags stay a generic map; the
 * handful of keys the pipeline reads have typed accessors.
 */
@Getter
@ToString
public class Poi {

    public static final String STREET_TAG = "addr:street";
    public static final String POSTCODE_TAG = "addr:postcode";

    private final long id;
    private final OsmType osmType;
    private final Coordinate coordinate;
    private final Map<String, String> tags;

    public Poi(long id, OsmType osmType, Coordinate coordinate, Map<String, String> tags) {
        if (osmType == null || coordinate == null) {
            throw new IllegalArgumentException("POI type and coordinate are required");
        }
        this.id = id;
        this.osmType = osmType;
        this.coordinate = coordinate;
        this.tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public Optional<String> getExplicitStreet() {
        return tag(STREET_TAG);
    }

    public Optional<String> getPostcode() {
        return tag(POSTCODE_TAG);
    }

    public Optional<String> getName() {
        return tag("name");
    }

    public Optional<String> getShop() {
        return tag("shop");
    }

    public Optional<String> getAmenity() {
        return tag("amenity");
    }

    public Optional<String> getOffice() {
        return tag("office");
    }

    public Optional<String> getBuilding() {
        return tag("building");
    }

    public Optional<String> getLanduse() {
        return tag("landuse");
    }

    private Optional<String> tag(String key) {
        String value = tags.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
