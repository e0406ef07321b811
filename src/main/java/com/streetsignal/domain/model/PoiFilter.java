package com.streetsignal.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Category selectors for the POI query.
 * Property selectors are {@code key=value} or {@code key=*}.
 */
@Getter
@EqualsAndHashCode
@ToString
public class PoiFilter {
    private final boolean includeAllShops;
    private final List<String> shopTypes;
    private final List<String> amenities;
    private final List<String> propertySelectors;

    public PoiFilter(boolean includeAllShops, List<String> shopTypes, List<String> amenities,
            List<String> propertySelectors) {
        this.includeAllShops = includeAllShops;
        this.shopTypes = shopTypes == null ? List.of() : List.copyOf(shopTypes);
        this.amenities = amenities == null ? List.of() : List.copyOf(amenities);
        this.propertySelectors = propertySelectors == null ? List.of() : List.copyOf(propertySelectors);
    }

    public static PoiFilter allShops() {
        return new PoiFilter(true, List.of(), List.of(), List.of());
    }
}
