package com.streetsignal.infrastructure.external;

import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds Overpass QL for the POI and street queries.
 *
 * Filter values end up inside the query text, so only plain tokens are
 * accepted; anything else is dropped before the query is assembled.
 */
@Component
public class OverpassQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(OverpassQueryBuilder.class);

    static final Pattern TOKEN = Pattern.compile("^[a-z0-9_]+$");
    static final Pattern SELECTOR = Pattern.compile("^[a-z0-9_]+=(\\*|[a-z0-9_]+)$");

    private static final String[] ELEMENT_TYPES = {"node", "way", "relation"};

    private final int queryTimeoutSeconds;

    @Autowired
    public OverpassQueryBuilder(StreetSignalProperties properties) {
        this(properties.getOverpass().getQueryTimeoutSeconds());
    }

    OverpassQueryBuilder(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    /**
     * Union of nodes, ways and relations matching any selector of the filter.
     * Falls back to all shops when the filter selects nothing.
     */
    public String buildPoiQuery(Coordinate center, int radiusMeters, PoiFilter filter) {
        String around = around(center, radiusMeters);
        List<String> shopTypes = validTokens(filter.getShopTypes(), "shop type");
        List<String> amenities = validTokens(filter.getAmenities(), "amenity");
        List<String> selectors = validSelectors(filter.getPropertySelectors());

        List<String> parts = new ArrayList<>();
        if (filter.isIncludeAllShops()) {
            addForAllTypes(parts, around, "[\"shop\"]");
        } else if (!shopTypes.isEmpty()) {
            addForAllTypes(parts, around, "[\"shop\"~\"^(" + String.join("|", shopTypes) + ")$\"]");
        }

        if (!amenities.isEmpty()) {
            addForAllTypes(parts, around, "[\"amenity\"~\"^(" + String.join("|", amenities) + ")$\"]");
        }

        for (String selector : selectors) {
            String[] keyValue = selector.split("=", 2);
            String tagFilter = "*".equals(keyValue[1])
                ? "[\"" + keyValue[0] + "\"]"
                : "[\"" + keyValue[0] + "\"=\"" + keyValue[1] + "\"]";
            addForAllTypes(parts, around, tagFilter);
        }

        if (parts.isEmpty()) {
            addForAllTypes(parts, around, "[\"shop\"]");
        }

        return header()
            + "(\n  " + String.join("\n  ", parts) + "\n);\n"
            + "out tags center;";
    }

    /**
     * All named highways within the radius.
     */
    public String buildStreetQuery(Coordinate center, int radiusMeters) {
        return header()
            + "way[\"highway\"][\"name\"]" + around(center, radiusMeters) + ";\n"
            + "out tags center;";
    }

    private String header() {
        return "[out:json][timeout:" + queryTimeoutSeconds + "];\n";
    }

    private static String around(Coordinate center, int radiusMeters) {
        return String.format(Locale.ROOT, "(around:%d,%.6f,%.6f)", radiusMeters, center.getLat(), center.getLon());
    }

    private static void addForAllTypes(List<String> parts, String around, String tagFilter) {
        for (String type : ELEMENT_TYPES) {
            parts.add(type + around + tagFilter + ";");
        }
    }

    private static List<String> validTokens(List<String> values, String kind) {
        List<String> valid = new ArrayList<>();
        for (String value : values) {
            if (value != null && TOKEN.matcher(value).matches()) {
                valid.add(value);
            } else {
                logger.warn("Ignoring invalid {} '{}'", kind, value);
            }
        }
        return valid;
    }

    private static List<String> validSelectors(List<String> values) {
        List<String> valid = new ArrayList<>();
        for (String value : values) {
            if (value != null && SELECTOR.matcher(value).matches()) {
                valid.add(value);
            } else {
                logger.warn("Ignoring invalid property selector '{}'", value);
            }
        }
        return valid;
    }
}
