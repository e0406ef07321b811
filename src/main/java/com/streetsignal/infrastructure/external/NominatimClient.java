package com.streetsignal.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsignal.application.port.out.GeocodingProvider;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.exception.GeocodeFailureException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fallback geocoder using Nominatim free-text search.
 *
 * Results whose postcode lies in the district are averaged into a centroid.
 * Without such matches a single result is accepted as is, several results are
 * treated as ambiguous.
 */
@Component
@Order(2)
public class NominatimClient implements GeocodingProvider {

    private static final Logger logger = LoggerFactory.getLogger(NominatimClient.class);

    private final RetryingClient httpClient;
    private final ObjectMapper objectMapper;
    private final String querySuffix;
    private final int resultLimit;

    public NominatimClient(@Qualifier("nominatimHttpClient") RetryingClient httpClient, ObjectMapper objectMapper,
            StreetSignalProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.querySuffix = properties.getNominatim().getQuerySuffix();
        this.resultLimit = properties.getNominatim().getResultLimit();
    }

    @Override
    public String name() {
        return WebClientConfig.NOMINATIM;
    }

    @Override
    public Optional<Coordinate> lookup(District district) {
        String query = district.getCode() + (querySuffix == null ? "" : querySuffix);
        String body = httpClient.execute("search " + district, client -> client.get()
            .uri(uriBuilder -> uriBuilder.path("/search")
                .queryParam("q", query)
                .queryParam("format", "jsonv2")
                .queryParam("limit", resultLimit)
                .queryParam("addressdetails", 1)
                .build())
            .retrieve()
            .bodyToMono(String.class));
        return parse(district, body);
    }

    Optional<Coordinate> parse(District district, String body) {
        JsonNode results;
        try {
            results = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ExternalServiceException(name(), "Failed to parse Nominatim response for " + district,
                1, null, e);
        }
        if (results == null || !results.isArray() || results.isEmpty()) {
            logger.info("Nominatim found nothing for district {}", district);
            return Optional.empty();
        }

        String prefix = district.getCode() + " ";
        List<Coordinate> usable = new ArrayList<>();
        List<Coordinate> exactMatches = new ArrayList<>();
        for (JsonNode result : results) {
            Optional<Coordinate> coordinate = coordinateOf(result);
            if (coordinate.isEmpty()) {
                logger.warn("Skipping Nominatim result without usable coordinates for district {}: {}",
                    district, result.path("display_name").asText(""));
                continue;
            }
            usable.add(coordinate.get());
            String postcode = result.path("address").path("postcode").asText("").toUpperCase(Locale.ROOT);
            if (postcode.startsWith(prefix)) {
                exactMatches.add(coordinate.get());
            }
        }

        if (!exactMatches.isEmpty()) {
            double lat = exactMatches.stream().mapToDouble(Coordinate::getLat).average().orElseThrow();
            double lon = exactMatches.stream().mapToDouble(Coordinate::getLon).average().orElseThrow();
            logger.debug("Nominatim: centroid of {} exact matches for {}", exactMatches.size(), district);
            return Optional.of(new Coordinate(lat, lon));
        }
        if (usable.isEmpty()) {
            logger.info("Nominatim returned no usable coordinates for district {}", district);
            return Optional.empty();
        }
        if (usable.size() == 1) {
            return Optional.of(usable.get(0));
        }
        throw new GeocodeFailureException("Ambiguous geocoding result for district " + district + ": "
            + usable.size() + " candidates, none inside the district");
    }

    private Optional<Coordinate> coordinateOf(JsonNode result) {
        // Nominatim serializes coordinates as strings
        JsonNode lat = result.get("lat");
        JsonNode lon = result.get("lon");
        if (lat == null || lon == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Coordinate(Double.parseDouble(lat.asText()), Double.parseDouble(lon.asText())));
        } catch (IllegalArgumentException e) {
            // NumberFormatException or an out-of-range coordinate
            return Optional.empty();
        }
    }
}
