package com.streetsignal.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsignal.application.port.out.PoiDataGateway;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.OsmType;
import com.streetsignal.domain.model.Poi;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.domain.model.Street;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Client for the Overpass API.
 * Handles query execution and maps raw elements into POIs and streets.
 */
@Service
public class OverpassGateway implements PoiDataGateway {

    private static final Logger logger = LoggerFactory.getLogger(OverpassGateway.class);

    private final RetryingClient httpClient;
    private final OverpassQueryBuilder queryBuilder;
    private final ObjectMapper objectMapper;

    public OverpassGateway(
        @Qualifier("overpassHttpClient") RetryingClient httpClient,
        OverpassQueryBuilder queryBuilder,
        ObjectMapper objectMapper
    ) {
        this.httpClient = httpClient;
        this.queryBuilder = queryBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Poi> fetchPois(Coordinate center, int radiusMeters, PoiFilter filter) {
        String query = queryBuilder.buildPoiQuery(center, radiusMeters, filter);
        List<Poi> pois = parseElements(execute("POI query", query), this::toPoi);
        logger.info("Parsed {} POIs from Overpass response", pois.size());
        return pois;
    }

    @Override
    public List<Street> fetchStreets(Coordinate center, int radiusMeters) {
        String query = queryBuilder.buildStreetQuery(center, radiusMeters);
        List<Street> streets = parseElements(execute("street query", query), this::toStreet);
        logger.info("Parsed {} named streets from Overpass response", streets.size());
        return streets;
    }

    private String execute(String operation, String query) {
        logger.debug("Executing Overpass {}: {}", operation, query);
        return httpClient.execute(operation, client -> client.post()
            .uri("/interpreter")
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData("data", query))
            .retrieve()
            .bodyToMono(String.class));
    }

    /**
     * Parse the elements array, skipping elements the mapper rejects (null) or
     * cannot read.
     */
    <T> List<T> parseElements(String responseBody, Function<JsonNode, T> mapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "" : responseBody);
        } catch (Exception e) {
            logger.error("Failed to parse Overpass response", e);
            throw new ExternalServiceException(WebClientConfig.OVERPASS, "Failed to parse Overpass response",
                1, null, e);
        }

        if (root == null || root.isMissingNode()) {
            throw new ExternalServiceException(WebClientConfig.OVERPASS, "Empty Overpass response");
        }
        JsonNode remark = root.get("remark");
        if (remark != null) {
            logger.warn("Overpass remark: {}", remark.asText());
        }

        JsonNode elements = root.get("elements");
        if (elements == null || !elements.isArray()) {
            logger.warn("Overpass response missing elements array");
            return List.of();
        }

        List<T> parsed = new ArrayList<>();
        for (JsonNode element : elements) {
            try {
                T value = mapper.apply(element);
                if (value != null) {
                    parsed.add(value);
                }
            } catch (Exception e) {
                logger.warn("Failed to parse element: {}", element, e);
            }
        }
        return parsed;
    }

    Poi toPoi(JsonNode element) {
        OsmType osmType = osmTypeOf(element);
        Coordinate coordinate = coordinateOf(element, osmType);
        if (osmType == null || coordinate == null) {
            return null;
        }
        return new Poi(element.path("id").asLong(), osmType, coordinate, tagsOf(element));
    }

    Street toStreet(JsonNode element) {
        Map<String, String> tags = tagsOf(element);
        String name = tags.get("name");
        if (name == null || name.isBlank()) {
            return null;
        }
        JsonNode center = element.get("center");
        if (center == null || !center.has("lat") || !center.has("lon")) {
            return null;
        }
        Coordinate coordinate = new Coordinate(center.path("lat").asDouble(), center.path("lon").asDouble());
        return new Street(element.path("id").asLong(), name, coordinate, tags.get("highway"));
    }

    private OsmType osmTypeOf(JsonNode element) {
        String type = element.path("type").asText("");
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "node" -> OsmType.node;
            case "way" -> OsmType.way;
            case "relation" -> OsmType.relation;
            default -> {
                logger.warn("Unknown OSM type: {}", type);
                yield null;
            }
        };
    }

    private Coordinate coordinateOf(JsonNode element, OsmType osmType) {
        if (osmType == OsmType.node && element.has("lat") && element.has("lon")) {
            return new Coordinate(element.get("lat").asDouble(), element.get("lon").asDouble());
        }
        JsonNode center = element.get("center");
        if (center != null && center.has("lat") && center.has("lon")) {
            return new Coordinate(center.get("lat").asDouble(), center.get("lon").asDouble());
        }
        return null;
    }

    private Map<String, String> tagsOf(JsonNode element) {
        Map<String, String> tags = new HashMap<>();
        JsonNode tagNode = element.get("tags");
        if (tagNode != null) {
            tagNode.fields().forEachRemaining(entry -> tags.put(entry.getKey(), entry.getValue().asText()));
        }
        return tags;
    }
}
