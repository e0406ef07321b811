package com.streetsignal.infrastructure.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsignal.application.port.out.GeocodingProvider;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Primary geocoder: the postcodes.io outcode endpoint returns a pre-computed
 * centroid for every UK postcode district.
 */
@Component
@Order(1)
public class PostcodesIoClient implements GeocodingProvider {

    private static final Logger logger = LoggerFactory.getLogger(PostcodesIoClient.class);

    private final RetryingClient httpClient;
    private final ObjectMapper objectMapper;

    public PostcodesIoClient(@Qualifier("postcodesIoHttpClient") RetryingClient httpClient,
            ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return WebClientConfig.POSTCODES_IO;
    }

    @Override
    public Optional<Coordinate> lookup(District district) {
        String body;
        try {
            body = httpClient.execute("outcode lookup " + district, client -> client.get()
                .uri("/outcodes/{outcode}", district.getCode())
                .retrieve()
                .bodyToMono(String.class));
        } catch (ExternalServiceException e) {
            if (e.isNotFound()) {
                logger.info("postcodes.io does not know district {}", district);
                return Optional.empty();
            }
            throw e;
        }
        return parse(district, body);
    }

    Optional<Coordinate> parse(District district, String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode result = root.path("result");
            if (root.path("status").asInt() != 200 || result.isMissingNode() || result.isNull()) {
                return Optional.empty();
            }
            JsonNode latitude = result.get("latitude");
            JsonNode longitude = result.get("longitude");
            if (latitude == null || longitude == null || !latitude.isNumber() || !longitude.isNumber()) {
                logger.warn("postcodes.io returned no centroid for district {}", district);
                return Optional.empty();
            }
            return Optional.of(new Coordinate(latitude.asDouble(), longitude.asDouble()));
        } catch (Exception e) {
            throw new ExternalServiceException(name(), "Failed to parse postcodes.io response for " + district,
                1, null, e);
        }
    }
}
