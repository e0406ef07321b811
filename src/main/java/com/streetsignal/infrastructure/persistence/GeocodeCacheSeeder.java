package com.streetsignal.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.infrastructure.cache.GeocodeCache;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.util.Iterator;
import java.util.Map;

/**
 * Imports a geocode JSON file into the durable cache at startup.
 * Runs when app.seeding.enabled=true.
 *
 * File format: {"E1": {"lat": 51.5175, "lon": -0.0599}, ...}
 * Districts already in the cache are left untouched.
 */
@Configuration
public class GeocodeCacheSeeder {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeCacheSeeder.class);

    static final String SEED_SOURCE = "seed";

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedGeocodes(
        GeocodeCache geocodeCache,
        StreetSignalProperties properties,
        ResourceLoader resourceLoader,
        ObjectMapper objectMapper
    ) {
        return args -> {
            String location = properties.getSeeding().getGeocodeFile();
            Resource resource = resourceLoader.getResource(location);
            if (!resource.exists()) {
                logger.warn("Geocode seed file {} not found, skipping", location);
                return;
            }

            JsonNode root;
            try (InputStream in = resource.getInputStream()) {
                root = objectMapper.readTree(in);
            }
            int imported = seed(geocodeCache, root);
            logger.info("Geocode seeding complete: {} entries read from {}, cache now holds {}",
                imported, location, geocodeCache.size());
        };
    }

    static int seed(GeocodeCache geocodeCache, JsonNode root) {
        if (root == null || !root.isObject()) {
            logger.warn("Geocode seed file is not a JSON object, skipping");
            return 0;
        }
        int imported = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.path("lat").isNumber() || !value.path("lon").isNumber()) {
                logger.warn("Skipping seed entry {} without numeric lat/lon", field.getKey());
                continue;
            }
            try {
                District district = District.of(field.getKey());
                geocodeCache.put(district, new Coordinate(value.get("lat").asDouble(), value.get("lon").asDouble()),
                    SEED_SOURCE);
                imported++;
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping invalid seed entry {}: {}", field.getKey(), e.getMessage());
            }
        }
        return imported;
    }
}
