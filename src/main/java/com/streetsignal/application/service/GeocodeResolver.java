package com.streetsignal.application.service;

import com.streetsignal.application.port.out.GeocodingProvider;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.exception.GeocodeFailureException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.infrastructure.cache.GeocodeCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a district to its centroid.
 * Strategy: geocode cache first, then each provider in order until one knows
 * the district. A successful lookup is stored before it is returned.
 */
@Service
public class GeocodeResolver {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeResolver.class);

    private final GeocodeCache geocodeCache;
    private final List<GeocodingProvider> providers;

    public GeocodeResolver(GeocodeCache geocodeCache, List<GeocodingProvider> providers) {
        this.geocodeCache = geocodeCache;
        this.providers = List.copyOf(providers);
    }

    /**
     * @throws GeocodeFailureException if no provider can locate the district
     */
    public Coordinate resolve(District district) {
        Optional<Coordinate> cached = geocodeCache.get(district);
        if (cached.isPresent()) {
            return cached.get();
        }

        RuntimeException lastFailure = null;
        for (GeocodingProvider provider : providers) {
            try {
                Optional<Coordinate> found = provider.lookup(district);
                if (found.isPresent()) {
                    logger.info("Geocoded {} via {}: {}", district, provider.name(), found.get());
                    return geocodeCache.put(district, found.get(), provider.name());
                }
            } catch (ExternalServiceException | GeocodeFailureException e) {
                logger.warn("Geocoding {} via {} failed: {}", district, provider.name(), e.getMessage());
                lastFailure = e;
            }
        }

        String message = "Could not geocode district: " + district;
        if (lastFailure != null) {
            throw new GeocodeFailureException(message + " (" + lastFailure.getMessage() + ")", lastFailure);
        }
        throw new GeocodeFailureException(message);
    }
}
