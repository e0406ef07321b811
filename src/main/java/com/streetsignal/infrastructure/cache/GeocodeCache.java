package com.streetsignal.infrastructure.cache;

import com.streetsignal.application.port.out.GeocodeEntryRepository;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.GeocodeEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Durable district to centroid store.
 *
 * Strategy: cache first, database fallback, populate cache. Writes go to the
 * database synchronously and are append-only: an existing district is never
 * overwritten. Cache failures (e.g. Redis unavailable) are logged and the
 * database is used alone.
 */
@Component
public class GeocodeCache {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeCache.class);

    private final GeocodeEntryRepository repository;
    private final CacheManager cacheManager;

    public GeocodeCache(GeocodeEntryRepository repository, CacheManager cacheManager) {
        this.repository = repository;
        this.cacheManager = cacheManager;
    }

    public Optional<Coordinate> get(District district) {
        Optional<Coordinate> cached = getFromCache(district);
        if (cached.isPresent()) {
            logger.debug("Geocode cache hit for {}", district);
            return cached;
        }

        Optional<Coordinate> stored = repository.findById(district.getCode()).map(GeocodeEntry::toCoordinate);
        stored.ifPresent(coordinate -> putInCache(district, coordinate));
        logger.debug("Geocode {} for {}", stored.isPresent() ? "database hit" : "miss", district);
        return stored;
    }

    /**
     * Store a coordinate unless the district is already known.
     *
     * @return the coordinate now held for the district, which is the earlier one
     *         if the district was already stored
     */
    public synchronized Coordinate put(District district, Coordinate coordinate, String source) {
        Optional<GeocodeEntry> existing = repository.findById(district.getCode());
        if (existing.isPresent()) {
            logger.debug("Geocode for {} already stored, keeping existing entry", district);
            Coordinate kept = existing.get().toCoordinate();
            putInCache(district, kept);
            return kept;
        }

        repository.save(new GeocodeEntry(district, coordinate, source));
        putInCache(district, coordinate);
        logger.info("Stored geocode for {} from {}: {}", district, source, coordinate);
        return coordinate;
    }

    public long size() {
        return repository.count();
    }

    /**
     * Load every stored geocode into the cache once the application is up.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            List<GeocodeEntry> entries = repository.findAll();
            entries.forEach(entry -> putInCache(District.of(entry.getDistrict()), entry.toCoordinate()));
            logger.info("Geocode cache warmed with {} entries", entries.size());
        } catch (Exception e) {
            logger.warn("Failed to warm geocode cache, continuing without warm-up: {}", e.getMessage());
        }
    }

    private Optional<Coordinate> getFromCache(District district) {
        try {
            Cache cache = cacheManager.getCache(CacheConfig.GEOCODES);
            if (cache != null) {
                Cache.ValueWrapper wrapper = cache.get(district.getCode());
                if (wrapper != null && wrapper.get() instanceof Coordinate coordinate) {
                    return Optional.of(coordinate);
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read geocode cache, continuing without cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private void putInCache(District district, Coordinate coordinate) {
        try {
            Cache cache = cacheManager.getCache(CacheConfig.GEOCODES);
            if (cache != null) {
                cache.put(district.getCode(), coordinate);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate geocode cache, continuing without cache: {}", e.getMessage());
        }
    }
}
