package com.streetsignal.infrastructure.cache;

import com.streetsignal.application.port.out.GeocodeEntryRepository;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.GeocodeEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeocodeCacheTest {

    private static final District E1 = District.of("E1");
    private static final Coordinate E1_CENTER = new Coordinate(51.5175, -0.0599);

    private GeocodeEntryRepository repository;
    private CacheManager cacheManager;
    private GeocodeCache geocodeCache;

    @BeforeEach
    void setUp() {
        repository = mock(GeocodeEntryRepository.class);
        cacheManager = new ConcurrentMapCacheManager(CacheConfig.GEOCODES);
        geocodeCache = new GeocodeCache(repository, cacheManager);
    }

    @Test
    void testGet_Miss_ReturnsEmpty() {
        when(repository.findById("E1")).thenReturn(Optional.empty());

        assertThat(geocodeCache.get(E1)).isEmpty();
    }

    @Test
    void testGet_DatabaseHit_PopulatesCache() {
        when(repository.findById("E1")).thenReturn(Optional.of(new GeocodeEntry(E1, E1_CENTER, "postcodes.io")));

        assertThat(geocodeCache.get(E1)).contains(E1_CENTER);
        assertThat(cacheManager.getCache(CacheConfig.GEOCODES).get("E1", Coordinate.class)).isEqualTo(E1_CENTER);
    }

    @Test
    void testGet_CacheHit_SkipsDatabase() {
        cacheManager.getCache(CacheConfig.GEOCODES).put("E1", E1_CENTER);

        assertThat(geocodeCache.get(E1)).contains(E1_CENTER);
        verify(repository, never()).findById(any());
    }

    @Test
    void testPut_NewDistrict_PersistsAndCaches() {
        when(repository.findById("E1")).thenReturn(Optional.empty());

        Coordinate stored = geocodeCache.put(E1, E1_CENTER, "postcodes.io");

        assertThat(stored).isEqualTo(E1_CENTER);
        verify(repository).save(any(GeocodeEntry.class));
        assertThat(cacheManager.getCache(CacheConfig.GEOCODES).get("E1", Coordinate.class)).isEqualTo(E1_CENTER);
    }

    @Test
    void testPut_ExistingDistrict_KeepsFirstValue() {
        Coordinate other = new Coordinate(51.0, 0.0);
        when(repository.findById("E1")).thenReturn(Optional.of(new GeocodeEntry(E1, E1_CENTER, "seed")));

        Coordinate stored = geocodeCache.put(E1, other, "nominatim");

        assertThat(stored).isEqualTo(E1_CENTER);
        verify(repository, never()).save(any());
    }

    @Test
    void testWarmUp_LoadsEveryEntry() {
        District n1 = District.of("N1");
        when(repository.findAll()).thenReturn(List.of(
            new GeocodeEntry(E1, E1_CENTER, "seed"),
            new GeocodeEntry(n1, new Coordinate(51.5386, -0.0994), "seed")));

        geocodeCache.warmUp();

        assertThat(cacheManager.getCache(CacheConfig.GEOCODES).get("N1", Coordinate.class))
            .isEqualTo(new Coordinate(51.5386, -0.0994));
    }
}
