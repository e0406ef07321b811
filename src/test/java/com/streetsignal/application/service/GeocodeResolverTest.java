package com.streetsignal.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streetsignal.application.port.out.GeocodeEntryRepository;
import com.streetsignal.application.port.out.GeocodingProvider;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.exception.GeocodeFailureException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.GeocodeEntry;
import com.streetsignal.infrastructure.cache.CacheConfig;
import com.streetsignal.infrastructure.cache.GeocodeCache;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import com.streetsignal.infrastructure.external.NominatimClient;
import com.streetsignal.infrastructure.external.RateLimiter;
import com.streetsignal.infrastructure.external.RetryingClient;
import com.streetsignal.infrastructure.external.WebClientConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.streetsignal.module.test.support.TestFixtures.fastRetry;
import static com.streetsignal.module.test.support.TestFixtures.jsonResponse;
import static com.streetsignal.module.test.support.TestFixtures.webClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeocodeResolverTest {

    private static final District E1 = District.of("E1");
    private static final Coordinate E1_CENTER = new Coordinate(51.5175, -0.0599);

    private final Map<String, GeocodeEntry> table = new HashMap<>();
    private GeocodeCache geocodeCache;
    private GeocodingProvider primary;
    private GeocodingProvider fallback;
    private GeocodeResolver resolver;

    @BeforeEach
    void setUp() {
        GeocodeEntryRepository repository = mock(GeocodeEntryRepository.class);
        when(repository.findById(any())).thenAnswer(invocation -> Optional.ofNullable(table.get(invocation.<String>getArgument(0))));
        when(repository.save(any())).thenAnswer(invocation -> {
            GeocodeEntry entry = invocation.getArgument(0);
            table.put(entry.getDistrict(), entry);
            return entry;
        });
        geocodeCache = new GeocodeCache(repository, new ConcurrentMapCacheManager(CacheConfig.GEOCODES));

        primary = mock(GeocodingProvider.class);
        fallback = mock(GeocodingProvider.class);
        when(primary.name()).thenReturn("postcodes.io");
        when(fallback.name()).thenReturn("nominatim");
        resolver = new GeocodeResolver(geocodeCache, List.of(primary, fallback));
    }

    @Test
    void testResolve_PrimaryHit_StoresAndSkipsFallback() {
        when(primary.lookup(E1)).thenReturn(Optional.of(E1_CENTER));

        assertThat(resolver.resolve(E1)).isEqualTo(E1_CENTER);
        assertThat(table).containsKey("E1");
        assertThat(table.get("E1").getSource()).isEqualTo("postcodes.io");
        verify(fallback, never()).lookup(any());
    }

    @Test
    void testResolve_TwiceInARow_CallsProviderOnce() {
        when(primary.lookup(E1)).thenReturn(Optional.of(E1_CENTER));

        Coordinate first = resolver.resolve(E1);
        Coordinate second = resolver.resolve(District.of(" e1 "));

        assertThat(second).isEqualTo(first);
        verify(primary, times(1)).lookup(any());
    }

    @Test
    void testResolve_PrimaryNotFound_UsesFallback() {
        when(primary.lookup(E1)).thenReturn(Optional.empty());
        when(fallback.lookup(E1)).thenReturn(Optional.of(E1_CENTER));

        assertThat(resolver.resolve(E1)).isEqualTo(E1_CENTER);
        assertThat(table.get("E1").getSource()).isEqualTo("nominatim");
    }

    @Test
    void testResolve_PrimaryFails_UsesFallback() {
        when(primary.lookup(E1)).thenThrow(new ExternalServiceException("postcodes.io", "HTTP 503"));
        when(fallback.lookup(E1)).thenReturn(Optional.of(E1_CENTER));

        assertThat(resolver.resolve(E1)).isEqualTo(E1_CENTER);
    }

    @Test
    void testResolve_AllProvidersFail_ThrowsWithLastCause() {
        ExternalServiceException lastError = new ExternalServiceException("nominatim", "HTTP 503");
        when(primary.lookup(E1)).thenReturn(Optional.empty());
        when(fallback.lookup(E1)).thenThrow(lastError);

        assertThatThrownBy(() -> resolver.resolve(E1))
            .isInstanceOf(GeocodeFailureException.class)
            .hasMessageStartingWith("Could not geocode district: E1")
            .hasCause(lastError);
        assertThat(table).isEmpty();
    }

    @Test
    void testResolve_NobodyKnowsDistrict_Throws() {
        when(primary.lookup(any())).thenReturn(Optional.empty());
        when(fallback.lookup(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(District.of("ZZ9")))
            .isInstanceOf(GeocodeFailureException.class)
            .hasMessage("Could not geocode district: ZZ9");
    }

    @Test
    void testResolve_FallbackReturnsResultWithoutCoordinates_ThrowsGeocodeFailure() {
        RetryingClient httpClient = new RetryingClient(WebClientConfig.NOMINATIM,
            webClient(request -> jsonResponse(HttpStatus.OK, "[{\"lon\":\"-0.1\",\"address\":{\"postcode\":\"ZZ9 1AA\"}}]")),
            new RateLimiter(WebClientConfig.NOMINATIM, Duration.ZERO), fastRetry(1), Duration.ofSeconds(5));
        NominatimClient nominatim = new NominatimClient(httpClient, new ObjectMapper(), new StreetSignalProperties());
        when(primary.lookup(any())).thenReturn(Optional.empty());
        GeocodeResolver withNominatim = new GeocodeResolver(geocodeCache, List.of(primary, nominatim));

        assertThatThrownBy(() -> withNominatim.resolve(District.of("ZZ9")))
            .isInstanceOf(GeocodeFailureException.class)
            .hasMessageStartingWith("Could not geocode district: ZZ9");
    }
}
