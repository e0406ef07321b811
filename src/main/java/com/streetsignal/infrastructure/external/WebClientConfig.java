package com.streetsignal.infrastructure.external;

import com.streetsignal.infrastructure.config.StreetSignalProperties;
import com.streetsignal.infrastructure.config.StreetSignalProperties.ServiceEndpoint;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * One rate-limited, retrying client per external service. Each gets its own
 * limiter, so the three services are throttled independently.
 *
 * Spring Boot auto-configures the Jackson codecs on the injected builder.
 */
@Configuration
public class WebClientConfig {

    public static final String POSTCODES_IO = "postcodes.io";
    public static final String NOMINATIM = "nominatim";
    public static final String OVERPASS = "overpass";

    /** Overpass answers for dense districts easily exceed the 256 KB default. */
    private static final int MAX_RESPONSE_BYTES = 32 * 1024 * 1024;

    @Bean
    public RetryingClient postcodesIoHttpClient(WebClient.Builder webClientBuilder, StreetSignalProperties properties) {
        return retryingClient(POSTCODES_IO, properties.getPostcodesIo(), webClientBuilder, properties);
    }

    @Bean
    public RetryingClient nominatimHttpClient(WebClient.Builder webClientBuilder, StreetSignalProperties properties) {
        return retryingClient(NOMINATIM, properties.getNominatim(), webClientBuilder, properties);
    }

    @Bean
    public RetryingClient overpassHttpClient(WebClient.Builder webClientBuilder, StreetSignalProperties properties) {
        return retryingClient(OVERPASS, properties.getOverpass(), webClientBuilder, properties);
    }

    private RetryingClient retryingClient(String service, ServiceEndpoint endpoint, WebClient.Builder builder,
            StreetSignalProperties properties) {
        WebClient webClient = builder.clone()
            .baseUrl(endpoint.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build())
            .build();
        RateLimiter rateLimiter = new RateLimiter(service, endpoint.getMinInterval());
        return new RetryingClient(service, webClient, rateLimiter, properties.getRetry(), endpoint.getTimeout());
    }
}
