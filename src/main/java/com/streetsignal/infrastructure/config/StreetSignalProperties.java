package com.streetsignal.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application settings bound from {@code app.*}. Read once at startup; nothing
 * in the pipeline writes to it afterwards.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app")
public class StreetSignalProperties {

    /** Sent on every outgoing request; Nominatim rejects anonymous clients. */
    @NotBlank
    private String userAgent = "StreetSignal/1.0";

    @Valid
    private ServiceEndpoint postcodesIo = new ServiceEndpoint(
        "https://api.postcodes.io", Duration.ofMillis(200), Duration.ofSeconds(10));

    @Valid
    private Nominatim nominatim = new Nominatim();

    @Valid
    private Overpass overpass = new Overpass();

    @Valid
    private RetrySettings retry = new RetrySettings();

    @Valid
    private Analysis analysis = new Analysis();

    private Map<String, Preset> presets = new LinkedHashMap<>();

    private Seeding seeding = new Seeding();

    /**
     * Base URL, courtesy interval between two requests and per-call timeout of one
     * external service.
     */
    @Getter
    @Setter
    public static class ServiceEndpoint {
        @NotBlank
        private String baseUrl;
        @NotNull
        private Duration minInterval;
        @NotNull
        private Duration timeout;

        public ServiceEndpoint() {
        }

        public ServiceEndpoint(String baseUrl, Duration minInterval, Duration timeout) {
            this.baseUrl = baseUrl;
            this.minInterval = minInterval;
            this.timeout = timeout;
        }
    }

    @Getter
    @Setter
    public static class Nominatim extends ServiceEndpoint {
        /** Appended to the district code to form the free-text query. */
        private String querySuffix = ", London, UK";
        @Min(1)
        private int resultLimit = 10;

        public Nominatim() {
            super("https://nominatim.openstreetmap.org", Duration.ofSeconds(2), Duration.ofSeconds(10));
        }
    }

    @Getter
    @Setter
    public static class Overpass extends ServiceEndpoint {
        /** Server-side query budget, written into the [timeout:n] header. */
        @Min(1)
        private int queryTimeoutSeconds = 180;

        public Overpass() {
            super("https://overpass-api.de/api", Duration.ofSeconds(1), Duration.ofSeconds(240));
        }
    }

    @Getter
    @Setter
    public static class RetrySettings {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseBackoff = Duration.ofSeconds(2);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);
        /** Fraction of each backoff randomly added or removed, 0 to 1. */
        private double jitter = 0.5;
    }

    @Getter
    @Setter
    public static class Analysis {
        @Min(1)
        private int defaultRadiusMeters = 900;
        private double defaultMaxAssignMeters = 200.0;
        @Min(1)
        private int topN = 3;
    }

    @Getter
    @Setter
    public static class Preset {
        private String label;
        private boolean includeAllShops;
        private List<String> shopTypes = new ArrayList<>();
        private List<String> amenities = new ArrayList<>();
        private List<String> propertySelectors = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Seeding {
        private boolean enabled;
        /** Spring resource location of a geocode JSON file, e.g. file:geocode_cache.json */
        private String geocodeFile = "classpath:geocode-seed.json";
    }
}
