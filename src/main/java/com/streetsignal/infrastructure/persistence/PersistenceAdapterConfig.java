package com.streetsignal.infrastructure.persistence;

import com.streetsignal.application.port.out.GeocodeEntryRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the JPA repository to the application's persistence port.
 */
@Configuration
public class PersistenceAdapterConfig {

    @Bean
    @Primary
    public GeocodeEntryRepository geocodeEntryRepository(GeocodeEntryJpaRepository jpaRepository) {
        return jpaRepository;
    }
}
