package com.streetsignal.infrastructure.persistence;

import com.streetsignal.application.port.out.GeocodeEntryRepository;
import com.streetsignal.domain.model.GeocodeEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA implementation of GeocodeEntryRepository output port.
 * Keyed by the normalized district code.
 */
@Repository
public interface GeocodeEntryJpaRepository
        extends JpaRepository<GeocodeEntry, String>, GeocodeEntryRepository {
}
