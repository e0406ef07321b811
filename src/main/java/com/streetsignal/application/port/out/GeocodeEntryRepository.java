package com.streetsignal.application.port.out;

import com.streetsignal.domain.model.GeocodeEntry;

import java.util.List;
import java.util.Optional;

/**
 * Output port for the durable geocode cache.
 */
public interface GeocodeEntryRepository {

  Optional<GeocodeEntry> findById(String district);

  boolean existsById(String district);

  GeocodeEntry save(GeocodeEntry entry);

  List<GeocodeEntry> findAll();

  long count();
}
