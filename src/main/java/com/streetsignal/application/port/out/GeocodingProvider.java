package com.streetsignal.application.port.out;

import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;

import java.util.Optional;

/**
 * Output port for an external geocoding service.
 */
public interface GeocodingProvider {

  /**
   * Short provider name, recorded alongside cached coordinates.
   */
  String name();

  /**
   * Look up the centroid of a district.
   *
   * @return the centroid, or empty if the service does not know the district
   * @throws com.streetsignal.domain.exception.ExternalServiceException if the service cannot be reached
   * @throws com.streetsignal.domain.exception.GeocodeFailureException if the answer is ambiguous
   */
  Optional<Coordinate> lookup(District district);
}
