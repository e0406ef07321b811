package com.streetsignal.application.port.out;

import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.Poi;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.domain.model.Street;

import java.util.List;

/**
 * Output port for the map database holding POIs and named streets.
 */
public interface PoiDataGateway {

  /**
   * Fetch POIs matching the filter within the radius.
   *
   * @throws com.streetsignal.domain.exception.ExternalServiceException on failure
   */
  List<Poi> fetchPois(Coordinate center, int radiusMeters, PoiFilter filter);

  /**
   * Fetch named highways within the radius.
   *
   * @throws com.streetsignal.domain.exception.ExternalServiceException on failure
   */
  List<Street> fetchStreets(Coordinate center, int radiusMeters);
}
