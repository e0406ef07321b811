package com.streetsignal.application.service;

import com.streetsignal.application.port.out.PoiDataGateway;
import com.streetsignal.domain.exception.ExternalServiceException;
import com.streetsignal.domain.exception.GeocodeFailureException;
import com.streetsignal.domain.model.AnalysisParameters;
import com.streetsignal.domain.model.Attribution;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.Poi;
import com.streetsignal.domain.model.Street;
import com.streetsignal.domain.model.StreetRanking;
import com.streetsignal.domain.service.StreetAttributor;
import com.streetsignal.domain.service.StreetRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the full pipeline for one district:
 * geocode, fetch POIs, fetch streets, attribute, rank.
 *
 * Never throws. Every failure becomes a failed {@link DistrictResult} so a
 * batch keeps moving when single districts fail.
 */
@Service
public class DistrictProcessor {

    private static final Logger logger = LoggerFactory.getLogger(DistrictProcessor.class);

    private final GeocodeResolver geocodeResolver;
    private final PoiDataGateway poiDataGateway;
    private final StreetAttributor streetAttributor;
    private final StreetRanker streetRanker;

    public DistrictProcessor(
        GeocodeResolver geocodeResolver,
        PoiDataGateway poiDataGateway,
        StreetAttributor streetAttributor,
        StreetRanker streetRanker
    ) {
        this.geocodeResolver = geocodeResolver;
        this.poiDataGateway = poiDataGateway;
        this.streetAttributor = streetAttributor;
        this.streetRanker = streetRanker;
    }

    public DistrictResult process(District district, AnalysisParameters parameters) {
        long startedAt = System.currentTimeMillis();
        try {
            DistrictResult result = runPipeline(district, parameters);
            logger.info("Processed district {} in {} ms: {} POIs, {} streets",
                district, System.currentTimeMillis() - startedAt, result.getTotalPois(), result.getTotalStreets());
            return result;
        } catch (GeocodeFailureException e) {
            logger.warn("Geocoding failed for district {}: {}", district, e.getMessage());
            return DistrictResult.failure(district, e.getMessage());
        } catch (ExternalServiceException e) {
            logger.warn("External service failure for district {}: {}", district, e.getMessage());
            return DistrictResult.failure(district, "External service failure: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error while processing district {}", district, e);
            return DistrictResult.failure(district, "Unexpected error while processing district " + district);
        }
    }

    private DistrictResult runPipeline(District district, AnalysisParameters parameters) {
        // Step 1: Geocode district
        Coordinate center = geocodeResolver.resolve(district);

        // Step 2: Fetch POIs, dropping those whose postcode lies in another district
        List<Poi> fetched = poiDataGateway.fetchPois(center, parameters.getRadiusMeters(), parameters.getFilter());
        List<Poi> pois = fetched.stream()
            .filter(poi -> poi.getPostcode().map(district::matchesPostcode).orElse(true))
            .toList();
        if (pois.size() < fetched.size()) {
            logger.debug("Dropped {} POIs outside district {}", fetched.size() - pois.size(), district);
        }
        if (pois.isEmpty()) {
            logger.info("No POIs found for district {}, skipping street query", district);
            return DistrictResult.empty(district);
        }

        // Step 3: Fetch named streets
        List<Street> streets = poiDataGateway.fetchStreets(center, parameters.getRadiusMeters());

        // Step 4: Attribute POIs to streets
        List<Attribution> attributions = streetAttributor.attribute(pois, streets, parameters.getMaxAssignMeters());

        // Step 5: Rank streets
        StreetRanking ranking = streetRanker.rank(attributions, parameters.getTopN());
        return DistrictResult.success(district, ranking);
    }
}
