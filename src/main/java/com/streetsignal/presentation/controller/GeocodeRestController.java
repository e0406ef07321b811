package com.streetsignal.presentation.controller;

import com.streetsignal.api.dto.GeocodeResponseDto;
import com.streetsignal.application.service.GeocodeResolver;
import com.streetsignal.domain.exception.GeocodeFailureException;
import com.streetsignal.domain.model.Coordinate;
import com.streetsignal.domain.model.District;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Controller for standalone district geocoding, useful to check a district
 * before submitting a job.
 */
@RestController
@RequestMapping("/api/geocode")
public class GeocodeRestController {

    private static final Logger logger = LoggerFactory.getLogger(GeocodeRestController.class);

    private final GeocodeResolver geocodeResolver;

    public GeocodeRestController(GeocodeResolver geocodeResolver) {
        this.geocodeResolver = geocodeResolver;
    }

    /**
     * GET /api/geocode/district?district=E1
     *
     * @return centroid of the district, or 404 with the failure reason
     */
    @GetMapping("/district")
    public ResponseEntity<?> geocodeDistrict(@RequestParam("district") String rawDistrict) {
        District district = District.of(rawDistrict);
        logger.info("Geocoding district {}", district);

        try {
            Coordinate center = geocodeResolver.resolve(district);
            return ResponseEntity.ok(new GeocodeResponseDto(district.getCode(), center.getLat(), center.getLon()));
        } catch (GeocodeFailureException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("district", district.getCode());
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
    }
}
