package com.streetsignal.application.dto;

import com.streetsignal.domain.model.PoiFilter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Input for starting a job. Null numeric fields fall back to the configured
 * defaults; {@code customFilter} is only read for the "custom" preset.
 */
@Getter
@Builder
@AllArgsConstructor
public class StartJobCommand {
    private final List<String> districts;
    private final String preset;
    private final PoiFilter customFilter;
    private final Integer radiusMeters;
    private final Double maxAssignMeters;
    private final Integer topN;
}
