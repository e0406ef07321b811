package com.streetsignal.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Body of POST /jobs/start. {@code districts} accepts a single comma or
 * newline separated string as well as an array. Numeric fields are optional
 * but must be positive when given.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StartJobRequestDto {

    @JsonProperty("districts")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> districts;

    @JsonProperty("preset")
    private String preset;

    @JsonProperty("radiusM")
    @Positive(message = "Radius must be positive")
    private Integer radiusM;

    @JsonProperty("maxAssignM")
    @Positive(message = "Maximum assignment distance must be positive")
    private Double maxAssignM;

    @JsonProperty("topN")
    @Positive(message = "Top N must be positive")
    private Integer topN;

    @JsonProperty("includeAllShops")
    private Boolean includeAllShops;

    @JsonProperty("shopTypes")
    private List<String> shopTypes;

    @JsonProperty("amenities")
    private List<String> amenities;

    @JsonProperty("propertySelectors")
    private List<String> propertySelectors;
}
