package com.streetsignal.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PresetDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("label")
    private String label;

    @JsonProperty("includeAllShops")
    private boolean includeAllShops;

    @JsonProperty("shopTypes")
    private List<String> shopTypes;

    @JsonProperty("amenities")
    private List<String> amenities;

    @JsonProperty("propertySelectors")
    private List<String> propertySelectors;
}
