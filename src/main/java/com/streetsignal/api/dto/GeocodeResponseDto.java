package com.streetsignal.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GeocodeResponseDto {

    @JsonProperty("district")
    private String district;

    @JsonProperty("lat")
    private double lat;

    @JsonProperty("lon")
    private double lon;
}
