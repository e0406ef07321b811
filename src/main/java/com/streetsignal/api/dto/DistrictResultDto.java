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
public class DistrictResultDto {

    @JsonProperty("district")
    private String district;

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("error")
    private String error;

    @JsonProperty("totalPois")
    private int totalPois;

    @JsonProperty("totalStreets")
    private int totalStreets;

    @JsonProperty("topStreets")
    private List<StreetCountDto> topStreets;

    @JsonProperty("allStreets")
    private List<StreetCountDto> allStreets;
}
