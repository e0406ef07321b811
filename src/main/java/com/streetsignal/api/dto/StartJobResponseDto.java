package com.streetsignal.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StartJobResponseDto {

    @JsonProperty("jobId")
    private UUID jobId;

    @JsonProperty("totalDistricts")
    private int totalDistricts;

    @JsonProperty("message")
    private String message;
}
