package com.streetsignal.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Response of POST /jobs/step. {@code result} is omitted when the job was
 * already completed before the call.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceJobResponseDto {

    @JsonProperty("jobId")
    private UUID jobId;

    @JsonProperty("completed")
    private boolean completed;

    @JsonProperty("processed")
    private int processed;

    @JsonProperty("total")
    private int total;

    @JsonProperty("result")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private DistrictResultDto result;
}
