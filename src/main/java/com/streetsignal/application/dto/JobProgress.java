package com.streetsignal.application.dto;

import com.streetsignal.domain.model.DistrictResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of one advance call. {@code latestResult} is null when the call was
 * a no-op on an already completed job.
 */
@Getter
@ToString
@AllArgsConstructor
public class JobProgress {
    private final UUID jobId;
    private final boolean completed;
    private final int processed;
    private final int total;
    private final DistrictResult latestResult;

    public Optional<DistrictResult> latest() {
        return Optional.ofNullable(latestResult);
    }
}
