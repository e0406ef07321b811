package com.streetsignal.domain.model;

import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Batch of districts processed one at a time. Not thread-safe: every mutation
 * goes through the job controller's lock.
 */
@Getter
public class Job {
    private final UUID id;
    private final List<District> districts;
    private final AnalysisParameters parameters;
    private final OffsetDateTime createdAt;
    private final List<DistrictResult> results = new ArrayList<>();

    public Job(List<District> districts, AnalysisParameters parameters) {
        if (districts == null || districts.isEmpty()) {
            throw new IllegalArgumentException("A job needs at least one district");
        }
        this.id = UUID.randomUUID();
        this.districts = List.copyOf(districts);
        this.parameters = parameters;
        this.createdAt = OffsetDateTime.now();
    }

    public int getCursor() {
        return results.size();
    }

    public int getTotal() {
        return districts.size();
    }

    public boolean isCompleted() {
        return getCursor() == getTotal();
    }

    public JobState getState() {
        return isCompleted() ? JobState.COMPLETED : JobState.RUNNING;
    }

    /**
     * @throws IllegalStateException if every district has been processed
     */
    public District nextDistrict() {
        if (isCompleted()) {
            throw new IllegalStateException("Job " + id + " has no remaining districts");
        }
        return districts.get(getCursor());
    }

    /**
     * Appends the result for {@link #nextDistrict()} and moves the cursor.
     */
    public void record(DistrictResult result) {
        District expected = nextDistrict();
        if (!expected.equals(result.getDistrict())) {
            throw new IllegalStateException("Result for " + result.getDistrict() + " recorded while " + expected
                + " was expected");
        }
        results.add(result);
    }

    public List<DistrictResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }
}
