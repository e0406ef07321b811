package com.streetsignal.application.service;

import com.streetsignal.application.dto.JobProgress;
import com.streetsignal.application.dto.JobSubmission;
import com.streetsignal.application.dto.StartJobCommand;
import com.streetsignal.application.port.in.ManageJobsUseCase;
import com.streetsignal.domain.exception.InvalidJobSpecException;
import com.streetsignal.domain.exception.NoActiveJobException;
import com.streetsignal.domain.model.AnalysisParameters;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.Job;
import com.streetsignal.domain.model.JobState;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single active job and drives it one district per call.
 *
 * States: IDLE (no job), RUNNING (districts left), COMPLETED (cursor at end).
 * Every operation runs under one fair lock, so two concurrent advance calls
 * can never race on the cursor and a reset waits for an in-flight advance.
 */
@Service
public class JobController implements ManageJobsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final DistrictProcessor districtProcessor;
    private final PresetCatalog presetCatalog;
    private final StreetSignalProperties.Analysis defaults;
    private final ReentrantLock lock = new ReentrantLock(true);

    private Job activeJob;

    public JobController(
        DistrictProcessor districtProcessor,
        PresetCatalog presetCatalog,
        StreetSignalProperties properties
    ) {
        this.districtProcessor = districtProcessor;
        this.presetCatalog = presetCatalog;
        this.defaults = properties.getAnalysis();
    }

    @Override
    public JobSubmission startJob(StartJobCommand command) {
        List<District> districts = normalize(command.getDistricts());
        if (districts.isEmpty()) {
            throw new InvalidJobSpecException("No valid districts provided");
        }
        AnalysisParameters parameters = toParameters(command);

        lock.lock();
        try {
            if (activeJob != null) {
                logger.info("Discarding job {} at {}/{}", activeJob.getId(), activeJob.getCursor(),
                    activeJob.getTotal());
            }
            activeJob = new Job(districts, parameters);
            logger.info("Started job {} with {} districts, parameters {}", activeJob.getId(), districts.size(),
                parameters);
            return new JobSubmission(activeJob.getId(), activeJob.getTotal());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public JobProgress advanceJob() {
        lock.lock();
        try {
            Job job = requireActiveJob();
            if (job.isCompleted()) {
                logger.debug("Job {} already completed, nothing to advance", job.getId());
                return progressOf(job, null);
            }

            District district = job.nextDistrict();
            logger.info("Job {}: processing district {} ({}/{})", job.getId(), district, job.getCursor() + 1,
                job.getTotal());
            DistrictResult result = districtProcessor.process(district, job.getParameters());
            job.record(result);

            if (job.isCompleted()) {
                logger.info("Job {} completed", job.getId());
            }
            return progressOf(job, result);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<DistrictResult> getResults() {
        lock.lock();
        try {
            return requireActiveJob().getResults();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resetJob() {
        lock.lock();
        try {
            if (activeJob != null) {
                logger.info("Reset job {}", activeJob.getId());
            }
            activeJob = null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public JobState getState() {
        lock.lock();
        try {
            return activeJob == null ? JobState.IDLE : activeJob.getState();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JobProgress> getProgress() {
        lock.lock();
        try {
            if (activeJob == null) {
                return Optional.empty();
            }
            List<DistrictResult> results = activeJob.getResults();
            DistrictResult latest = results.isEmpty() ? null : results.get(results.size() - 1);
            return Optional.of(progressOf(activeJob, latest));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getTopN() {
        lock.lock();
        try {
            return activeJob == null ? defaults.getTopN() : activeJob.getParameters().getTopN();
        } finally {
            lock.unlock();
        }
    }

    private Job requireActiveJob() {
        if (activeJob == null) {
            throw new NoActiveJobException();
        }
        return activeJob;
    }

    private JobProgress progressOf(Job job, DistrictResult latest) {
        return new JobProgress(job.getId(), job.isCompleted(), job.getCursor(), job.getTotal(), latest);
    }

    private List<District> normalize(List<String> rawDistricts) {
        if (rawDistricts == null) {
            return List.of();
        }
        return rawDistricts.stream()
            .filter(raw -> raw != null && !raw.isBlank())
            .map(District::of)
            .toList();
    }

    private AnalysisParameters toParameters(StartJobCommand command) {
        PoiFilter filter = presetCatalog.resolve(command.getPreset(), command.getCustomFilter());

        int radius = command.getRadiusMeters() != null ? command.getRadiusMeters() : defaults.getDefaultRadiusMeters();
        double maxAssign = command.getMaxAssignMeters() != null
            ? command.getMaxAssignMeters()
            : defaults.getDefaultMaxAssignMeters();
        int topN = command.getTopN() != null ? command.getTopN() : defaults.getTopN();

        if (radius <= 0) {
            throw new InvalidJobSpecException("Radius must be positive: " + radius);
        }
        if (!(maxAssign > 0)) {
            throw new InvalidJobSpecException("Max assignment distance must be positive: " + maxAssign);
        }
        if (topN <= 0) {
            throw new InvalidJobSpecException("topN must be positive: " + topN);
        }

        String preset = command.getPreset() == null || command.getPreset().isBlank()
            ? PresetCatalog.CUSTOM
            : command.getPreset().trim();
        return new AnalysisParameters(preset, filter, radius, maxAssign, topN);
    }
}
