package com.streetsignal.application.port.in;

import com.streetsignal.application.dto.JobProgress;
import com.streetsignal.application.dto.JobSubmission;
import com.streetsignal.application.dto.StartJobCommand;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.JobState;

import java.util.List;
import java.util.Optional;

/**
 * Input port for driving a district batch one district at a time.
 * A single job is active at a time; starting a new one discards the old one.
 */
public interface ManageJobsUseCase {

  /**
   * Replace the active job with a new one.
   *
   * @throws com.streetsignal.domain.exception.InvalidJobSpecException on bad input
   */
  JobSubmission startJob(StartJobCommand command);

  /**
   * Process the next district of the active job. Blocks for the whole
   * district pipeline; a no-op once the job is completed.
   *
   * @throws com.streetsignal.domain.exception.NoActiveJobException when idle
   */
  JobProgress advanceJob();

  /**
   * Results of the active job in submission order.
   *
   * @throws com.streetsignal.domain.exception.NoActiveJobException when idle
   */
  List<DistrictResult> getResults();

  void resetJob();

  JobState getState();

  /**
   * Progress of the active job without advancing it.
   */
  Optional<JobProgress> getProgress();

  /**
   * Ranking depth of the active job, or the configured default when idle.
   */
  int getTopN();
}
