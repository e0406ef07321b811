package com.streetsignal.application.service;

import com.streetsignal.application.dto.JobProgress;
import com.streetsignal.application.dto.JobSubmission;
import com.streetsignal.application.dto.StartJobCommand;
import com.streetsignal.domain.exception.InvalidJobSpecException;
import com.streetsignal.domain.exception.NoActiveJobException;
import com.streetsignal.domain.model.AnalysisParameters;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.JobState;
import com.streetsignal.infrastructure.config.StreetSignalProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobControllerTest {

    private DistrictProcessor districtProcessor;
    private JobController jobController;

    @BeforeEach
    void setUp() {
        districtProcessor = mock(DistrictProcessor.class);
        when(districtProcessor.process(any(), any()))
            .thenAnswer(invocation -> DistrictResult.empty(invocation.getArgument(0)));

        StreetSignalProperties properties = new StreetSignalProperties();
        StreetSignalProperties.Preset shop = new StreetSignalProperties.Preset();
        shop.setIncludeAllShops(true);
        properties.getPresets().put("shop", shop);
        jobController = new JobController(districtProcessor, new PresetCatalog(properties), properties);
    }

    @Test
    void testStateMachine_IdleRunningCompleted() {
        assertThat(jobController.getState()).isEqualTo(JobState.IDLE);

        JobSubmission submission = jobController.startJob(command("E1", "sw1"));
        assertThat(submission.getTotalDistricts()).isEqualTo(2);
        assertThat(jobController.getState()).isEqualTo(JobState.RUNNING);

        JobProgress first = jobController.advanceJob();
        assertThat(first.getJobId()).isEqualTo(submission.getJobId());
        assertThat(first.isCompleted()).isFalse();
        assertThat(first.getProcessed()).isEqualTo(1);
        assertThat(first.getLatestResult().getDistrict().getCode()).isEqualTo("E1");

        JobProgress second = jobController.advanceJob();
        assertThat(second.isCompleted()).isTrue();
        assertThat(second.getProcessed()).isEqualTo(2);
        assertThat(jobController.getState()).isEqualTo(JobState.COMPLETED);

        jobController.resetJob();
        assertThat(jobController.getState()).isEqualTo(JobState.IDLE);
        assertThat(jobController.getProgress()).isEmpty();
    }

    @Test
    void testResults_LengthAlwaysEqualsCursor() {
        jobController.startJob(command("E1", "N1", "W1"));

        for (int step = 1; step <= 3; step++) {
            JobProgress progress = jobController.advanceJob();
            assertThat(jobController.getResults()).hasSize(progress.getProcessed());
        }
        assertThat(jobController.getResults())
            .extracting(result -> result.getDistrict().getCode())
            .containsExactly("E1", "N1", "W1");
    }

    @Test
    void testAdvance_WhenCompleted_IsNoOp() {
        jobController.startJob(command("E1"));
        jobController.advanceJob();

        JobProgress progress = jobController.advanceJob();

        assertThat(progress.isCompleted()).isTrue();
        assertThat(progress.latest()).isEmpty();
        assertThat(jobController.getResults()).hasSize(1);
        verify(districtProcessor, times(1)).process(any(), any());
    }

    @Test
    void testAdvance_WhenIdle_Throws() {
        assertThatThrownBy(() -> jobController.advanceJob()).isInstanceOf(NoActiveJobException.class);
        assertThatThrownBy(() -> jobController.getResults()).isInstanceOf(NoActiveJobException.class);
    }

    @Test
    void testAdvance_FailedDistrict_StillMovesCursor() {
        when(districtProcessor.process(any(), any()))
            .thenAnswer(invocation -> DistrictResult.failure(invocation.getArgument(0), "Could not geocode district: SW1"));
        jobController.startJob(command("SW1"));

        JobProgress progress = jobController.advanceJob();

        assertThat(progress.isCompleted()).isTrue();
        assertThat(progress.getLatestResult().isSuccess()).isFalse();
    }

    @Test
    void testStart_ReplacesPreviousJob() {
        JobSubmission first = jobController.startJob(command("E1", "N1"));
        jobController.advanceJob();

        JobSubmission second = jobController.startJob(command("W1"));

        assertThat(second.getJobId()).isNotEqualTo(first.getJobId());
        assertThat(jobController.getResults()).isEmpty();
        assertThat(jobController.getProgress().orElseThrow().getTotal()).isEqualTo(1);
    }

    @Test
    void testStart_AppliesConfiguredDefaults() {
        jobController.startJob(command("E1"));
        jobController.advanceJob();

        ArgumentCaptor<AnalysisParameters> captor = ArgumentCaptor.forClass(AnalysisParameters.class);
        verify(districtProcessor).process(any(District.class), captor.capture());
        assertThat(captor.getValue().getRadiusMeters()).isEqualTo(900);
        assertThat(captor.getValue().getMaxAssignMeters()).isEqualTo(200.0);
        assertThat(captor.getValue().getTopN()).isEqualTo(3);
        assertThat(jobController.getTopN()).isEqualTo(3);
    }

    @Test
    void testStart_InvalidSpecs_Rejected() {
        assertThatThrownBy(() -> jobController.startJob(command()))
            .isInstanceOf(InvalidJobSpecException.class);
        assertThatThrownBy(() -> jobController.startJob(command(" ", "")))
            .isInstanceOf(InvalidJobSpecException.class);
        assertThatThrownBy(() -> jobController.startJob(StartJobCommand.builder()
                .districts(List.of("E1")).preset("nonexistent").build()))
            .isInstanceOf(InvalidJobSpecException.class);
        assertThatThrownBy(() -> jobController.startJob(StartJobCommand.builder()
                .districts(List.of("E1")).preset("shop").radiusMeters(0).build()))
            .isInstanceOf(InvalidJobSpecException.class);
        assertThatThrownBy(() -> jobController.startJob(StartJobCommand.builder()
                .districts(List.of("E1")).preset("shop").maxAssignMeters(-5.0).build()))
            .isInstanceOf(InvalidJobSpecException.class);
        assertThatThrownBy(() -> jobController.startJob(StartJobCommand.builder()
                .districts(List.of("E1")).preset("shop").topN(0).build()))
            .isInstanceOf(InvalidJobSpecException.class);

        assertThat(jobController.getState()).isEqualTo(JobState.IDLE);
    }

    @Test
    void testAdvance_ConcurrentCalls_ProcessEachDistrictOnce() throws Exception {
        jobController.startJob(command("E1", "E2", "E3", "E4", "E5", "E6"));
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<JobProgress>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return jobController.advanceJob();
                }));
            }
            start.countDown();
            for (Future<JobProgress> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(jobController.getResults())
            .extracting(result -> result.getDistrict().getCode())
            .containsExactly("E1", "E2", "E3", "E4", "E5", "E6");
        verify(districtProcessor, times(6)).process(any(), any());
    }

    private static StartJobCommand command(String... districts) {
        return StartJobCommand.builder()
            .districts(Arrays.asList(districts))
            .preset("shop")
            .build();
    }
}
