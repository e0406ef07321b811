package com.streetsignal.presentation.controller;

import com.streetsignal.api.dto.AdvanceJobResponseDto;
import com.streetsignal.api.dto.DistrictResultDto;
import com.streetsignal.api.dto.MessageResponseDto;
import com.streetsignal.api.dto.PresetDto;
import com.streetsignal.api.dto.StartJobRequestDto;
import com.streetsignal.api.dto.StartJobResponseDto;
import com.streetsignal.application.dto.JobProgress;
import com.streetsignal.application.dto.JobSubmission;
import com.streetsignal.application.mapper.JobMapper;
import com.streetsignal.application.port.in.ManageJobsUseCase;
import com.streetsignal.application.service.PresetCatalog;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.infrastructure.export.ResultCsvExporter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Controller for the stepwise district job.
 * The client starts a job, then calls /step once per district until the
 * response reports completion.
 */
@RestController
@RequestMapping("/jobs")
public class JobRestController {

    private static final Logger logger = LoggerFactory.getLogger(JobRestController.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ManageJobsUseCase manageJobsUseCase;
    private final PresetCatalog presetCatalog;
    private final JobMapper jobMapper;
    private final ResultCsvExporter csvExporter;

    public JobRestController(
        ManageJobsUseCase manageJobsUseCase,
        PresetCatalog presetCatalog,
        JobMapper jobMapper,
        ResultCsvExporter csvExporter
    ) {
        this.manageJobsUseCase = manageJobsUseCase;
        this.presetCatalog = presetCatalog;
        this.jobMapper = jobMapper;
        this.csvExporter = csvExporter;
    }

    /**
     * POST /jobs/start
     *
     * Replaces any previous job. Omitted numeric parameters fall back to the
     * configured defaults.
     */
    @PostMapping("/start")
    public ResponseEntity<StartJobResponseDto> startJob(@Valid @RequestBody StartJobRequestDto request) {
        logger.info("Start job request: districts={}, preset={}", request.getDistricts(), request.getPreset());

        JobSubmission submission = manageJobsUseCase.startJob(jobMapper.toCommand(request));
        return ResponseEntity.ok(jobMapper.toDto(submission));
    }

    /**
     * POST /jobs/step
     *
     * Processes exactly one district. Blocks while the external services are
     * queried, which can take minutes for a large district.
     */
    @PostMapping("/step")
    public ResponseEntity<AdvanceJobResponseDto> advanceJob() {
        JobProgress progress = manageJobsUseCase.advanceJob();
        return ResponseEntity.ok(jobMapper.toDto(progress));
    }

    @GetMapping("/results")
    public ResponseEntity<List<DistrictResultDto>> getResults() {
        List<DistrictResultDto> results = manageJobsUseCase.getResults().stream()
            .map(jobMapper::toDto)
            .toList();
        return ResponseEntity.ok(results);
    }

    /**
     * GET /jobs/download
     *
     * CSV export of the results so far, named after the current local time.
     */
    @GetMapping("/download")
    public ResponseEntity<?> download() {
        List<DistrictResult> results = manageJobsUseCase.getResults();
        if (results.isEmpty()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "NO_RESULTS", "message", "No results to download"));
        }

        String csv = csvExporter.export(results, manageJobsUseCase.getTopN());
        String filename = "street_signal_" + LocalDateTime.now().format(FILE_TIMESTAMP) + ".csv";
        logger.info("Exporting {} results as {}", results.size(), filename);

        return ResponseEntity.ok()
            .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
            .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    @PostMapping("/reset")
    public ResponseEntity<MessageResponseDto> resetJob() {
        manageJobsUseCase.resetJob();
        return ResponseEntity.ok(new MessageResponseDto("Job reset"));
    }

    @GetMapping("/presets")
    public ResponseEntity<List<PresetDto>> getPresets() {
        return ResponseEntity.ok(jobMapper.toDtos(presetCatalog.getPresets()));
    }
}
