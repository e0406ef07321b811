package com.streetsignal.application.mapper;

import com.streetsignal.api.dto.AdvanceJobResponseDto;
import com.streetsignal.api.dto.DistrictResultDto;
import com.streetsignal.api.dto.PresetDto;
import com.streetsignal.api.dto.StartJobRequestDto;
import com.streetsignal.api.dto.StartJobResponseDto;
import com.streetsignal.api.dto.StreetCountDto;
import com.streetsignal.application.dto.JobProgress;
import com.streetsignal.application.dto.JobSubmission;
import com.streetsignal.application.dto.StartJobCommand;
import com.streetsignal.domain.model.District;
import com.streetsignal.domain.model.DistrictResult;
import com.streetsignal.domain.model.PoiFilter;
import com.streetsignal.domain.model.StreetCount;
import com.streetsignal.infrastructure.config.StreetSignalProperties.Preset;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Mapper between the REST DTOs and the job use case types.
 */
@Component
public class JobMapper {

  /**
   * Maps a start request to a command. Each districts entry may itself hold
   * several comma or newline separated codes. Filter fields are only turned
   * into a custom filter when at least one of them is present.
   */
  public StartJobCommand toCommand(StartJobRequestDto request) {
    List<String> districts = request.getDistricts() == null
        ? List.of()
        : request.getDistricts().stream()
            .flatMap(entry -> District.parseList(entry).stream())
            .map(District::getCode)
            .toList();

    return StartJobCommand.builder()
        .districts(districts)
        .preset(request.getPreset())
        .customFilter(toCustomFilter(request))
        .radiusMeters(request.getRadiusM())
        .maxAssignMeters(request.getMaxAssignM())
        .topN(request.getTopN())
        .build();
  }

  public StartJobResponseDto toDto(JobSubmission submission) {
    return new StartJobResponseDto(
        submission.getJobId(),
        submission.getTotalDistricts(),
        "Job started with " + submission.getTotalDistricts() + " districts");
  }

  public AdvanceJobResponseDto toDto(JobProgress progress) {
    return new AdvanceJobResponseDto(
        progress.getJobId(),
        progress.isCompleted(),
        progress.getProcessed(),
        progress.getTotal(),
        progress.latest().map(this::toDto).orElse(null));
  }

  public DistrictResultDto toDto(DistrictResult result) {
    return new DistrictResultDto(
        result.getDistrict().getCode(),
        result.isSuccess(),
        result.getError(),
        result.getTotalPois(),
        result.getTotalStreets(),
        toDtos(result.getTopStreets()),
        toDtos(result.getAllStreets()));
  }

  public List<PresetDto> toDtos(Map<String, Preset> presets) {
    return presets.entrySet().stream()
        .map(entry -> new PresetDto(
            entry.getKey(),
            entry.getValue().getLabel(),
            entry.getValue().isIncludeAllShops(),
            entry.getValue().getShopTypes(),
            entry.getValue().getAmenities(),
            entry.getValue().getPropertySelectors()))
        .toList();
  }

  private List<StreetCountDto> toDtos(List<StreetCount> counts) {
    return counts.stream()
        .map(count -> new StreetCountDto(count.getName(), count.getCount()))
        .toList();
  }

  private PoiFilter toCustomFilter(StartJobRequestDto request) {
    if (request.getIncludeAllShops() == null
        && request.getShopTypes() == null
        && request.getAmenities() == null
        && request.getPropertySelectors() == null) {
      return null;
    }
    return new PoiFilter(
        Boolean.TRUE.equals(request.getIncludeAllShops()),
        request.getShopTypes(),
        request.getAmenities(),
        request.getPropertySelectors());
  }
}
