package com.streetsignal.application.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

@Getter
@ToString
@AllArgsConstructor
public class JobSubmission {
    private final UUID jobId;
    private final int totalDistricts;
}
