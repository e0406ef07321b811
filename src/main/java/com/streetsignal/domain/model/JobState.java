package com.streetsignal.domain.model;

public enum JobState {
    IDLE,
    RUNNING,
    COMPLETED
}
