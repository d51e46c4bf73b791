package com.hostwatch.dto;

public enum SchedulerState {
    IDLE,
    COLLECTING
}
