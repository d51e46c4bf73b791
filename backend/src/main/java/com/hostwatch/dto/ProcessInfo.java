package com.hostwatch.dto;

public record ProcessInfo(
    int pid,
    String name,
    String username,
    double memoryPercent
) {
    public ProcessInfo {
        if (username == null) username = "";
    }
}
