package com.hostwatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record ExportRequest(
    @NotBlank(message = "File name is required")
    @Pattern(regexp = ".*\\.json$", message = "File name must end with .json")
    String fileName
) {}
