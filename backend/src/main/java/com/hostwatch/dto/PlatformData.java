package com.hostwatch.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

public record PlatformData(
    String system,
    String release,
    String version,
    String machine,
    String processor,
    Architecture architecture,
    String runtimeVersion
) {
    /**
     * Bit width ("64bit") and executable linkage format ("ELF", "WindowsPE", ...),
     * written as a two-element array.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    public record Architecture(String bits, String linkage) {}
}
