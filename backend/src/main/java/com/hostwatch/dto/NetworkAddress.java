package com.hostwatch.dto;

public record NetworkAddress(
    String address,
    String netmask,
    String family
) {
    public static final String AF_INET = "AF_INET";
    public static final String AF_INET6 = "AF_INET6";
    public static final String AF_LINK = "AF_LINK";
}
