package com.hostwatch.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record NetworkData(
    String hostname,
    String ipAddress,
    String macAddress,
    Map<String, List<NetworkAddress>> networkInterfaces
) {
    public NetworkData {
        // keeps OS enumeration order
        Map<String, List<NetworkAddress>> copy = new LinkedHashMap<>();
        if (networkInterfaces != null) {
            networkInterfaces.forEach((name, addresses) -> copy.put(name, List.copyOf(addresses)));
        }
        networkInterfaces = Collections.unmodifiableMap(copy);
    }
}
