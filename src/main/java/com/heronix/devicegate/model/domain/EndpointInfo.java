package com.heronix.devicegate.model.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where a device says it can be reached, plus its descriptive attributes.
 */
public record EndpointInfo(
        String address,
        int port,
        Map<String, Object> metadata
) {

    public static final int DEFAULT_PORT = 80;

    public EndpointInfo {
        metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public static EndpointInfo of(String address, Integer port, Map<String, Object> metadata) {
        return new EndpointInfo(address, port == null ? DEFAULT_PORT : port, metadata);
    }
}
