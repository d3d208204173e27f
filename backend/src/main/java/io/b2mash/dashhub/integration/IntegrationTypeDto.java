package io.b2mash.dashhub.integration;

import java.util.List;

public record IntegrationTypeDto(
    String type,
    String displayName,
    List<String> metrics,
    List<String> actions,
    boolean supportsCapabilities,
    int capabilityCount,
    int implementedCapabilityCount) {}
