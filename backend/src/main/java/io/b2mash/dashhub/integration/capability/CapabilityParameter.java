package io.b2mash.dashhub.integration.capability;

public record CapabilityParameter(String name, String type, boolean required, String description) {}
