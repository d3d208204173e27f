package io.b2mash.dashhub.integration.metric;

import io.b2mash.dashhub.integration.IntegrationConfig;

@FunctionalInterface
public interface MetricHandler {

  MetricResult fetch(IntegrationConfig config);
}
