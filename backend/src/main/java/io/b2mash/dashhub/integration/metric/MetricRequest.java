package io.b2mash.dashhub.integration.metric;

import java.util.Map;

/** A metric fetch for one configured instance. {@code params} override instance options. */
public record MetricRequest(String integrationId, String metricName, Map<String, String> params) {

  public MetricRequest {
    params = params == null ? Map.of() : Map.copyOf(params);
  }
}
