package io.b2mash.dashhub.integration.metric;

import io.b2mash.dashhub.integration.error.IntegrationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Outcome of one metric fetch. Upstream failures are values here, not exceptions. */
public sealed interface MetricResult {

  static MetricResult success(Map<String, Object> data) {
    return new Success(data);
  }

  /** {@code Success} without warnings, {@code PartialSuccess} with them. */
  static MetricResult of(Map<String, Object> data, List<String> warnings) {
    return warnings.isEmpty() ? new Success(data) : new PartialSuccess(data, warnings);
  }

  static MetricResult failure(IntegrationException error) {
    return new Failure(error);
  }

  record Success(Map<String, Object> data) implements MetricResult {
    public Success {
      data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
  }

  record PartialSuccess(Map<String, Object> data, List<String> warnings) implements MetricResult {
    public PartialSuccess {
      data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
      warnings = List.copyOf(warnings);
    }
  }

  record Failure(IntegrationException error) implements MetricResult {}
}
