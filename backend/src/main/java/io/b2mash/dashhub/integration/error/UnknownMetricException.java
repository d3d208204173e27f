package io.b2mash.dashhub.integration.error;

import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpStatus;

public class UnknownMetricException extends IntegrationException {

  private final String metric;
  private final List<String> validMetrics;

  public UnknownMetricException(String integrationType, String metric, Collection<String> valid) {
    super(
        HttpStatus.BAD_REQUEST,
        ErrorCategory.UNKNOWN_METRIC,
        "Unknown metric",
        "Unknown metric '"
            + metric
            + "' for "
            + integrationType
            + ". Valid metrics: "
            + String.join(", ", valid),
        null);
    this.metric = metric;
    this.validMetrics = List.copyOf(valid);
    getBody().setProperty("validMetrics", validMetrics);
  }

  public String metric() {
    return metric;
  }

  public List<String> validMetrics() {
    return validMetrics;
  }
}
