package io.b2mash.dashhub.integration.metric;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.error.UnknownMetricException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes metric ids to handlers. Built once per adapter; the metric list it exposes is the same
 * instance for the adapter's lifetime.
 */
public final class MetricDispatcher {

  private static final Logger log = LoggerFactory.getLogger(MetricDispatcher.class);

  private final String integrationType;
  private final Map<String, MetricHandler> handlers;
  private final List<MetricInfo> metrics;

  private MetricDispatcher(
      String integrationType, Map<String, MetricHandler> handlers, List<MetricInfo> metrics) {
    this.integrationType = integrationType;
    this.handlers = Collections.unmodifiableMap(handlers);
    this.metrics = List.copyOf(metrics);
  }

  public static Builder builder(String integrationType) {
    return new Builder(integrationType);
  }

  /**
   * Runs the handler for {@code metric}. Anything the handler throws is translated into a {@link
   * MetricResult.Failure}.
   *
   * @throws UnknownMetricException if no handler is registered for {@code metric}
   */
  public MetricResult dispatch(IntegrationConfig config, String metric) {
    var handler = handlers.get(metric);
    if (handler == null) {
      throw new UnknownMetricException(integrationType, metric, handlers.keySet());
    }
    try {
      return handler.fetch(config);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn(
          "{} metric '{}' failed for integration {}: {}",
          integrationType,
          metric,
          config.id(),
          error.getMessage());
      return MetricResult.failure(error);
    }
  }

  public List<MetricInfo> metrics() {
    return metrics;
  }

  public Set<String> metricIds() {
    return handlers.keySet();
  }

  public static final class Builder {

    private final String integrationType;
    private final Map<String, MetricHandler> handlers = new LinkedHashMap<>();
    private final List<MetricInfo> metrics = new ArrayList<>();

    private Builder(String integrationType) {
      this.integrationType = integrationType;
    }

    public Builder metric(MetricInfo info, MetricHandler handler) {
      if (handlers.putIfAbsent(info.id(), handler) != null) {
        throw new IllegalStateException(
            "Duplicate metric '" + info.id() + "' for " + integrationType);
      }
      metrics.add(info);
      return this;
    }

    public MetricDispatcher build() {
      return new MetricDispatcher(integrationType, handlers, metrics);
    }
  }
}
