package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.util.List;

/**
 * Uniform contract every upstream service adapter implements. Adapters are Spring beans discovered
 * by {@link IntegrationRegistry}; optional operations live in {@link ActionPerformer} and {@link
 * CapabilityExecutor}.
 */
public interface IntegrationAdapter {

  /** Unique type key, e.g. {@code "gitea"}. Matches {@code IntegrationConfig.type()}. */
  String type();

  String displayName();

  /** One lightweight authenticated call. Never throws; failures come back as a result. */
  ConnectionTestResult testConnection(IntegrationConfig config);

  /**
   * Fetches one metric. Upstream failures are returned as {@link MetricResult.Failure}.
   *
   * @throws io.b2mash.dashhub.integration.error.UnknownMetricException for an unknown metric id
   */
  MetricResult getData(IntegrationConfig config, String metric);

  /** Pure; returns the same list on every call. */
  List<MetricInfo> getAvailableMetrics();

  /** Pure; returns the same list on every call. */
  List<Capability> getApiCapabilities();
}
