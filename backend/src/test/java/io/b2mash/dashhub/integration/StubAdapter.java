package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.util.List;
import java.util.Map;

/** Minimal adapter for registry and service tests. */
class StubAdapter implements IntegrationAdapter {

  private final String type;
  private final List<Capability> capabilities;

  StubAdapter(String type) {
    this(type, List.of());
  }

  StubAdapter(String type, List<Capability> capabilities) {
    this.type = type;
    this.capabilities = capabilities;
  }

  @Override
  public String type() {
    return type;
  }

  @Override
  public String displayName() {
    return "Stub " + type;
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    return ConnectionTestResult.success("ok", Map.of());
  }

  @Override
  public MetricResult getData(IntegrationConfig config, String metric) {
    return MetricResult.success(Map.of("metric", metric));
  }

  @Override
  public List<MetricInfo> getAvailableMetrics() {
    return List.of(new MetricInfo("status", "Status", "Stub status", List.of("stub-status")));
  }

  @Override
  public List<Capability> getApiCapabilities() {
    return capabilities;
  }

  /** Adapter that also performs actions. */
  static class Actionable extends StubAdapter implements ActionPerformer {

    Actionable(String type) {
      super(type);
    }

    @Override
    public List<String> supportedActions() {
      return List.of("restart");
    }

    @Override
    public ActionResult performAction(
        IntegrationConfig config, String action, Map<String, Object> params) {
      return ActionResult.success("Performed " + action);
    }
  }
}
