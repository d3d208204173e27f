package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.capability.CapabilityRegistry;
import io.b2mash.dashhub.integration.error.IntegrationDisabledException;
import io.b2mash.dashhub.integration.error.IntegrationNotFoundException;
import io.b2mash.dashhub.integration.error.UnknownActionException;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricRequest;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates configured integration instances: connection testing, metric fetches, actions,
 * capability invocation and credential cache management.
 */
@Service
public class IntegrationService {

  private static final Logger log = LoggerFactory.getLogger(IntegrationService.class);

  private final IntegrationConfigStore configStore;
  private final IntegrationRegistry integrationRegistry;
  private final CapabilityRegistry capabilityRegistry;
  private final CredentialManager credentialManager;

  public IntegrationService(
      IntegrationConfigStore configStore,
      IntegrationRegistry integrationRegistry,
      CapabilityRegistry capabilityRegistry,
      CredentialManager credentialManager) {
    this.configStore = configStore;
    this.integrationRegistry = integrationRegistry;
    this.capabilityRegistry = capabilityRegistry;
    this.credentialManager = credentialManager;
  }

  /** Lists every configured instance, flagging those whose type has no registered adapter. */
  public List<IntegrationInstanceDto> listInstances() {
    var types = integrationRegistry.availableTypes();
    return configStore.findAll().stream()
        .map(config -> IntegrationInstanceDto.from(config, types.contains(config.type())))
        .toList();
  }

  public List<IntegrationTypeDto> listTypes() {
    return integrationRegistry.adapters().stream().map(this::describe).toList();
  }

  public List<MetricInfo> metricsFor(String type) {
    return integrationRegistry.resolve(type).getAvailableMetrics();
  }

  public List<Capability> capabilitiesFor(String type) {
    return capabilityRegistry.capabilitiesFor(type);
  }

  /**
   * Tests connectivity of a configured instance. Disabled instances may still be tested so they
   * can be checked before being switched on.
   */
  public ConnectionTestResult testConnection(String integrationId) {
    var config = findConfig(integrationId);
    var result = integrationRegistry.resolve(config.type()).testConnection(config);
    log.info(
        "Connection test for {} integration {}: success={}{}",
        config.type(),
        config.id(),
        result.success(),
        result.success() ? "" : ", category=" + result.category());
    return result;
  }

  /**
   * Fetches one metric. Request params override the instance's options for this call only.
   *
   * @throws io.b2mash.dashhub.integration.error.UnknownMetricException for an unknown metric id
   */
  public MetricResult getData(MetricRequest request) {
    var config = findEnabledConfig(request.integrationId()).withOptionOverrides(request.params());
    return integrationRegistry.resolve(config.type()).getData(config, request.metricName());
  }

  public ActionResult performAction(
      String integrationId, String action, Map<String, Object> params) {
    var config = findEnabledConfig(integrationId);
    var result =
        integrationRegistry
            .resolveExtension(config.type(), ActionPerformer.class)
            .map(performer -> performer.performAction(config, action, params))
            .orElseGet(
                () ->
                    ActionResult.failure(
                        new UnknownActionException(config.type(), action, List.of())));
    log.info(
        "Action '{}' on {} integration {}: success={}",
        action,
        config.type(),
        config.id(),
        result.success());
    return result;
  }

  /** Invokes a cataloged capability and reports how long the upstream round trip took. */
  public CapabilityExecutionResult executeCapability(
      String integrationId,
      String capabilityId,
      CapabilityMethod method,
      String endpoint,
      Map<String, Object> params) {
    var config = findEnabledConfig(integrationId);
    var executor =
        integrationRegistry.resolveExtension(config.type(), CapabilityExecutor.class);
    if (executor.isEmpty()) {
      return CapabilityExecutionResult.failure(
          config.type() + " does not support capability execution");
    }
    long started = System.nanoTime();
    var result =
        executor.get().executeCapability(config, capabilityId, method, endpoint, params);
    long durationMs = (System.nanoTime() - started) / 1_000_000;
    log.debug(
        "Capability {} on integration {} finished in {} ms: success={}",
        capabilityId,
        config.id(),
        durationMs,
        result.success());
    return result.withDuration(durationMs);
  }

  /** Drops the cached credential of one instance; the next call authenticates again. */
  public void invalidateCredentials(String integrationId) {
    var config = findConfig(integrationId);
    credentialManager.invalidate(config);
    log.info("Dropped cached credentials for integration {}", config.id());
  }

  /** Drops every cached credential and returns how many entries were held. */
  public long invalidateAllCredentials() {
    long held = credentialManager.cachedCredentials();
    credentialManager.invalidateAll();
    log.info("Dropped all cached integration credentials ({} entries)", held);
    return held;
  }

  private IntegrationConfig findConfig(String integrationId) {
    return configStore
        .findById(integrationId)
        .orElseThrow(() -> IntegrationNotFoundException.instance(integrationId));
  }

  private IntegrationConfig findEnabledConfig(String integrationId) {
    var config = findConfig(integrationId);
    if (!config.enabled()) {
      throw new IntegrationDisabledException(integrationId);
    }
    return config;
  }

  private IntegrationTypeDto describe(IntegrationAdapter adapter) {
    var summary = capabilityRegistry.summary(adapter.type());
    return new IntegrationTypeDto(
        adapter.type(),
        adapter.displayName(),
        adapter.getAvailableMetrics().stream().map(MetricInfo::id).toList(),
        adapter instanceof ActionPerformer performer ? performer.supportedActions() : List.of(),
        adapter instanceof CapabilityExecutor,
        summary.total(),
        summary.implemented());
  }
}
