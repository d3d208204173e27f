package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricRequest;
import io.b2mash.dashhub.integration.metric.MetricResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {

  private final IntegrationService integrationService;
  private final Clock clock;

  public IntegrationController(IntegrationService integrationService, Clock clock) {
    this.integrationService = integrationService;
    this.clock = clock;
  }

  @GetMapping
  public ResponseEntity<List<IntegrationInstanceDto>> listIntegrations() {
    return ResponseEntity.ok(integrationService.listInstances());
  }

  @GetMapping("/types")
  public ResponseEntity<List<IntegrationTypeDto>> listTypes() {
    return ResponseEntity.ok(integrationService.listTypes());
  }

  @GetMapping("/types/{type}/metrics")
  public ResponseEntity<List<MetricInfo>> listMetrics(@PathVariable String type) {
    return ResponseEntity.ok(integrationService.metricsFor(type));
  }

  @GetMapping("/types/{type}/capabilities")
  public ResponseEntity<List<Capability>> listCapabilities(@PathVariable String type) {
    return ResponseEntity.ok(integrationService.capabilitiesFor(type));
  }

  @PostMapping("/{id}/test")
  public ResponseEntity<ConnectionTestResult> testConnection(@PathVariable String id) {
    return ResponseEntity.ok(integrationService.testConnection(id));
  }

  /** Failures are rendered as problem details by the global exception handler. */
  @GetMapping("/{id}/data/{metric}")
  public ResponseEntity<MetricResponse> getData(
      @PathVariable String id,
      @PathVariable String metric,
      @RequestParam Map<String, String> params) {
    var result = integrationService.getData(new MetricRequest(id, metric, params));
    if (result instanceof MetricResult.Failure failure) {
      throw failure.error();
    }
    return ResponseEntity.ok(MetricResponse.from(id, metric, result, clock.instant()));
  }

  @PostMapping("/{id}/action")
  public ResponseEntity<ActionResult> performAction(
      @PathVariable String id, @Valid @RequestBody ActionRequest request) {
    return ResponseEntity.ok(
        integrationService.performAction(id, request.action(), paramsOf(request.params())));
  }

  @PostMapping("/{id}/capability")
  public ResponseEntity<CapabilityExecutionResult> executeCapability(
      @PathVariable String id, @Valid @RequestBody CapabilityRequest request) {
    return ResponseEntity.ok(
        integrationService.executeCapability(
            id,
            request.capabilityId(),
            request.method(),
            request.endpoint(),
            paramsOf(request.params())));
  }

  @DeleteMapping("/{id}/credentials")
  public ResponseEntity<Void> invalidateCredentials(@PathVariable String id) {
    integrationService.invalidateCredentials(id);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/credentials")
  public ResponseEntity<Map<String, Long>> invalidateAllCredentials() {
    return ResponseEntity.ok(Map.of("dropped", integrationService.invalidateAllCredentials()));
  }

  private static Map<String, Object> paramsOf(Map<String, Object> params) {
    return params != null ? params : Map.of();
  }

  // --- DTOs ---

  public record ActionRequest(
      @NotBlank(message = "action must not be blank") String action, Map<String, Object> params) {}

  public record CapabilityRequest(
      @NotBlank(message = "capabilityId must not be blank") String capabilityId,
      @NotNull(message = "method is required") CapabilityMethod method,
      String endpoint,
      Map<String, Object> params) {}

  public record MetricResponse(
      String integrationId,
      String metric,
      String status,
      Map<String, Object> data,
      List<String> warnings,
      Instant fetchedAt) {

    static MetricResponse from(
        String integrationId, String metric, MetricResult result, Instant fetchedAt) {
      if (result instanceof MetricResult.PartialSuccess partial) {
        return new MetricResponse(
            integrationId, metric, "PARTIAL", partial.data(), partial.warnings(), fetchedAt);
      }
      var success = (MetricResult.Success) result;
      return new MetricResponse(
          integrationId, metric, "SUCCESS", success.data(), List.of(), fetchedAt);
    }
  }
}
