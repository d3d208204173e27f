package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.error.IntegrationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared result record for testing connectivity to an upstream service. {@code category} is set
 * only on failure.
 */
public record ConnectionTestResult(
    boolean success, String message, ErrorCategory category, Map<String, Object> details) {

  public ConnectionTestResult {
    details =
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static ConnectionTestResult success(String message, Map<String, Object> details) {
    return new ConnectionTestResult(true, message, null, details);
  }

  public static ConnectionTestResult failure(IntegrationException error) {
    var details = new LinkedHashMap<String, Object>();
    if (error.getReason() != null) {
      details.put("reason", error.getReason());
    }
    return new ConnectionTestResult(false, error.getMessage(), error.getCategory(), details);
  }
}
