package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.error.ConfigurationException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Everything an adapter needs to reach one configured upstream instance. Immutable; per-request
 * overrides produce a copy via {@link #withOptionOverrides(Map)}.
 */
public record IntegrationConfig(
    String id,
    String type,
    String name,
    String host,
    Integer port,
    boolean verifySsl,
    Duration timeout,
    boolean enabled,
    IntegrationCredentials credentials,
    Map<String, String> options) {

  public IntegrationConfig {
    options = options == null ? Map.of() : Map.copyOf(options);
  }

  public String requireHost() {
    if (host == null || host.isBlank()) {
      throw new ConfigurationException(id, "host is required for " + type);
    }
    return host.trim();
  }

  /**
   * Base URL for the instance. A host that already carries a scheme is used as given (with the
   * configured port appended when present); a bare host gets {@code defaultScheme} and the port or
   * {@code defaultPort}.
   */
  public String baseUrl(String defaultScheme, int defaultPort) {
    var configuredHost = stripTrailingSlash(requireHost());
    if (configuredHost.startsWith("http://") || configuredHost.startsWith("https://")) {
      return port == null ? configuredHost : configuredHost + ":" + port;
    }
    return defaultScheme + "://" + configuredHost + ":" + (port != null ? port : defaultPort);
  }

  public <T extends IntegrationCredentials> T requireCredentials(Class<T> credentialType) {
    if (!credentialType.isInstance(credentials)) {
      throw new ConfigurationException(
          id,
          type
              + " requires "
              + credentialType.getSimpleName()
              + " but "
              + (credentials == null
                  ? "none were"
                  : credentials.getClass().getSimpleName() + " was")
              + " configured");
    }
    return credentialType.cast(credentials);
  }

  public String requireOption(String key) {
    var value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException(id, "option '" + key + "' is required for " + type);
    }
    return value;
  }

  public String option(String key, String defaultValue) {
    var value = options.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  public int intOption(String key, int defaultValue) {
    var value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(id, "option '" + key + "' must be a number: " + value);
    }
  }

  public Duration timeoutOr(Duration fallback) {
    return timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : fallback;
  }

  public IntegrationConfig withOptionOverrides(Map<String, String> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    var merged = new HashMap<>(options);
    merged.putAll(overrides);
    return new IntegrationConfig(
        id, type, name, host, port, verifySsl, timeout, enabled, credentials, merged);
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
