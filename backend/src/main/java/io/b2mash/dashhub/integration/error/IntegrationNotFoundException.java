package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** No configured instance, or no registered adapter type, matches the requested key. */
public class IntegrationNotFoundException extends IntegrationException {

  public IntegrationNotFoundException(String kind, String key) {
    super(
        HttpStatus.NOT_FOUND,
        ErrorCategory.NOT_FOUND,
        kind + " not found",
        "No " + kind.toLowerCase() + " found with id " + key,
        null);
  }

  public static IntegrationNotFoundException instance(String id) {
    return new IntegrationNotFoundException("Integration", id);
  }

  public static IntegrationNotFoundException type(String type) {
    return new IntegrationNotFoundException("Integration type", type);
  }
}
