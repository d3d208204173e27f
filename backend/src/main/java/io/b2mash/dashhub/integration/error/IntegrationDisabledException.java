package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** Thrown when a configured integration instance is switched off with {@code enabled: false}. */
public class IntegrationDisabledException extends IntegrationException {

  public IntegrationDisabledException(String integrationId) {
    super(
        HttpStatus.CONFLICT,
        ErrorCategory.DISABLED,
        "Integration disabled",
        "Integration " + integrationId + " is disabled in configuration.",
        null);
  }
}
