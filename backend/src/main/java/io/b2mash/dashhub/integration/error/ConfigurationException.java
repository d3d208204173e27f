package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** The integration instance is missing a field its adapter needs, or holds an unusable value. */
public class ConfigurationException extends IntegrationException {

  public ConfigurationException(String integrationId, String detail) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        ErrorCategory.CONFIGURATION,
        "Integration misconfigured",
        "Integration " + integrationId + ": " + detail,
        null);
  }
}
