package io.b2mash.dashhub.integration.error;

/** Coarse classification of an integration failure, rendered as the {@code category} property. */
public enum ErrorCategory {
  CONFIGURATION,
  AUTHENTICATION,
  NETWORK,
  UPSTREAM,
  UNKNOWN_METRIC,
  UNKNOWN_ACTION,
  NOT_FOUND,
  DISABLED
}
