package io.b2mash.dashhub.integration.aggregation;

public enum CallPolicy {
  /** Failure fails the whole metric. */
  REQUIRED,
  /** Failure substitutes the call's fallback and records a warning. */
  OPTIONAL
}
