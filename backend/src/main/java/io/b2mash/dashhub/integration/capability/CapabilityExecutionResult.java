package io.b2mash.dashhub.integration.capability;

/**
 * Outcome of a pass-through capability call. {@code statusCode} is the upstream HTTP status when
 * one was received; {@code durationMs} is filled in by the service layer.
 */
public record CapabilityExecutionResult(
    boolean success, Object data, String error, Integer statusCode, Long durationMs) {

  public static CapabilityExecutionResult success(Object data, int statusCode) {
    return new CapabilityExecutionResult(true, data, null, statusCode, null);
  }

  public static CapabilityExecutionResult failure(String error, Object data, Integer statusCode) {
    return new CapabilityExecutionResult(false, data, error, statusCode, null);
  }

  public static CapabilityExecutionResult failure(String error) {
    return failure(error, null, null);
  }

  public CapabilityExecutionResult withDuration(long durationMs) {
    return new CapabilityExecutionResult(success, data, error, statusCode, durationMs);
  }
}
