package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.error.IntegrationException;

public record ActionResult(boolean success, String message, Object data) {

  public static ActionResult success(String message) {
    return new ActionResult(true, message, null);
  }

  public static ActionResult success(String message, Object data) {
    return new ActionResult(true, message, data);
  }

  public static ActionResult failure(String message) {
    return new ActionResult(false, message, null);
  }

  public static ActionResult failure(IntegrationException error) {
    return new ActionResult(false, error.getMessage(), null);
  }
}
