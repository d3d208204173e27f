package io.b2mash.dashhub.integration.error;

import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpStatus;

public class UnknownActionException extends IntegrationException {

  private final List<String> supportedActions;

  public UnknownActionException(
      String integrationType, String action, Collection<String> supportedActions) {
    super(
        HttpStatus.BAD_REQUEST,
        ErrorCategory.UNKNOWN_ACTION,
        "Unknown action",
        supportedActions.isEmpty()
            ? integrationType + " does not support actions"
            : "Unknown action '"
                + action
                + "' for "
                + integrationType
                + ". Supported actions: "
                + String.join(", ", supportedActions),
        null);
    this.supportedActions = List.copyOf(supportedActions);
  }

  public List<String> supportedActions() {
    return supportedActions;
  }
}
