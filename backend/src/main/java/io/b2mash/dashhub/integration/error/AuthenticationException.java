package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** The upstream service refused the configured credentials or the session derived from them. */
public class AuthenticationException extends IntegrationException {

  public enum Reason {
    INVALID_CREDENTIALS,
    TOKEN_EXPIRED,
    FORBIDDEN
  }

  private final Reason reason;

  public AuthenticationException(Reason reason, String detail) {
    this(reason, detail, null);
  }

  public AuthenticationException(Reason reason, String detail, Throwable cause) {
    super(
        HttpStatus.BAD_GATEWAY,
        ErrorCategory.AUTHENTICATION,
        "Upstream authentication failed",
        detail,
        cause);
    this.reason = reason;
    exposeReason(reason);
  }

  public Reason reason() {
    return reason;
  }

  @Override
  public String getReason() {
    return reason.name();
  }
}
