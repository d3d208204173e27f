package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** The upstream service could not be reached, or did not answer in time. */
public class NetworkException extends IntegrationException {

  public enum Reason {
    UNREACHABLE,
    DNS_FAILURE,
    TIMEOUT,
    TLS_FAILURE
  }

  private final Reason reason;

  public NetworkException(Reason reason, String detail, Throwable cause) {
    super(
        reason == Reason.TIMEOUT ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY,
        ErrorCategory.NETWORK,
        reason == Reason.TIMEOUT ? "Upstream timed out" : "Upstream unreachable",
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
