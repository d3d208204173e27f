package io.b2mash.dashhub.integration.error;

import org.springframework.http.HttpStatus;

/** The upstream answered, but with an error status or a body that could not be understood. */
public class UpstreamException extends IntegrationException {

  private static final int MAX_BODY_LENGTH = 500;

  private final int status;
  private final String body;

  public UpstreamException(int status, String body, String detail, Throwable cause) {
    super(HttpStatus.BAD_GATEWAY, ErrorCategory.UPSTREAM, "Upstream error", detail, cause);
    this.status = status;
    this.body = truncate(body);
    if (status > 0) {
      getBody().setProperty("upstreamStatus", status);
    }
  }

  public UpstreamException(String detail, Throwable cause) {
    this(0, null, detail, cause);
  }

  /** Upstream HTTP status, or 0 when the failure happened before a status was received. */
  public int status() {
    return status;
  }

  public String body() {
    return body;
  }

  private static String truncate(String body) {
    if (body == null || body.length() <= MAX_BODY_LENGTH) {
      return body;
    }
    return body.substring(0, MAX_BODY_LENGTH) + "...";
  }
}
