package io.b2mash.dashhub.integration.error;

import java.net.URI;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base of every failure raised while talking to an upstream service. Carries an RFC 7807 problem
 * body with {@code category} (and, where known, {@code reason}) properties so the REST layer can
 * render it as-is.
 */
public abstract class IntegrationException extends ErrorResponseException {

  private final ErrorCategory category;

  protected IntegrationException(
      HttpStatus status, ErrorCategory category, String title, String detail, Throwable cause) {
    super(status, createProblem(status, category, title, detail), cause);
    this.category = category;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  /** Finer-grained reason within the category, or {@code null} when the category says it all. */
  public String getReason() {
    return null;
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  protected void exposeReason(Enum<?> reason) {
    getBody().setProperty("reason", reason.name());
  }

  private static ProblemDetail createProblem(
      HttpStatus status, ErrorCategory category, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setType(URI.create("urn:dashhub:integration:" + category.name().toLowerCase()));
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("category", category.name());
    return problem;
  }
}
