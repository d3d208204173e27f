package io.b2mash.dashhub.exception;

import io.b2mash.dashhub.integration.error.IntegrationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IntegrationException.class)
  public ResponseEntity<ProblemDetail> handleIntegration(
      IntegrationException ex, HttpServletRequest request) {
    log.warn(
        "Integration request failed: path={}, method={}, category={}, detail={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getCategory(),
        ex.getMessage());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Rejected request: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
