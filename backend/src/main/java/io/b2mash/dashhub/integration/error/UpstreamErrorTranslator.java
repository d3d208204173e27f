package io.b2mash.dashhub.integration.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/** Maps Spring client exceptions (and their I/O causes) onto the integration error taxonomy. */
public final class UpstreamErrorTranslator {

  private UpstreamErrorTranslator() {}

  public static IntegrationException translate(Throwable error) {
    if (error instanceof IntegrationException integrationException) {
      return integrationException;
    }
    if ((error instanceof CompletionException || error instanceof ExecutionException)
        && error.getCause() != null) {
      return translate(error.getCause());
    }
    if (error instanceof TimeoutException) {
      return new NetworkException(
          NetworkException.Reason.TIMEOUT, "Upstream call timed out", error);
    }
    if (error instanceof HttpStatusCodeException statusError) {
      return fromStatus(statusError);
    }
    if (error instanceof RestClientResponseException responseError) {
      return new UpstreamException(
          responseError.getStatusCode().value(),
          responseError.getResponseBodyAsString(),
          "Upstream returned HTTP " + responseError.getStatusCode().value(),
          responseError);
    }
    if (error instanceof ResourceAccessException accessError) {
      return fromIoFailure(accessError);
    }
    if (error instanceof RestClientException clientError) {
      return new UpstreamException(
          "Could not read upstream response: " + clientError.getMessage(), clientError);
    }
    return new UpstreamException(
        "Unexpected integration failure: " + describe(error), error);
  }

  /** True when the status means the upstream no longer accepts the credential we sent. */
  public static boolean isAuthRejection(Throwable error) {
    return error instanceof HttpStatusCodeException statusError
        && (statusError.getStatusCode().value() == 401
            || statusError.getStatusCode().value() == 403);
  }

  private static IntegrationException fromStatus(HttpStatusCodeException error) {
    int status = error.getStatusCode().value();
    if (status == 401) {
      return new AuthenticationException(
          AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Upstream rejected the credentials (HTTP 401)",
          error);
    }
    if (status == 403) {
      return new AuthenticationException(
          AuthenticationException.Reason.FORBIDDEN,
          "Upstream denied access (HTTP 403)",
          error);
    }
    return new UpstreamException(
        status,
        error.getResponseBodyAsString(),
        "Upstream returned HTTP " + status,
        error);
  }

  private static NetworkException fromIoFailure(ResourceAccessException error) {
    for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof UnknownHostException) {
        return new NetworkException(
            NetworkException.Reason.DNS_FAILURE,
            "Could not resolve upstream host: " + cause.getMessage(),
            error);
      }
      if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
        return new NetworkException(
            NetworkException.Reason.TIMEOUT, "Upstream call timed out", error);
      }
      if (cause instanceof SSLException) {
        return new NetworkException(
            NetworkException.Reason.TLS_FAILURE,
            "TLS handshake with upstream failed: " + cause.getMessage(),
            error);
      }
      if (cause instanceof ConnectException || cause instanceof NoRouteToHostException) {
        return new NetworkException(
            NetworkException.Reason.UNREACHABLE,
            "Upstream refused the connection or is unreachable",
            error);
      }
    }
    return new NetworkException(
        NetworkException.Reason.UNREACHABLE, "Upstream unreachable: " + describe(error), error);
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
