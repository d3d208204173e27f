package io.b2mash.dashhub.integration.capability;

import org.springframework.http.HttpMethod;

public enum CapabilityMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE;

  public HttpMethod toHttpMethod() {
    return HttpMethod.valueOf(name());
  }

  /** Whether leftover parameters travel in the query string rather than the request body. */
  public boolean sendsParamsAsQuery() {
    return this == GET || this == DELETE;
  }
}
