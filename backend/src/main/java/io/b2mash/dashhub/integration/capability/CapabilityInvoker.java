package io.b2mash.dashhub.integration.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.error.UpstreamException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Executes cataloged operations of one adapter on behalf of a caller.
 *
 * <p>The call must name a cataloged capability with its exact method and endpoint. {@code {name}}
 * placeholders are filled from {@code params}; leftover params go to the query string for GET and
 * DELETE and to the body otherwise. All failures come back as a {@link CapabilityExecutionResult}.
 */
public final class CapabilityInvoker {

  private static final Logger log = LoggerFactory.getLogger(CapabilityInvoker.class);
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

  public enum BodyEncoding {
    JSON,
    FORM,
    /** No body at all: every method sends its params in the query string. */
    QUERY
  }

  /** Runs a request against an authenticated client, with whatever retry the adapter applies. */
  @FunctionalInterface
  public interface Transport {
    ResponseEntity<String> send(Function<RestClient, ResponseEntity<String>> request);
  }

  private final String integrationType;
  private final Map<String, Capability> catalog;
  private final BodyEncoding bodyEncoding;
  private final ObjectMapper objectMapper;

  public CapabilityInvoker(
      String integrationType,
      List<Capability> capabilities,
      BodyEncoding bodyEncoding,
      ObjectMapper objectMapper) {
    this.integrationType = integrationType;
    this.catalog =
        capabilities.stream()
            .collect(
                Collectors.toMap(
                    Capability::id, capability -> capability, (a, b) -> a, LinkedHashMap::new));
    this.bodyEncoding = bodyEncoding;
    this.objectMapper = objectMapper;
  }

  public CapabilityExecutionResult execute(
      String capabilityId,
      CapabilityMethod method,
      String endpoint,
      Map<String, Object> params,
      Transport transport) {
    var capability = catalog.get(capabilityId);
    if (capability == null) {
      return CapabilityExecutionResult.failure(
          "Unknown capability '" + capabilityId + "' for " + integrationType);
    }
    if (method != capability.method()) {
      return CapabilityExecutionResult.failure(
          "Method "
              + method
              + " does not match capability "
              + capabilityId
              + " (expects "
              + capability.method()
              + ")");
    }
    if (endpoint != null && !endpoint.equals(capability.endpoint())) {
      return CapabilityExecutionResult.failure(
          "Endpoint " + endpoint + " is not the cataloged endpoint of " + capabilityId);
    }

    var remaining = new LinkedHashMap<String, Object>(params != null ? params : Map.of());
    var pathVariables = new HashMap<String, Object>();
    var matcher = PLACEHOLDER.matcher(capability.endpoint());
    while (matcher.find()) {
      var name = matcher.group(1);
      var value = remaining.remove(name);
      if (value == null || String.valueOf(value).isBlank()) {
        return CapabilityExecutionResult.failure("Missing path parameter '" + name + "'");
      }
      pathVariables.put(name, String.valueOf(value));
    }
    for (var parameter : capability.parameters()) {
      if (parameter.required()
          && !pathVariables.containsKey(parameter.name())
          && remaining.get(parameter.name()) == null) {
        return CapabilityExecutionResult.failure(
            "Missing required parameter '" + parameter.name() + "'");
      }
    }

    try {
      var response = transport.send(client -> send(client, capability, pathVariables, remaining));
      return CapabilityExecutionResult.success(
          parseBody(response.getBody()), response.getStatusCode().value());
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      log.debug("{} capability {} returned HTTP {}", integrationType, capabilityId, status);
      return CapabilityExecutionResult.failure(
          "Upstream returned HTTP " + status, parseBody(e.getResponseBodyAsString()), status);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.debug("{} capability {} failed: {}", integrationType, capabilityId, error.getMessage());
      Integer status =
          error instanceof UpstreamException upstream && upstream.status() > 0
              ? upstream.status()
              : null;
      return CapabilityExecutionResult.failure(error.getMessage(), null, status);
    }
  }

  private ResponseEntity<String> send(
      RestClient client,
      Capability capability,
      Map<String, Object> pathVariables,
      Map<String, Object> remaining) {
    var method = capability.method();
    boolean paramsInQuery = method.sendsParamsAsQuery() || bodyEncoding == BodyEncoding.QUERY;
    var request =
        client
            .method(method.toHttpMethod())
            .uri(
                builder -> {
                  builder.path(capability.endpoint());
                  var variables = new HashMap<>(pathVariables);
                  if (paramsInQuery) {
                    int index = 0;
                    for (var entry : remaining.entrySet()) {
                      var variable = "query" + index++;
                      builder.queryParam(entry.getKey(), "{" + variable + "}");
                      variables.put(variable, String.valueOf(entry.getValue()));
                    }
                  }
                  return builder.build(variables);
                });
    if (!paramsInQuery && !remaining.isEmpty()) {
      if (bodyEncoding == BodyEncoding.FORM) {
        var form = new LinkedMultiValueMap<String, String>();
        remaining.forEach((key, value) -> form.add(key, String.valueOf(value)));
        request.contentType(MediaType.APPLICATION_FORM_URLENCODED).body(form);
      } else {
        request.contentType(MediaType.APPLICATION_JSON).body(remaining);
      }
    }
    return request.retrieve().toEntity(String.class);
  }

  private Object parseBody(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      return body;
    }
  }
}
