package io.b2mash.dashhub.integration.homebridge;

import static io.b2mash.dashhub.integration.http.UpstreamJson.elements;
import static io.b2mash.dashhub.integration.http.UpstreamJson.emptyArray;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.b2mash.dashhub.integration.ActionPerformer;
import io.b2mash.dashhub.integration.ActionResult;
import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.BearerExchangeAuthenticator;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityInvoker;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.error.UnknownActionException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricDispatcher;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

/**
 * Homebridge (homebridge-config-ui-x) adapter. Logs in with username and password for a JWT that
 * the UI issues for eight hours by default.
 */
@Component
public class HomebridgeAdapter implements IntegrationAdapter, ActionPerformer, CapabilityExecutor {

  private static final Logger log = LoggerFactory.getLogger(HomebridgeAdapter.class);

  static final String TYPE = "homebridge";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  private static final List<String> ACTIONS = List.of("set_characteristic", "restart");

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final AggregationExecutor aggregation;
  private final ObjectMapper objectMapper;
  private final SessionAuthenticator authenticator;
  private final MetricDispatcher dispatcher;
  private final CapabilityInvoker capabilityInvoker;

  public HomebridgeAdapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      AggregationExecutor aggregation,
      ObjectMapper objectMapper,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.aggregation = aggregation;
    this.objectMapper = objectMapper;
    this.authenticator =
        BearerExchangeAuthenticator.builder(clientFactory, clock)
            .baseUrl(HomebridgeAdapter::baseUrl)
            .tokenPath(config -> "/api/auth/login")
            .jsonBody(
                config -> {
                  var credentials = config.requireCredentials(UsernamePasswordCredentials.class);
                  var body = new HashMap<String, Object>();
                  body.put("username", credentials.username());
                  body.put("password", credentials.password());
                  return body;
                })
            .defaultTtl(Duration.ofHours(8))
            .build();
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "status",
                    "Server Status",
                    "Homebridge server status, versions, CPU, and RAM",
                    List.of("homebridge-status")),
                this::status)
            .metric(
                new MetricInfo(
                    "accessories",
                    "Accessories",
                    "All HomeKit accessories (requires insecure mode)",
                    List.of("homebridge-accessories", "homebridge-accessory-control")),
                this::accessories)
            .metric(
                new MetricInfo(
                    "plugins",
                    "Plugins",
                    "Installed Homebridge plugins",
                    List.of("homebridge-plugins")),
                this::plugins)
            .build();
    this.capabilityInvoker =
        new CapabilityInvoker(
            TYPE,
            HomebridgeCapabilities.CATALOG,
            CapabilityInvoker.BodyEncoding.JSON,
            objectMapper);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "Homebridge";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      return withClient(
          config,
          client -> {
            var status = get(client, "/api/status/homebridge");
            var serverInfo = get(client, "/api/status/server-information");
            var name = status.path("name").asText("Homebridge");
            var version = status.path("packageVersion").asText("unknown");
            var details = new LinkedHashMap<String, Object>();
            details.put("name", name);
            details.put("version", version);
            details.put("nodeVersion", serverInfo.path("nodeVersion").asText(null));
            details.put("insecureMode", serverInfo.path("homebridgeInsecureMode").asBoolean());
            details.put("status", status.path("status").asText(null));
            return ConnectionTestResult.success("Connected to " + name + " v" + version, details);
          });
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("Homebridge connection test failed for {}: {}", config.id(), error.getMessage());
      return ConnectionTestResult.failure(error);
    }
  }

  @Override
  public MetricResult getData(IntegrationConfig config, String metric) {
    return dispatcher.dispatch(config, metric);
  }

  @Override
  public List<MetricInfo> getAvailableMetrics() {
    return dispatcher.metrics();
  }

  @Override
  public List<Capability> getApiCapabilities() {
    return HomebridgeCapabilities.CATALOG;
  }

  @Override
  public List<String> supportedActions() {
    return ACTIONS;
  }

  /**
   * {@code set_characteristic} needs {@code uniqueId}, {@code characteristicType} and {@code
   * value}; {@code restart} takes no parameters.
   */
  @Override
  public ActionResult performAction(
      IntegrationConfig config, String action, Map<String, Object> params) {
    if (!ACTIONS.contains(action)) {
      return ActionResult.failure(new UnknownActionException(TYPE, action, ACTIONS));
    }
    var arguments = params != null ? params : Map.<String, Object>of();
    try {
      if ("restart".equals(action)) {
        withClient(
            config,
            client -> client.put().uri("/api/server/restart").retrieve().toBodilessEntity());
        return ActionResult.success("Homebridge restart requested");
      }
      var uniqueId = arguments.get("uniqueId");
      var characteristicType = arguments.get("characteristicType");
      var value = arguments.get("value");
      if (uniqueId == null || characteristicType == null || value == null) {
        return ActionResult.failure(
            "set_characteristic requires uniqueId, characteristicType and value");
      }
      var body = new LinkedHashMap<String, Object>();
      body.put("characteristicType", characteristicType);
      body.put("value", value);
      var accessory =
          withClient(
              config,
              client ->
                  client
                      .put()
                      .uri("/api/accessories/{uniqueId}", uniqueId)
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(body)
                      .retrieve()
                      .body(JsonNode.class));
      log.debug(
          "Set {} to {} for accessory {} on {}", characteristicType, value, uniqueId, config.id());
      return ActionResult.success(
          "Set " + characteristicType + " to " + value + " for " + uniqueId, accessory);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("Homebridge action {} failed for {}: {}", action, config.id(), error.getMessage());
      return ActionResult.failure(error);
    }
  }

  @Override
  public CapabilityExecutionResult executeCapability(
      IntegrationConfig config,
      String capabilityId,
      CapabilityMethod method,
      String endpoint,
      Map<String, Object> params) {
    return capabilityInvoker.execute(
        capabilityId, method, endpoint, params, request -> withClient(config, request));
  }

  // --- metrics ---

  /** Status and server information are required; version, CPU and RAM degrade to placeholders. */
  private MetricResult status(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var statusCall = plan.required("status", () -> get(client, "/api/status/homebridge"));
          var serverInfoCall =
              plan.required(
                  "serverInformation", () -> get(client, "/api/status/server-information"));
          var versionCall =
              plan.optional(
                  "version",
                  () -> get(client, "/api/status/homebridge-version"),
                  objectMapper.createObjectNode().put("installedVersion", "unknown"));
          var cpuCall =
              plan.optional(
                  "cpu",
                  () -> get(client, "/api/status/cpu"),
                  objectMapper.createObjectNode().put("currentLoad", 0));
          var ramCall =
              plan.optional("ram", () -> get(client, "/api/status/ram"), emptyRam());
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var serverInfo = merged.get(serverInfoCall);
                var status = objectMapper.createObjectNode();
                if (merged.get(statusCall) instanceof ObjectNode upstream) {
                  status.setAll(upstream);
                }
                status.put(
                    "packageVersion",
                    merged.get(versionCall).path("installedVersion").asText("unknown"));
                status.put("name", serverInfo.path("os").path("hostname").asText("Homebridge"));

                var combined = new LinkedHashMap<String, Object>();
                combined.put("status", status);
                combined.put("serverInfo", serverInfo);
                combined.put("cpu", merged.get(cpuCall));
                combined.put("ram", merged.get(ramCall));
                combined.put("insecureMode", serverInfo.path("homebridgeInsecureMode").asBoolean());
                return Map.of("status", combined);
              });
        });
  }

  /**
   * Accessories are only served in insecure mode. The mode is checked first; a 403 from the
   * accessories endpoint is read the same way.
   */
  private MetricResult accessories(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var serverInfo = get(client, "/api/status/server-information");
          if (!serverInfo.path("homebridgeInsecureMode").asBoolean()) {
            log.debug("Insecure mode disabled on {}, no accessories available", config.id());
            return accessoriesResult(emptyArray(), false);
          }
          try {
            return accessoriesResult(get(client, "/api/accessories"), true);
          } catch (HttpClientErrorException.Forbidden e) {
            log.debug("Accessories endpoint forbidden on {}", config.id());
            return accessoriesResult(emptyArray(), false);
          }
        });
  }

  private MetricResult plugins(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plugins = get(client, "/api/plugins");
          return MetricResult.success(
              Map.of("plugins", plugins, "total", elements(plugins).size()));
        });
  }

  private static MetricResult accessoriesResult(JsonNode accessories, boolean insecureMode) {
    return MetricResult.success(Map.of("accessories", accessories, "insecureMode", insecureMode));
  }

  private ObjectNode emptyRam() {
    var ram = objectMapper.createObjectNode();
    ram.putObject("mem").put("total", 0).put("used", 0).put("free", 0);
    return ram;
  }

  // --- plumbing ---

  private <T> T withClient(IntegrationConfig config, Function<RestClient, T> call) {
    return credentialManager.withCredential(
        config, authenticator, credential -> call.apply(client(config, credential)));
  }

  private RestClient client(IntegrationConfig config, CachedCredential credential) {
    return clientFactory.create(
        config,
        baseUrl(config),
        timeout(config),
        headers -> {
          headers.setBearerAuth(credential.material());
          headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        });
  }

  /** Homebridge is usually served over plain HTTP on 8581. */
  private static String baseUrl(IntegrationConfig config) {
    return config.baseUrl("http", 8581);
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }

  private static JsonNode get(RestClient client, String uri) {
    return client.get().uri(uri).retrieve().body(JsonNode.class);
  }
}
