package io.b2mash.dashhub.integration.pikvm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.b2mash.dashhub.integration.ActionPerformer;
import io.b2mash.dashhub.integration.ActionResult;
import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.auth.StaticTokenAuthenticator;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * PiKVM adapter. kvmd accepts the username and password on every request in the {@code
 * X-KVMD-User} and {@code X-KVMD-Passwd} headers, so there is no session to maintain.
 */
@Component
public class PikvmAdapter implements IntegrationAdapter, ActionPerformer, CapabilityExecutor {

  private static final Logger log = LoggerFactory.getLogger(PikvmAdapter.class);

  static final String TYPE = "pikvm";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

  private static final Map<String, PowerAction> ACTIONS = actions();

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final SessionAuthenticator authenticator;
  private final MetricDispatcher dispatcher;
  private final CapabilityInvoker capabilityInvoker;

  public PikvmAdapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      ObjectMapper objectMapper,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.authenticator = StaticTokenAuthenticator.userPassword(clock);
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "info",
                    "System Info",
                    "PiKVM hardware and software information",
                    List.of("pikvm-system-info")),
                this::info)
            .metric(
                new MetricInfo(
                    "atx",
                    "ATX Power",
                    "ATX power state and LED status",
                    List.of("pikvm-power-status", "pikvm-power-control")),
                this::atx)
            .metric(
                new MetricInfo(
                    "msd",
                    "Mass Storage",
                    "Mass storage drive state and mounted images",
                    List.of("pikvm-msd-status")),
                this::msd)
            .metric(
                new MetricInfo(
                    "streamer",
                    "Video Streamer",
                    "Video capture status, resolution, and clients",
                    List.of("pikvm-streamer-status")),
                this::streamer)
            .build();
    this.capabilityInvoker =
        new CapabilityInvoker(
            TYPE, PikvmCapabilities.CATALOG, CapabilityInvoker.BodyEncoding.QUERY, objectMapper);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "PiKVM";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      var info = result(config, "/api/info");
      var version = info.path("system").path("kvmd").path("version").asText("unknown");
      var platform = info.path("hw").path("platform");
      var platformName =
          platform.isValueNode() ? platform.asText() : platform.path("type").asText("unknown");
      var details = new LinkedHashMap<String, Object>();
      details.put("version", version);
      details.put("platform", platformName);
      return ConnectionTestResult.success(
          "Connected to PiKVM v" + version + " (" + platformName + ")", details);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("PiKVM connection test failed for {}: {}", config.id(), error.getMessage());
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
    return PikvmCapabilities.CATALOG;
  }

  @Override
  public List<String> supportedActions() {
    return List.copyOf(ACTIONS.keySet());
  }

  @Override
  public ActionResult performAction(
      IntegrationConfig config, String action, Map<String, Object> params) {
    var powerAction = ACTIONS.get(action);
    if (powerAction == null) {
      return ActionResult.failure(new UnknownActionException(TYPE, action, supportedActions()));
    }
    try {
      withClient(
          config,
          client ->
              client
                  .post()
                  .uri("/api/atx/power?action={action}", powerAction.kvmdAction())
                  .retrieve()
                  .toBodilessEntity());
      log.info("Sent ATX {} to PiKVM {}", powerAction.kvmdAction(), config.id());
      return ActionResult.success(powerAction.message());
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("PiKVM action {} failed for {}: {}", action, config.id(), error.getMessage());
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

  private MetricResult info(IntegrationConfig config) {
    return MetricResult.success(Map.of("info", result(config, "/api/info")));
  }

  private MetricResult atx(IntegrationConfig config) {
    return MetricResult.success(Map.of("atx", result(config, "/api/atx")));
  }

  private MetricResult msd(IntegrationConfig config) {
    return MetricResult.success(Map.of("msd", result(config, "/api/msd")));
  }

  /** kvmd nests the live state under {@code result.streamer}; older releases return it flat. */
  private MetricResult streamer(IntegrationConfig config) {
    var result = result(config, "/api/streamer");
    var state = result.hasNonNull("streamer") ? result.path("streamer") : result;
    var streamer = new LinkedHashMap<String, Object>();
    streamer.put("enabled", true);
    streamer.put("features", result.path("features"));
    streamer.put("params", result.path("params"));
    streamer.put("source", state.path("source"));
    streamer.put("stream", state.path("stream"));
    streamer.put("snapshot", result.path("snapshot"));
    return MetricResult.success(Map.of("streamer", streamer));
  }

  // --- plumbing ---

  /** The {@code result} member of a kvmd response envelope. */
  private JsonNode result(IntegrationConfig config, String uri) {
    var response =
        withClient(config, client -> client.get().uri(uri).retrieve().body(JsonNode.class));
    return response != null ? response.path("result") : MissingNode.getInstance();
  }

  private <T> T withClient(IntegrationConfig config, Function<RestClient, T> call) {
    return credentialManager.withCredential(
        config, authenticator, credential -> call.apply(client(config, credential)));
  }

  private RestClient client(IntegrationConfig config, CachedCredential credential) {
    var userPassword = StaticTokenAuthenticator.splitUserPassword(credential.material());
    return clientFactory.create(
        config,
        config.baseUrl("https", 443),
        timeout(config),
        headers -> {
          headers.set("X-KVMD-User", userPassword[0]);
          headers.set("X-KVMD-Passwd", userPassword[1]);
          headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        });
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }

  private static Map<String, PowerAction> actions() {
    var actions = new LinkedHashMap<String, PowerAction>();
    actions.put("power_on", new PowerAction("on", "Power on command sent"));
    actions.put("power_off", new PowerAction("off", "Power off command sent"));
    actions.put("power_off_hard", new PowerAction("off_hard", "Force power off command sent"));
    actions.put("reset_hard", new PowerAction("reset_hard", "Hard reset command sent"));
    return actions;
  }

  private record PowerAction(String kvmdAction, String message) {}
}
