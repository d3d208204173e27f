package io.b2mash.dashhub.integration.qbittorrent;

import static io.b2mash.dashhub.integration.http.UpstreamJson.elements;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.ActionPerformer;
import io.b2mash.dashhub.integration.ActionResult;
import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.auth.SessionCookieAuthenticator;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * qBittorrent WebUI adapter. Logs in with a form post and rides on the {@code SID} session
 * cookie; an expired session answers 403, which triggers one re-login.
 */
@Component
public class QBittorrentAdapter implements IntegrationAdapter, ActionPerformer, CapabilityExecutor {

  private static final Logger log = LoggerFactory.getLogger(QBittorrentAdapter.class);

  static final String TYPE = "qbittorrent";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private static final Set<String> DOWNLOADING =
      Set.of(
          "downloading", "forcedDL", "metaDL", "stalledDL", "queuedDL", "checkingDL", "allocating");
  private static final Set<String> SEEDING =
      Set.of("uploading", "forcedUP", "stalledUP", "queuedUP", "checkingUP");
  private static final Set<String> PAUSED =
      Set.of("pausedDL", "pausedUP", "stoppedDL", "stoppedUP");

  private static final Map<String, TorrentAction> ACTIONS = actions();

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final AggregationExecutor aggregation;
  private final SessionAuthenticator authenticator;
  private final MetricDispatcher dispatcher;
  private final CapabilityInvoker capabilityInvoker;

  public QBittorrentAdapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      AggregationExecutor aggregation,
      ObjectMapper objectMapper,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.aggregation = aggregation;
    this.authenticator =
        SessionCookieAuthenticator.builder(clientFactory, clock)
            .baseUrl(QBittorrentAdapter::apiBase)
            .loginPath("/auth/login")
            .form(
                config -> {
                  var credentials = config.requireCredentials(UsernamePasswordCredentials.class);
                  var form = new LinkedMultiValueMap<String, String>();
                  form.add("username", credentials.username());
                  form.add(
                      "password", credentials.password() != null ? credentials.password() : "");
                  return form;
                })
            .extraHeaders(QBittorrentAdapter::refererHeaders)
            .cookieName("SID")
            .rejectedBody("Fails."::equals)
            .fallbackTtl(Duration.ofMinutes(30))
            .build();
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "status",
                    "Status",
                    "Version, connection state, speeds and all torrents",
                    List.of("qbittorrent-status")),
                this::status)
            .metric(
                new MetricInfo(
                    "torrents",
                    "Torrents",
                    "Torrent list with downloading, seeding and paused counts",
                    List.of("qbittorrent-torrents")),
                this::torrents)
            .metric(
                new MetricInfo(
                    "transfer",
                    "Transfer",
                    "Global transfer speeds and totals",
                    List.of("qbittorrent-transfer")),
                this::transfer)
            .metric(
                new MetricInfo(
                    "categories",
                    "Categories",
                    "Torrent categories and tags",
                    List.of("qbittorrent-categories")),
                this::categories)
            .build();
    this.capabilityInvoker =
        new CapabilityInvoker(
            TYPE,
            QBittorrentCapabilities.CATALOG,
            CapabilityInvoker.BodyEncoding.FORM,
            objectMapper);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "qBittorrent";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      var version =
          withClient(
              config, client -> client.get().uri("/app/version").retrieve().body(String.class));
      return ConnectionTestResult.success(
          "Connected to qBittorrent " + version, Map.of("version", version));
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("qBittorrent connection test failed for {}: {}", config.id(), error.getMessage());
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
    return QBittorrentCapabilities.CATALOG;
  }

  @Override
  public List<String> supportedActions() {
    return List.copyOf(ACTIONS.keySet());
  }

  /**
   * Runs one of the torrent actions. {@code hashes} (a {@code |}-separated list) defaults to
   * {@code all} for actions that target torrents.
   */
  @Override
  public ActionResult performAction(
      IntegrationConfig config, String action, Map<String, Object> params) {
    var torrentAction = ACTIONS.get(action);
    if (torrentAction == null) {
      return ActionResult.failure(new UnknownActionException(TYPE, action, supportedActions()));
    }
    var hashes =
        params != null && params.get("hashes") != null ? params.get("hashes").toString() : "all";
    try {
      withClient(
          config,
          client -> {
            var form = new LinkedMultiValueMap<String, String>();
            if (torrentAction.targetsTorrents()) {
              form.add("hashes", hashes);
            }
            return client
                .post()
                .uri(torrentAction.path())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .toBodilessEntity();
          });
      return ActionResult.success(
          torrentAction.description()
              + (torrentAction.targetsTorrents() ? " (" + hashes + ")" : ""));
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("qBittorrent action {} failed for {}: {}", action, config.id(), error.getMessage());
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

  /** Version lookups are cosmetic and degrade to "Unknown"; the main data snapshot is required. */
  private MetricResult status(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var version =
              plan.optional(
                  "version",
                  () -> client.get().uri("/app/version").retrieve().body(String.class),
                  "Unknown");
          var apiVersion =
              plan.optional(
                  "apiVersion",
                  () -> client.get().uri("/app/webapiVersion").retrieve().body(String.class),
                  "Unknown");
          var mainData =
              plan.required(
                  "maindata",
                  () -> client.get().uri("/sync/maindata?rid=0").retrieve().body(JsonNode.class));
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var snapshot = merged.get(mainData);
                var state = snapshot.path("server_state");
                var status = new LinkedHashMap<String, Object>();
                status.put("version", merged.get(version));
                status.put("apiVersion", merged.get(apiVersion));
                status.put("connectionStatus", state.path("connection_status").asText("unknown"));
                status.put("dhtNodes", state.path("dht_nodes").asLong());
                status.put("totalPeerConnections", state.path("total_peer_connections").asLong());
                status.put("freeSpaceOnDisk", state.path("free_space_on_disk").asLong());
                status.put("useAltSpeedLimits", state.path("use_alt_speed_limits").asBoolean());
                status.put("downloadSpeed", state.path("dl_info_speed").asLong());
                status.put("uploadSpeed", state.path("up_info_speed").asLong());
                status.put("downloadSpeedLimit", state.path("dl_rate_limit").asLong());
                status.put("uploadSpeedLimit", state.path("up_rate_limit").asLong());
                status.put("allTimeDownload", state.path("alltime_dl").asLong());
                status.put("allTimeUpload", state.path("alltime_ul").asLong());
                status.put("globalRatio", state.path("global_ratio").asText("0"));

                var torrents = new ArrayList<Map<String, Object>>();
                snapshot
                    .path("torrents")
                    .fields()
                    .forEachRemaining(
                        entry -> {
                          var torrent = new LinkedHashMap<String, Object>();
                          torrent.put("hash", entry.getKey());
                          entry.getValue().fields().forEachRemaining(
                              field -> torrent.put(field.getKey(), field.getValue()));
                          torrents.add(torrent);
                        });
                var data = new LinkedHashMap<String, Object>();
                data.put("status", status);
                data.put("torrents", torrents);
                data.put("categories", snapshot.path("categories"));
                return data;
              });
        });
  }

  private MetricResult torrents(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var torrents = client.get().uri("/torrents/info").retrieve().body(JsonNode.class);
          int downloading = 0;
          int seeding = 0;
          int paused = 0;
          for (var torrent : elements(torrents)) {
            var state = torrent.path("state").asText();
            if (DOWNLOADING.contains(state)) {
              downloading++;
            } else if (SEEDING.contains(state)) {
              seeding++;
            } else if (PAUSED.contains(state)) {
              paused++;
            }
          }
          var data = new LinkedHashMap<String, Object>();
          data.put("torrents", torrents);
          data.put("downloading", downloading);
          data.put("seeding", seeding);
          data.put("paused", paused);
          data.put("total", elements(torrents).size());
          return MetricResult.success(data);
        });
  }

  private MetricResult transfer(IntegrationConfig config) {
    return withClient(
        config,
        client ->
            MetricResult.success(
                Map.of(
                    "transfer",
                    client.get().uri("/transfer/info").retrieve().body(JsonNode.class))));
  }

  private MetricResult categories(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var categories =
              plan.required(
                  "categories",
                  () -> client.get().uri("/torrents/categories").retrieve().body(JsonNode.class));
          var tags =
              plan.required(
                  "tags",
                  () -> client.get().uri("/torrents/tags").retrieve().body(JsonNode.class));
          var merged = plan.execute();
          return merged.toResult(
              () -> Map.of("categories", merged.get(categories), "tags", merged.get(tags)));
        });
  }

  // --- plumbing ---

  private <T> T withClient(IntegrationConfig config, Function<RestClient, T> call) {
    return credentialManager.withCredential(
        config, authenticator, credential -> call.apply(client(config, credential)));
  }

  private RestClient client(IntegrationConfig config, CachedCredential credential) {
    return clientFactory.create(
        config,
        apiBase(config),
        timeout(config),
        headers -> {
          headers.addAll(refererHeaders(config));
          headers.set(HttpHeaders.COOKIE, credential.material());
        });
  }

  private static String apiBase(IntegrationConfig config) {
    return config.baseUrl("http", 8080) + "/api/v2";
  }

  /** The WebUI's CSRF protection wants a Referer matching its own origin. */
  private static HttpHeaders refererHeaders(IntegrationConfig config) {
    var headers = new HttpHeaders();
    headers.set(HttpHeaders.REFERER, config.baseUrl("http", 8080));
    return headers;
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }

  private static Map<String, TorrentAction> actions() {
    var actions = new LinkedHashMap<String, TorrentAction>();
    actions.put("pause", new TorrentAction("/torrents/pause", true, "Paused torrents"));
    actions.put("resume", new TorrentAction("/torrents/resume", true, "Resumed torrents"));
    actions.put("recheck", new TorrentAction("/torrents/recheck", true, "Rechecking torrents"));
    actions.put(
        "toggle_alt_speed",
        new TorrentAction(
            "/transfer/toggleSpeedLimitsMode", false, "Toggled alternative speed limits"));
    return actions;
  }

  private record TorrentAction(String path, boolean targetsTorrents, String description) {}
}
