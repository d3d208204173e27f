package io.b2mash.dashhub.integration.panos;

import static io.b2mash.dashhub.integration.panos.PanosXml.entries;
import static io.b2mash.dashhub.integration.panos.PanosXml.number;
import static io.b2mash.dashhub.integration.panos.PanosXml.text;

import com.fasterxml.jackson.databind.JsonNode;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.KeygenExchangeAuthenticator;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.auth.StaticTokenAuthenticator;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.error.UpstreamException;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricDispatcher;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Palo Alto Networks PAN-OS firewall adapter, speaking the XML API. Uses a configured API key as
 * is, or generates one from username and password and keeps it for a day.
 */
@Component
public class PanosAdapter implements IntegrationAdapter {

  private static final Logger log = LoggerFactory.getLogger(PanosAdapter.class);

  static final String TYPE = "panos";
  static final String KEY_HEADER = "X-PAN-KEY";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final AggregationExecutor aggregation;
  private final SessionAuthenticator apiKeyAuthenticator;
  private final SessionAuthenticator keygenAuthenticator;
  private final MetricDispatcher dispatcher;

  public PanosAdapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      AggregationExecutor aggregation,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.aggregation = aggregation;
    this.apiKeyAuthenticator = StaticTokenAuthenticator.apiKey(clock);
    this.keygenAuthenticator =
        new KeygenExchangeAuthenticator(
            clientFactory,
            clock,
            PanosAdapter::baseUrl,
            "/api/",
            config -> {
              var credentials = config.requireCredentials(UsernamePasswordCredentials.class);
              var form = new LinkedMultiValueMap<String, String>();
              form.add("type", "keygen");
              form.add("user", credentials.username());
              form.add("password", credentials.password() != null ? credentials.password() : "");
              return form;
            },
            PanosXml::key,
            Duration.ofHours(24),
            Duration.ofSeconds(15));
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "system",
                    "System Status",
                    "Firewall system information and health",
                    List.of("panos-system")),
                this::system)
            .metric(
                new MetricInfo(
                    "interfaces",
                    "Interfaces",
                    "Network interface status and traffic",
                    List.of("panos-interfaces")),
                this::interfaces)
            .metric(
                new MetricInfo(
                    "vpn", "VPN Tunnels", "IPsec tunnel and gateway status", List.of("panos-vpn")),
                this::vpn)
            .metric(
                new MetricInfo(
                    "sessions", "Sessions", "Active session statistics", List.of("panos-sessions")),
                this::sessions)
            .metric(
                new MetricInfo("ha", "High Availability", "HA cluster status", List.of("panos-ha")),
                this::highAvailability)
            .build();
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "Palo Alto PAN-OS";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      var system = op(config, PanosCapabilities.SYSTEM_INFO).path("system");
      var hostname = text(system, "Unknown", "hostname");
      var model = text(system, "Unknown", "model");
      var version = text(system, "Unknown", "sw-version");
      var details = new LinkedHashMap<String, Object>();
      details.put("hostname", hostname);
      details.put("model", model);
      details.put("version", version);
      return ConnectionTestResult.success(
          "Connected to " + hostname + " (" + model + ") running PAN-OS " + version, details);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("PAN-OS connection test failed for {}: {}", config.id(), error.getMessage());
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
    return PanosCapabilities.CATALOG;
  }

  // --- metrics ---

  private MetricResult system(IntegrationConfig config) {
    var system = op(config, PanosCapabilities.SYSTEM_INFO).path("system");
    var uptime = text(system, "Unknown", "uptime");
    var software = new LinkedHashMap<String, Object>();
    software.put("version", text(system, "Unknown", "sw-version"));
    software.put("appVersion", text(system, "Unknown", "app-version"));
    software.put("threatVersion", text(system, "Unknown", "threat-version"));
    software.put("wildfireVersion", text(system, "Unknown", "wildfire-version"));

    var data = new LinkedHashMap<String, Object>();
    data.put("hostname", text(system, "Unknown", "hostname"));
    data.put("model", text(system, "Unknown", "model"));
    data.put("serial", text(system, "Unknown", "serial"));
    data.put("ipAddress", text(system, "Unknown", "ip-address"));
    data.put("software", software);
    data.put("uptime", uptime);
    data.put("uptimeSeconds", PanosXml.uptimeSeconds(uptime));
    data.put("multiVsys", "on".equals(text(system, "off", "multi-vsys")));
    data.put("operationalMode", text(system, "normal", "operational-mode"));
    return MetricResult.success(data);
  }

  private MetricResult interfaces(IntegrationConfig config) {
    var result = op(config, PanosCapabilities.INTERFACES_ALL);
    var rows = entries(result.path("ifnet").path("entry"));
    if (rows.isEmpty()) {
      rows = entries(result.path("hw").path("entry"));
    }
    var interfaces = new ArrayList<Map<String, Object>>();
    for (var row : rows) {
      var entry = new LinkedHashMap<String, Object>();
      entry.put("name", text(row, "Unknown", "name"));
      entry.put("zone", text(row, "N/A", "zone"));
      entry.put("ip", text(row, "N/A", "ip"));
      entry.put("state", lower(text(row, "down", "state")));
      entry.put("speed", text(row, "N/A", "speed"));
      entry.put("duplex", text(row, "N/A", "duplex"));
      entry.put("rxBytes", number(row, "rx-bytes"));
      entry.put("txBytes", number(row, "tx-bytes"));
      entry.put("rxPackets", number(row, "rx-packets"));
      entry.put("txPackets", number(row, "tx-packets"));
      interfaces.add(entry);
    }
    long up = interfaces.stream().filter(entry -> "up".equals(entry.get("state"))).count();
    return MetricResult.success(
        Map.of(
            "interfaces",
            interfaces,
            "stats",
            Map.of("total", interfaces.size(), "up", up, "down", interfaces.size() - up)));
  }

  /**
   * IPsec security associations and IKE gateways are fetched side by side. Either half may be
   * unavailable (no VPN configured); its list is then empty and a warning is attached.
   */
  private MetricResult vpn(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var ipsecCall =
              plan.optional(
                  "ipsec",
                  () -> ipsecTunnels(command(client, PanosCapabilities.IPSEC_SA)),
                  List.<Map<String, Object>>of());
          var gatewayCall =
              plan.optional(
                  "gateways",
                  () -> gateways(command(client, PanosCapabilities.VPN_GATEWAY)),
                  List.<Map<String, Object>>of());
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var tunnels = merged.get(ipsecCall);
                var gateways = merged.get(gatewayCall);
                var stats = new LinkedHashMap<String, Object>();
                stats.put("totalTunnels", tunnels.size());
                stats.put("activeTunnels", countActive(tunnels));
                stats.put("totalGateways", gateways.size());
                stats.put("activeGateways", countActive(gateways));
                return Map.of("ipsecTunnels", tunnels, "gateways", gateways, "stats", stats);
              });
        });
  }

  private MetricResult sessions(IntegrationConfig config) {
    var info = op(config, PanosCapabilities.SESSION_INFO);
    long active = number(info, "num-active", "active-sessions");
    long max = number(info, "num-max", "max-sessions");
    var stats = new LinkedHashMap<String, Object>();
    stats.put("activeSessions", active);
    stats.put("maxSessions", max);
    stats.put("utilizationPercent", Math.round(active * 100.0 / Math.max(max, 1)));
    stats.put("tcpSessions", number(info, "num-tcp"));
    stats.put("udpSessions", number(info, "num-udp"));
    stats.put("icmpSessions", number(info, "num-icmp"));
    var throughput = new LinkedHashMap<String, Object>();
    throughput.put("kbps", number(info, "kbps"));
    throughput.put("pps", number(info, "pps", "cps"));
    return MetricResult.success(Map.of("stats", stats, "throughput", throughput));
  }

  /** A firewall without HA answers the state command with an error, reported as standalone. */
  private MetricResult highAvailability(IntegrationConfig config) {
    JsonNode result;
    try {
      result = op(config, PanosCapabilities.HA_STATE);
    } catch (UpstreamException e) {
      log.debug("HA state unavailable on {}: {}", config.id(), e.getMessage());
      return MetricResult.success(standalone());
    }
    var group = result.has("group") ? result.path("group") : result;
    var local = group.path("local-info");
    var peer = group.path("peer-info");
    var links = new ArrayList<Map<String, Object>>();
    for (var link : entries(group.path("link-monitoring").path("groups").path("entry"))) {
      var interfaceName = text(link.path("interface"), "unknown", "name");
      links.add(
          Map.of(
              "name", text(link, "Unknown", "name"),
              "state", lower(text(link, "down", "state")),
              "type", interfaceName.split("/")[0]));
    }
    var data = new LinkedHashMap<String, Object>();
    data.put("enabled", !"no".equals(text(group, "yes", "enabled")));
    data.put("mode", text(group, "active-passive", "mode"));
    data.put("localState", lower(text(local, "initial", "state")));
    data.put("peerState", lower(text(peer, "unknown", "state")));
    data.put("peerAddress", text(peer, "N/A", "mgmt-ip", "address"));
    data.put("configSynced", "synchronized".equals(text(local, "", "config-sync")));
    data.put("links", links);
    return MetricResult.success(data);
  }

  private static List<Map<String, Object>> ipsecTunnels(JsonNode result) {
    var tunnels = new ArrayList<Map<String, Object>>();
    for (var row : entries(result.path("entries").path("entry"))) {
      var tunnel = new LinkedHashMap<String, Object>();
      tunnel.put("name", text(row, "Unknown", "name"));
      tunnel.put("gateway", text(row, "N/A", "gateway"));
      tunnel.put("state", lower(text(row, "down", "state")));
      tunnel.put("localProxy", text(row, "N/A", "local-ip", "local-proxy"));
      tunnel.put("remoteProxy", text(row, "N/A", "remote-ip", "remote-proxy"));
      tunnel.put("encryptionAlgo", text(row, "N/A", "enc-algo", "encryption"));
      tunnel.put("lifetime", number(row, "lifetime"));
      tunnels.add(tunnel);
    }
    return tunnels;
  }

  private static List<Map<String, Object>> gateways(JsonNode result) {
    var rows = entries(result.path("entry"));
    if (rows.isEmpty()) {
      rows = entries(result.path("Gateway").path("entry"));
    }
    var gateways = new ArrayList<Map<String, Object>>();
    for (var row : rows) {
      var gateway = new LinkedHashMap<String, Object>();
      gateway.put("name", text(row, "Unknown", "name"));
      gateway.put("peerAddress", text(row, "N/A", "peer-address", "remote"));
      gateway.put("localAddress", text(row, "N/A", "local-address", "local"));
      gateway.put("state", lower(text(row, "down", "state")));
      gateways.add(gateway);
    }
    return gateways;
  }

  private static long countActive(List<Map<String, Object>> rows) {
    return rows.stream().filter(row -> "active".equals(row.get("state"))).count();
  }

  private static Map<String, Object> standalone() {
    var data = new LinkedHashMap<String, Object>();
    data.put("enabled", false);
    data.put("mode", "standalone");
    data.put("localState", "standalone");
    data.put("peerState", "N/A");
    data.put("peerAddress", "N/A");
    data.put("configSynced", false);
    data.put("links", List.of());
    return data;
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }

  // --- plumbing ---

  private JsonNode op(IntegrationConfig config, String command) {
    return withClient(config, client -> command(client, command));
  }

  private static JsonNode command(RestClient client, String command) {
    return PanosXml.result(
        client.get().uri("/api/?type=op&cmd={cmd}", command).retrieve().body(String.class));
  }

  private <T> T withClient(IntegrationConfig config, Function<RestClient, T> call) {
    return credentialManager.withCredential(
        config, authenticator(config), credential -> call.apply(client(config, credential)));
  }

  private SessionAuthenticator authenticator(IntegrationConfig config) {
    return config.credentials() instanceof ApiKeyCredentials
        ? apiKeyAuthenticator
        : keygenAuthenticator;
  }

  private RestClient client(IntegrationConfig config, CachedCredential credential) {
    return clientFactory.create(
        config,
        baseUrl(config),
        timeout(config),
        headers -> headers.set(KEY_HEADER, credential.material()));
  }

  private static String baseUrl(IntegrationConfig config) {
    return config.baseUrl("https", 443);
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }
}
