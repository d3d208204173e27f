package io.b2mash.dashhub.integration.panos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.CredentialCache;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriUtils;

class PanosAdapterTest {

  private static final String BASE = "https://fw.local:443";
  private static final String SYSTEM_INFO_XML =
      "<response status=\"success\"><result><system>"
          + "<hostname>fw01</hostname><model>PA-440</model><sw-version>11.1.2</sw-version>"
          + "<serial>0123</serial><uptime>2 days, 1:00:00</uptime><multi-vsys>off</multi-vsys>"
          + "</system></result></response>";

  private MockRestServiceServer server;
  private PanosAdapter adapter;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    var clock = Clock.systemUTC();
    adapter =
        new PanosAdapter(
            new UpstreamClientFactory(builder, (verifySsl, timeout) -> null),
            new CredentialManager(new CredentialCache(Duration.ofSeconds(60), 100, clock)),
            new AggregationExecutor(Runnable::run, 4),
            clock);
  }

  @Nested
  class Authentication {

    @Test
    void apiKey_isSentInHeader() {
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andExpect(header(PanosAdapter.KEY_HEADER, "configured-key"))
          .andRespond(xml(SYSTEM_INFO_XML));

      var result = adapter.testConnection(config(new ApiKeyCredentials("configured-key")));

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Connected to fw01 (PA-440) running PAN-OS 11.1.2");
    }

    @Test
    void usernamePassword_generatesKeyWithFormPost() {
      expectKeygen("generated-1");
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andExpect(header(PanosAdapter.KEY_HEADER, "generated-1"))
          .andRespond(xml(SYSTEM_INFO_XML));

      assertThat(adapter.testConnection(passwordConfig()).success()).isTrue();
      server.verify();
    }

    @Test
    void expiredKeyEnvelope_regeneratesKeyOnce() {
      expectKeygen("generated-1");
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andRespond(
              xml(
                  "<response status=\"error\" code=\"403\"><result><msg>Invalid credential"
                      + "</msg></result></response>"));
      expectKeygen("generated-2");
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andExpect(header(PanosAdapter.KEY_HEADER, "generated-2"))
          .andRespond(xml(SYSTEM_INFO_XML));

      var result = adapter.testConnection(passwordConfig());

      assertThat(result.success()).isTrue();
      server.verify();
    }

    @Test
    void invalidStaticKey_isAuthenticationFailure() {
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andRespond(
              xml(
                  "<response status=\"error\" code=\"403\"><result><msg>Invalid credential"
                      + "</msg></result></response>"));

      var result = adapter.testConnection(config(new ApiKeyCredentials("bad")));

      assertThat(result.success()).isFalse();
      assertThat(result.category()).isEqualTo(ErrorCategory.AUTHENTICATION);
    }
  }

  @Nested
  class Metrics {

    private final IntegrationConfig config = config(new ApiKeyCredentials("k"));

    @Test
    void system_parsesUptime() {
      server
          .expect(requestTo(op(PanosCapabilities.SYSTEM_INFO)))
          .andRespond(xml(SYSTEM_INFO_XML));

      var result = (MetricResult.Success) adapter.getData(config, "system");

      assertThat(result.data())
          .containsEntry("hostname", "fw01")
          .containsEntry("serial", "0123")
          .containsEntry("uptimeSeconds", 2 * 86400L + 3600L)
          .containsEntry("multiVsys", false);
    }

    @Test
    void interfaces_countUpAndDown() {
      server
          .expect(requestTo(op(PanosCapabilities.INTERFACES_ALL)))
          .andRespond(
              xml(
                  "<response status=\"success\"><result><ifnet>"
                      + "<entry><name>ethernet1/1</name><state>UP</state><zone>trust</zone></entry>"
                      + "<entry><name>ethernet1/2</name><state>down</state></entry>"
                      + "<entry><name>ethernet1/3</name><state>up</state></entry>"
                      + "</ifnet></result></response>"));

      var result = (MetricResult.Success) adapter.getData(config, "interfaces");

      assertThat(result.data().get("stats"))
          .isEqualTo(Map.of("total", 3, "up", 2L, "down", 1L));
    }

    @Test
    void vpn_degradesWhenGatewaysUnavailable() {
      server
          .expect(requestTo(op(PanosCapabilities.IPSEC_SA)))
          .andRespond(
              xml(
                  "<response status=\"success\"><result><entries>"
                      + "<entry><name>to-branch</name><state>active</state></entry>"
                      + "</entries></result></response>"));
      server.expect(requestTo(op(PanosCapabilities.VPN_GATEWAY))).andRespond(withServerError());

      var result = adapter.getData(config, "vpn");

      assertThat(result).isInstanceOf(MetricResult.PartialSuccess.class);
      var data = ((MetricResult.PartialSuccess) result).data();
      assertThat((List<?>) data.get("ipsecTunnels")).hasSize(1);
      assertThat((List<?>) data.get("gateways")).isEmpty();
      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) data.get("stats");
      assertThat(stats).containsEntry("activeTunnels", 1L).containsEntry("totalGateways", 0);
    }

    @Test
    void ha_errorMeansStandalone() {
      server
          .expect(requestTo(op(PanosCapabilities.HA_STATE)))
          .andRespond(
              xml(
                  "<response status=\"error\"><msg><line>HA not configured</line></msg>"
                      + "</response>"));

      var result = (MetricResult.Success) adapter.getData(config, "ha");

      assertThat(result.data()).containsEntry("mode", "standalone").containsEntry("enabled", false);
    }

    @Test
    void sessions_computeUtilisation() {
      server
          .expect(requestTo(op(PanosCapabilities.SESSION_INFO)))
          .andRespond(
              xml(
                  "<response status=\"success\"><result><num-active>250</num-active>"
                      + "<num-max>1000</num-max><num-tcp>200</num-tcp></result></response>"));

      var result = (MetricResult.Success) adapter.getData(config, "sessions");

      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) result.data().get("stats");
      assertThat(stats)
          .containsEntry("activeSessions", 250L)
          .containsEntry("utilizationPercent", 25L)
          .containsEntry("tcpSessions", 200L);
    }
  }

  @Test
  void catalog_isDescriptiveOnly() {
    assertThat(adapter.getApiCapabilities()).isNotEmpty();
    assertThat(adapter).isNotInstanceOf(CapabilityExecutor.class);
  }

  private void expectKeygen(String key) {
    server
        .expect(requestTo(BASE + "/api/"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().string(containsString("type=keygen")))
        .andExpect(content().string(containsString("user=admin")))
        .andRespond(
            xml("<response status=\"success\"><result><key>" + key + "</key></result></response>"));
  }

  private static String op(String command) {
    return BASE + "/api/?type=op&cmd=" + UriUtils.encode(command, StandardCharsets.UTF_8);
  }

  private static ResponseCreator xml(String body) {
    return withSuccess(body, MediaType.APPLICATION_XML);
  }

  private static IntegrationConfig passwordConfig() {
    return config(new UsernamePasswordCredentials("admin", "secret"));
  }

  private static IntegrationConfig config(IntegrationCredentials credentials) {
    return new IntegrationConfig(
        "edge-fw",
        "panos",
        "Edge firewall",
        "fw.local",
        null,
        false,
        null,
        true,
        credentials,
        null);
  }
}
