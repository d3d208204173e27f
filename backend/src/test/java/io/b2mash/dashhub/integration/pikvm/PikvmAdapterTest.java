package io.b2mash.dashhub.integration.pikvm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.auth.CredentialCache;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

class PikvmAdapterTest {

  private static final String BASE = "https://kvm.local:443";
  private static final IntegrationConfig CONFIG =
      new IntegrationConfig(
          "rack-kvm",
          "pikvm",
          "Rack KVM",
          "kvm.local",
          null,
          false,
          null,
          true,
          new UsernamePasswordCredentials("admin", "admin"),
          null);

  private MockRestServiceServer server;
  private PikvmAdapter adapter;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    var clock = Clock.systemUTC();
    adapter =
        new PikvmAdapter(
            new UpstreamClientFactory(builder, (verifySsl, timeout) -> null),
            new CredentialManager(new CredentialCache(Duration.ofSeconds(60), 100, clock)),
            new ObjectMapper(),
            clock);
  }

  @Nested
  class TestConnection {

    @Test
    void credentialsTravelInKvmdHeaders() {
      server
          .expect(requestTo(BASE + "/api/info"))
          .andExpect(header("X-KVMD-User", "admin"))
          .andExpect(header("X-KVMD-Passwd", "admin"))
          .andRespond(
              json(
                  "{\"ok\":true,\"result\":{\"system\":{\"kvmd\":{\"version\":\"3.291\"}},"
                      + "\"hw\":{\"platform\":{\"type\":\"rpi\"}}}}"));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Connected to PiKVM v3.291 (rpi)");
    }

    @Test
    void rejectedCredentials_areNotRetried() {
      server
          .expect(once(), requestTo(BASE + "/api/info"))
          .andRespond(withStatus(HttpStatus.FORBIDDEN));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isFalse();
      assertThat(result.category()).isEqualTo(ErrorCategory.AUTHENTICATION);
      server.verify();
    }
  }

  @Nested
  class Metrics {

    @Test
    void atx_unwrapsResultEnvelope() {
      server
          .expect(requestTo(BASE + "/api/atx"))
          .andRespond(
              json("{\"ok\":true,\"result\":{\"enabled\":true,\"leds\":{\"power\":true}}}"));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "atx");

      var atx = (JsonNode) result.data().get("atx");
      assertThat(atx.path("leds").path("power").asBoolean()).isTrue();
    }

    @Test
    void streamer_readsNestedState() {
      server
          .expect(requestTo(BASE + "/api/streamer"))
          .andRespond(
              json(
                  "{\"ok\":true,\"result\":{\"features\":{\"h264\":true},"
                      + "\"streamer\":{\"source\":{\"online\":true},"
                      + "\"stream\":{\"clients\":2}}}}"));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "streamer");

      @SuppressWarnings("unchecked")
      var streamer = (Map<String, Object>) result.data().get("streamer");
      assertThat(((JsonNode) streamer.get("source")).path("online").asBoolean()).isTrue();
      assertThat(((JsonNode) streamer.get("stream")).path("clients").asInt()).isEqualTo(2);
    }
  }

  @Nested
  class Actions {

    @Test
    void powerOn_postsAtxAction() {
      server
          .expect(requestTo(BASE + "/api/atx/power?action=on"))
          .andExpect(method(HttpMethod.POST))
          .andRespond(json("{\"ok\":true,\"result\":{}}"));

      var result = adapter.performAction(CONFIG, "power_on", Map.of());

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Power on command sent");
      server.verify();
    }

    @Test
    void unknownAction_listsSupportedActions() {
      var result = adapter.performAction(CONFIG, "self_destruct", Map.of());

      assertThat(result.success()).isFalse();
      assertThat(result.message()).contains("power_on", "reset_hard");
    }
  }

  @Test
  void capability_sendsParamsInQueryString() {
    server
        .expect(requestTo(BASE + "/api/atx/click?button=power"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().string(""))
        .andRespond(json("{\"ok\":true,\"result\":{}}"));

    var result =
        adapter.executeCapability(
            CONFIG,
            "atx-click",
            CapabilityMethod.POST,
            "/api/atx/click",
            Map.of("button", "power"));

    assertThat(result.success()).isTrue();
    server.verify();
  }

  private static ResponseCreator json(String body) {
    return withSuccess(body, MediaType.APPLICATION_JSON);
  }
}
