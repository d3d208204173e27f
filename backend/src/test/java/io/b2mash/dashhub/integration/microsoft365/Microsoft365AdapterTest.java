package io.b2mash.dashhub.integration.microsoft365;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.OAuthCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.CredentialCache;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

class Microsoft365AdapterTest {

  private static final String AUTHORITY = "https://login.test";
  private static final String GRAPH = "https://graph.test/v1.0";
  private static final String TOKEN_URL = AUTHORITY + "/tenant-1/oauth2/v2.0/token";
  private static final IntegrationConfig CONFIG =
      new IntegrationConfig(
          "m365",
          "microsoft365",
          "Work account",
          null,
          null,
          true,
          null,
          true,
          new OAuthCredentials("client-1", "client-secret", "rt-1"),
          Map.of("tenantId", "tenant-1", "authorityUrl", AUTHORITY, "graphUrl", GRAPH));

  private final Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);

  private MockRestServiceServer server;
  private Microsoft365Adapter adapter;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    adapter =
        new Microsoft365Adapter(
            new UpstreamClientFactory(builder, (verifySsl, timeout) -> null),
            new CredentialManager(new CredentialCache(Duration.ofSeconds(60), 100, clock)),
            new AggregationExecutor(Runnable::run, 8),
            new ObjectMapper(),
            clock);
  }

  @Nested
  class Authentication {

    @Test
    void refreshTokenIsExchangedAtTenantTokenEndpoint() {
      server
          .expect(requestTo(TOKEN_URL))
          .andExpect(method(HttpMethod.POST))
          .andExpect(
              header(HttpHeaders.CONTENT_TYPE, startsWith("application/x-www-form-urlencoded")))
          .andExpect(content().string(containsString("grant_type=refresh_token")))
          .andExpect(content().string(containsString("client_id=client-1")))
          .andExpect(content().string(containsString("refresh_token=rt-1")))
          .andRespond(json("{\"access_token\":\"graph-token\",\"expires_in\":3600}"));
      server
          .expect(requestTo(GRAPH + "/me"))
          .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer graph-token"))
          .andRespond(json("{\"displayName\":\"Alice Smith\",\"mail\":\"alice@example.com\"}"));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Connected as Alice Smith (alice@example.com)");
      assertThat(result.details()).containsEntry("mail", "alice@example.com");
      server.verify();
    }

    @Test
    void rejectedRefreshToken_isReportedAsExpired() {
      server
          .expect(requestTo(TOKEN_URL))
          .andRespond(
              withStatus(HttpStatus.BAD_REQUEST)
                  .contentType(MediaType.APPLICATION_JSON)
                  .body("{\"error\":\"invalid_grant\"}"));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isFalse();
      assertThat(result.category()).isEqualTo(ErrorCategory.AUTHENTICATION);
      assertThat(result.details()).containsEntry("reason", "TOKEN_EXPIRED");
    }

    @Test
    void accessTokenIsReusedAcrossCalls() {
      expectToken();
      server.expect(requestTo(GRAPH + "/me")).andRespond(json("{\"displayName\":\"Alice\"}"));
      server.expect(requestTo(GRAPH + "/me")).andRespond(json("{\"displayName\":\"Alice\"}"));

      adapter.testConnection(CONFIG);
      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isTrue();
      server.verify();
    }
  }

  @Nested
  class Metrics {

    @Test
    void profile_degradesWhenOptionalCallsFail() {
      expectToken();
      server
          .expect(requestTo(GRAPH + "/me"))
          .andRespond(
              json(
                  "{\"id\":\"u1\",\"displayName\":\"Alice\",\"mail\":\"alice@example.com\","
                      + "\"jobTitle\":\"Engineer\"}"));
      server.expect(requestTo(GRAPH + "/me/presence")).andRespond(withServerError());
      server
          .expect(requestTo(GRAPH + "/me/manager"))
          .andRespond(withStatus(HttpStatus.NOT_FOUND));
      server
          .expect(requestTo(GRAPH + "/me/photo/$value"))
          .andRespond(withSuccess(new byte[] {1, 2, 3}, MediaType.IMAGE_JPEG));

      var result = adapter.getData(CONFIG, "profile");

      assertThat(result).isInstanceOf(MetricResult.PartialSuccess.class);
      var partial = (MetricResult.PartialSuccess) result;
      @SuppressWarnings("unchecked")
      var user = (Map<String, Object>) partial.data().get("user");
      assertThat(user)
          .containsEntry("displayName", "Alice")
          .containsEntry("jobTitle", "Engineer")
          .containsEntry("department", null)
          .containsEntry("photo", "data:image/jpeg;base64,AQID");
      assertThat(partial.data())
          .containsEntry("presence", Map.of("availability", "Unknown", "activity", "Unknown"))
          .doesNotContainKey("manager");
      assertThat(partial.warnings()).hasSize(2);
    }

    @Test
    void mail_combinesInboxCountsAndRecentMessages() {
      expectToken();
      server
          .expect(requestTo(GRAPH + "/me/mailFolders/Inbox"))
          .andRespond(json("{\"unreadItemCount\":4,\"totalItemCount\":120}"));
      server
          .expect(requestTo(startsWith(GRAPH + "/me/messages?$top=10")))
          .andRespond(
              json(
                  "{\"value\":[{\"id\":\"m1\",\"subject\":\"\",\"isRead\":false,"
                      + "\"from\":{\"emailAddress\":{\"address\":\"bob@example.com\"}}}]}"));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "mail");

      assertThat(result.data()).containsEntry("unreadCount", 4L).containsEntry("totalCount", 120L);
      @SuppressWarnings("unchecked")
      var messages = (List<Map<String, Object>>) result.data().get("recentMessages");
      assertThat(messages).hasSize(1);
      assertThat(messages.get(0))
          .containsEntry("subject", "(No subject)")
          .containsEntry("from", Map.of("name", "Unknown", "email", "bob@example.com"))
          .containsEntry("isRead", false);
    }

    @Test
    void calendar_picksFirstTimedEventThatHasNotEnded() {
      expectToken();
      server
          .expect(requestTo(startsWith(GRAPH + "/me/calendarView")))
          .andRespond(json("{\"value\":[" + event("e1", "2026-10-18T09:00:00", false) + "]}"));
      server
          .expect(requestTo(startsWith(GRAPH + "/me/calendarView")))
          .andRespond(
              json(
                  "{\"value\":["
                      + event("e2", "2026-10-19T00:00:00", true)
                      + ","
                      + event("e3", "2026-10-18T15:00:00", false)
                      + "]}"));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "calendar");

      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) result.data().get("stats");
      assertThat(stats).containsEntry("todayCount", 1).containsEntry("weekCount", 2);
      @SuppressWarnings("unchecked")
      var next = (Map<String, Object>) stats.get("nextMeeting");
      assertThat(next).containsEntry("id", "e3");
      server.verify();
    }

    @Test
    void tasks_countsOverdueAndDueTodayAgainstClock() {
      expectToken();
      server
          .expect(requestTo(GRAPH + "/me/todo/lists"))
          .andRespond(
              json(
                  "{\"value\":[{\"id\":\"list-1\",\"displayName\":\"Work\"},"
                      + "{\"id\":\"list-2\",\"displayName\":\"Home\"}]}"));
      server
          .expect(requestTo(GRAPH + "/me/todo/lists/list-1/tasks?$top=50"))
          .andRespond(
              json(
                  "{\"value\":["
                      + task("t1", "completed", "2026-10-10T09:00:00.0000000")
                      + ","
                      + task("t2", "notStarted", "2026-10-17T09:00:00.0000000")
                      + ","
                      + task("t3", "inProgress", "2026-10-18T08:00:00.0000000")
                      + ","
                      + task("t4", "notStarted", "2026-10-20T09:00:00.0000000")
                      + "]}"));
      server
          .expect(requestTo(GRAPH + "/me/todo/lists/list-2/tasks?$top=50"))
          .andRespond(withServerError());

      var result = adapter.getData(CONFIG, "tasks");

      assertThat(result).isInstanceOf(MetricResult.PartialSuccess.class);
      var partial = (MetricResult.PartialSuccess) result;
      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) partial.data().get("stats");
      assertThat(stats)
          .containsEntry("total", 4L)
          .containsEntry("completed", 1L)
          .containsEntry("pending", 3L)
          .containsEntry("overdue", 2L)
          .containsEntry("dueToday", 1L);
      @SuppressWarnings("unchecked")
      var lists = (List<Map<String, Object>>) partial.data().get("todoLists");
      assertThat(lists).hasSize(2);
      assertThat((List<?>) lists.get(1).get("tasks")).isEmpty();
      assertThat(partial.warnings()).singleElement().asString().contains("tasks:list-2");
    }

    @Test
    void graphDateTime_toleratesMissingAndMalformedValues() throws Exception {
      var mapper = new ObjectMapper();

      assertThat(Microsoft365Adapter.graphDateTime(null)).isNull();
      assertThat(Microsoft365Adapter.graphDateTime(mapper.readTree("{\"dateTime\":\"soon\"}")))
          .isNull();
      assertThat(
              Microsoft365Adapter.graphDateTime(
                  mapper.readTree("{\"dateTime\":\"2026-10-18T08:00:00.0000000\"}")))
          .isEqualTo(LocalDateTime.of(2026, 10, 18, 8, 0));
    }
  }

  @Test
  void catalogIsDescriptiveOnly() {
    assertThat(adapter).isNotInstanceOf(CapabilityExecutor.class);
    assertThat(adapter.getApiCapabilities())
        .extracting(Capability::id)
        .contains("get-me", "list-tasks", "create-task");
  }

  private void expectToken() {
    server
        .expect(requestTo(TOKEN_URL))
        .andRespond(json("{\"access_token\":\"graph-token\",\"expires_in\":3600}"));
  }

  private static String event(String id, String start, boolean allDay) {
    return "{\"id\":\""
        + id
        + "\",\"subject\":\"Meeting\",\"isAllDay\":"
        + allDay
        + ",\"start\":{\"dateTime\":\""
        + start
        + "\",\"timeZone\":\"UTC\"},\"end\":{\"dateTime\":\""
        + start.replace("T00:", "T23:").replace("T09:", "T10:").replace("T15:", "T16:")
        + "\",\"timeZone\":\"UTC\"}}";
  }

  private static String task(String id, String status, String due) {
    return "{\"id\":\""
        + id
        + "\",\"title\":\"Task "
        + id
        + "\",\"status\":\""
        + status
        + "\",\"dueDateTime\":{\"dateTime\":\""
        + due
        + "\",\"timeZone\":\"UTC\"}}";
  }

  private static ResponseCreator json(String body) {
    return withSuccess(body, MediaType.APPLICATION_JSON);
  }
}
