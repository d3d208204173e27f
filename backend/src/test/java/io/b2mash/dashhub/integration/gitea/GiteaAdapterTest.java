package io.b2mash.dashhub.integration.gitea;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.auth.CredentialCache;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

class GiteaAdapterTest {

  private static final String API = "https://git.local:443/api/v1";
  private static final IntegrationConfig CONFIG =
      new IntegrationConfig(
          "gitea-home",
          "gitea",
          "Gitea",
          "git.local",
          null,
          true,
          null,
          true,
          new ApiKeyCredentials("tok-123"),
          null);

  private MockRestServiceServer server;
  private GiteaAdapter adapter;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).ignoreExpectOrder(true).build();
    var clock = Clock.systemUTC();
    adapter =
        new GiteaAdapter(
            new UpstreamClientFactory(builder, (verifySsl, timeout) -> null),
            new CredentialManager(new CredentialCache(Duration.ofSeconds(60), 100, clock)),
            new AggregationExecutor(Runnable::run, 4),
            new ObjectMapper(),
            clock);
  }

  @Nested
  class TestConnection {

    @Test
    void validToken_reportsUser() {
      server
          .expect(requestTo(API + "/user"))
          .andExpect(header(HttpHeaders.AUTHORIZATION, "token tok-123"))
          .andRespond(
              json("{\"login\":\"alice\",\"full_name\":\"Alice A\",\"is_admin\":true}"));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isTrue();
      assertThat(result.message()).isEqualTo("Connected as alice (Admin)");
      assertThat(result.details())
          .containsEntry("username", "alice")
          .containsEntry("isAdmin", true);
    }

    @Test
    void rejectedToken_failsWithoutRetry() {
      server
          .expect(once(), requestTo(API + "/user"))
          .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

      var result = adapter.testConnection(CONFIG);

      assertThat(result.success()).isFalse();
      assertThat(result.category()).isEqualTo(ErrorCategory.AUTHENTICATION);
      server.verify();
    }
  }

  @Nested
  class Metrics {

    @Test
    void overview_degradesWhenOrganizationsFail() {
      server
          .expect(requestTo(API + "/user"))
          .andRespond(
              json("{\"login\":\"alice\",\"followers_count\":3,\"starred_repos_count\":7}"));
      server
          .expect(requestTo(API + "/user/repos?limit=100"))
          .andRespond(json("[{\"private\":true},{\"private\":false},{\"private\":false}]"));
      server.expect(requestTo(API + "/user/orgs?limit=100")).andRespond(withServerError());

      var result = adapter.getData(CONFIG, "overview");

      assertThat(result).isInstanceOf(MetricResult.PartialSuccess.class);
      var partial = (MetricResult.PartialSuccess) result;
      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) partial.data().get("stats");
      assertThat(stats)
          .containsEntry("totalRepos", 3)
          .containsEntry("publicRepos", 2L)
          .containsEntry("privateRepos", 1L)
          .containsEntry("organizations", 0)
          .containsEntry("stars", 7L);
      assertThat(partial.warnings()).singleElement().asString().startsWith("orgs unavailable");
    }

    @Test
    void overview_unauthorizedOrganizations_degradeInsteadOfFailing() {
      server
          .expect(once(), requestTo(API + "/user"))
          .andRespond(json("{\"login\":\"alice\",\"followers_count\":3}"));
      server
          .expect(once(), requestTo(API + "/user/repos?limit=100"))
          .andRespond(json("[{\"private\":false}]"));
      server
          .expect(once(), requestTo(API + "/user/orgs?limit=100"))
          .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

      var result = adapter.getData(CONFIG, "overview");

      assertThat(result).isInstanceOf(MetricResult.PartialSuccess.class);
      var partial = (MetricResult.PartialSuccess) result;
      @SuppressWarnings("unchecked")
      var stats = (Map<String, Object>) partial.data().get("stats");
      assertThat(stats).containsEntry("totalRepos", 1).containsEntry("organizations", 0);
      assertThat(partial.warnings()).singleElement().asString().startsWith("orgs unavailable");
      server.verify();
    }

    @Test
    void repositories_useTotalCountHeader() {
      var headers = new HttpHeaders();
      headers.add("X-Total-Count", "42");
      server
          .expect(requestTo(API + "/user/repos?limit=100"))
          .andRespond(
              withSuccess("[{\"name\":\"hub\"}]", MediaType.APPLICATION_JSON).headers(headers));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "repositories");

      assertThat(result.data()).containsEntry("total", 42L);
    }

    @Test
    void pullRequests_areMergedNewestFirstAcrossRepositories() {
      server
          .expect(requestTo(API + "/user/repos?limit=50"))
          .andRespond(
              json(
                  "[{\"name\":\"a\",\"full_name\":\"alice/a\",\"owner\":{\"login\":\"alice\"},"
                      + "\"open_pr_counter\":1},"
                      + "{\"name\":\"b\",\"full_name\":\"alice/b\",\"owner\":{\"login\":\"alice\"},"
                      + "\"open_pr_counter\":2},"
                      + "{\"name\":\"c\",\"full_name\":\"alice/c\",\"owner\":{\"login\":\"alice\"},"
                      + "\"open_pr_counter\":0}]"));
      server
          .expect(requestTo(API + "/repos/alice/a/pulls?state=open&limit=20"))
          .andRespond(json("[{\"id\":1,\"updated_at\":\"2026-01-01T10:00:00Z\"}]"));
      server
          .expect(requestTo(API + "/repos/alice/b/pulls?state=open&limit=20"))
          .andRespond(
              json(
                  "[{\"id\":3,\"updated_at\":\"2026-01-01T10:00:00Z\"},"
                      + "{\"id\":2,\"updated_at\":\"2026-01-03T10:00:00Z\"}]"));

      var result = (MetricResult.Success) adapter.getData(CONFIG, "pull-requests");

      @SuppressWarnings("unchecked")
      var pulls = (List<JsonNode>) result.data().get("pullRequests");
      assertThat(pulls).extracting(pr -> pr.path("id").asLong()).containsExactly(2L, 1L, 3L);
      assertThat(result.data()).containsEntry("repositoriesScanned", 2);
      server.verify();
    }

    @Test
    void requiredCallFailure_isCategorisedFailure() {
      server.expect(requestTo(API + "/user")).andRespond(withServerError());
      server.expect(requestTo(API + "/user/repos?limit=100")).andRespond(json("[]"));
      server.expect(requestTo(API + "/user/orgs?limit=100")).andRespond(json("[]"));

      var result = adapter.getData(CONFIG, "overview");

      assertThat(result).isInstanceOf(MetricResult.Failure.class);
      assertThat(((MetricResult.Failure) result).error().getCategory())
          .isEqualTo(ErrorCategory.UPSTREAM);
    }

    @Test
    void metricIds_matchTheWidgetsCatalog() {
      assertThat(adapter.getAvailableMetrics())
          .extracting(metric -> metric.id())
          .containsExactly(
              "overview",
              "repositories",
              "issues",
              "pull-requests",
              "activity",
              "organizations",
              "notifications");
    }
  }

  @Test
  void capability_passesThroughWithToken() {
    server
        .expect(requestTo(API + "/repos/alice/hub"))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "token tok-123"))
        .andRespond(json("{\"full_name\":\"alice/hub\"}"));

    var result =
        adapter.executeCapability(
            CONFIG,
            "repos-get",
            CapabilityMethod.GET,
            "/repos/{owner}/{repo}",
            Map.of("owner", "alice", "repo", "hub"));

    assertThat(result.success()).isTrue();
    assertThat(((JsonNode) result.data()).path("full_name").asText()).isEqualTo("alice/hub");
  }

  private static ResponseCreator json(String body) {
    return withSuccess(body, MediaType.APPLICATION_JSON);
  }
}
