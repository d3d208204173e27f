package io.b2mash.dashhub.integration.gitea;

import static io.b2mash.dashhub.integration.http.UpstreamJson.countWhere;
import static io.b2mash.dashhub.integration.http.UpstreamJson.elements;
import static io.b2mash.dashhub.integration.http.UpstreamJson.emptyArray;
import static io.b2mash.dashhub.integration.http.UpstreamJson.totalCount;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.CapabilityExecutor;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.aggregation.MergeOrdering;
import io.b2mash.dashhub.integration.aggregation.SubCall;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.auth.StaticTokenAuthenticator;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityInvoker;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
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
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Gitea adapter. Authenticates with a personal access token ({@code Authorization: token}). */
@Component
public class GiteaAdapter implements IntegrationAdapter, CapabilityExecutor {

  private static final Logger log = LoggerFactory.getLogger(GiteaAdapter.class);

  static final String TYPE = "gitea";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final AggregationExecutor aggregation;
  private final SessionAuthenticator authenticator;
  private final MetricDispatcher dispatcher;
  private final CapabilityInvoker capabilityInvoker;

  public GiteaAdapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      AggregationExecutor aggregation,
      ObjectMapper objectMapper,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.aggregation = aggregation;
    this.authenticator = StaticTokenAuthenticator.apiKey(clock);
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "overview",
                    "Overview",
                    "Account summary with repository and organization statistics",
                    List.of("gitea-overview")),
                this::overview)
            .metric(
                new MetricInfo(
                    "repositories",
                    "Repositories",
                    "List of repositories with stars, forks, and activity",
                    List.of("gitea-repositories")),
                this::repositories)
            .metric(
                new MetricInfo(
                    "issues",
                    "Issues",
                    "Open issues across repositories",
                    List.of("gitea-issues")),
                this::issues)
            .metric(
                new MetricInfo(
                    "pull-requests",
                    "Pull Requests",
                    "Open pull requests of the most active repositories, newest first",
                    List.of("gitea-pull-requests")),
                this::pullRequests)
            .metric(
                new MetricInfo(
                    "activity",
                    "Activity",
                    "Contribution heatmap of the authenticated user",
                    List.of("gitea-activity")),
                this::activity)
            .metric(
                new MetricInfo(
                    "organizations",
                    "Organizations",
                    "User organizations with repository, member and team counts",
                    List.of("gitea-organizations")),
                this::organizations)
            .metric(
                new MetricInfo(
                    "notifications",
                    "Notifications",
                    "User notification inbox",
                    List.of("gitea-notifications")),
                this::notifications)
            .build();
    this.capabilityInvoker =
        new CapabilityInvoker(
            TYPE, GiteaCapabilities.CATALOG, CapabilityInvoker.BodyEncoding.JSON, objectMapper);
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "Gitea";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      var user = withClient(config, client -> get(client, "/user"));
      var login = user.path("login").asText();
      boolean admin = user.path("is_admin").asBoolean();
      var details = new LinkedHashMap<String, Object>();
      details.put("username", login);
      details.put("fullName", user.path("full_name").asText(""));
      details.put("isAdmin", admin);
      return ConnectionTestResult.success(
          "Connected as " + login + (admin ? " (Admin)" : ""), details);
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("Gitea connection test failed for {}: {}", config.id(), error.getMessage());
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
    return GiteaCapabilities.CATALOG;
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

  private MetricResult overview(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var user = plan.required("user", () -> get(client, "/user"));
          var repos = plan.required("repos", () -> get(client, "/user/repos?limit={limit}", 100));
          var orgs =
              plan.optional(
                  "orgs", () -> get(client, "/user/orgs?limit={limit}", 100), emptyArray());
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var profile = merged.get(user);
                var repoList = merged.get(repos);
                var stats = new LinkedHashMap<String, Object>();
                stats.put("totalRepos", elements(repoList).size());
                stats.put("publicRepos", countWhere(repoList, "private", false));
                stats.put("privateRepos", countWhere(repoList, "private", true));
                stats.put("organizations", elements(merged.get(orgs)).size());
                stats.put("stars", profile.path("starred_repos_count").asLong());
                stats.put("followers", profile.path("followers_count").asLong());
                stats.put("following", profile.path("following_count").asLong());
                return Map.of("user", profile, "stats", stats);
              });
        });
  }

  private MetricResult repositories(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var response = getEntity(client, "/user/repos?limit={limit}", 100);
          return MetricResult.success(
              Map.of("repositories", response.getBody(), "total", totalCount(response)));
        });
  }

  private MetricResult issues(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var response =
              getEntity(client, "/repos/issues/search?state={state}&limit={limit}", "open", 100);
          return MetricResult.success(
              Map.of("issues", response.getBody(), "total", totalCount(response)));
        });
  }

  /**
   * Lists the user's repositories, then fetches open pull requests of the first {@code
   * prRepoLimit} repositories that have any. A repository whose pulls cannot be read is left out.
   */
  private MetricResult pullRequests(IntegrationConfig config) {
    int repoLimit = config.intOption("prRepoLimit", 10);
    return withClient(
        config,
        client -> {
          var repos =
              elements(get(client, "/user/repos?limit={limit}", 50)).stream()
                  .filter(repo -> repo.path("open_pr_counter").asInt() > 0)
                  .toList();
          var plan = aggregation.plan(timeout(config));
          var pulls =
              plan.optionalEach(
                  "pulls",
                  repos,
                  repoLimit,
                  repo -> repo.path("full_name").asText(),
                  repo ->
                      elements(
                          get(
                              client,
                              "/repos/{owner}/{repo}/pulls?state={state}&limit={limit}",
                              repo.path("owner").path("login").asText(),
                              repo.path("name").asText(),
                              "open",
                              20)));
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var sorted =
                    MergeOrdering.merge(
                        MergeOrdering.newestFirst(
                            (JsonNode pr) ->
                                MergeOrdering.parseTimestamp(pr.path("updated_at").asText(null)),
                            pr -> pr.path("id").asLong()),
                        merged.collect(pulls));
                var data = new LinkedHashMap<String, Object>();
                data.put("pullRequests", sorted);
                data.put("total", sorted.size());
                data.put("repositoriesScanned", pulls.size());
                return data;
              });
        });
  }

  private MetricResult activity(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var login = get(client, "/user").path("login").asText();
          var heatmap = get(client, "/users/{username}/heatmap", login);
          return MetricResult.success(Map.of("heatmap", heatmap));
        });
  }

  /**
   * Organizations of the user, each enriched with repository and member counts and its teams.
   * Enrichment failures fall back to zero counts and no teams.
   */
  private MetricResult organizations(IntegrationConfig config) {
    int orgLimit = config.intOption("orgLimit", 20);
    return withClient(
        config,
        client -> {
          var response = getEntity(client, "/user/orgs?limit={limit}", 100);
          var orgs = elements(response.getBody());
          var shown = orgs.subList(0, Math.min(orgLimit, orgs.size()));

          var plan = aggregation.plan(timeout(config));
          var enrichment = new ArrayList<OrgEnrichment>();
          for (var org : shown) {
            var name = org.path("username").asText();
            enrichment.add(
                new OrgEnrichment(
                    org,
                    plan.optional(
                        "repos:" + name,
                        () -> totalCount(getEntity(client, "/orgs/{org}/repos?limit=1", name)),
                        0L),
                    plan.optional(
                        "members:" + name,
                        () -> totalCount(getEntity(client, "/orgs/{org}/members?limit=1", name)),
                        0L),
                    plan.optional(
                        "teams:" + name,
                        () -> get(client, "/orgs/{org}/teams?limit=50", name),
                        emptyArray())));
          }
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var organizations = new ArrayList<Map<String, Object>>();
                for (var entry : enrichment) {
                  var org = new LinkedHashMap<String, Object>();
                  org.put("organization", entry.org());
                  org.put("repoCount", merged.get(entry.repoCount()));
                  org.put("memberCount", merged.get(entry.memberCount()));
                  org.put("teams", merged.get(entry.teams()));
                  organizations.add(org);
                }
                return Map.of("organizations", organizations, "total", totalCount(response));
              });
        });
  }

  private MetricResult notifications(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var list =
              plan.required("notifications", () -> getEntity(client, "/notifications?limit=50"));
          var fresh =
              plan.optional(
                  "new", () -> get(client, "/notifications/new").path("new").asLong(), null);
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var response = merged.get(list);
                var data = new LinkedHashMap<String, Object>();
                data.put("notifications", response.getBody());
                data.put("unreadCount", countWhere(response.getBody(), "unread", true));
                data.put("total", totalCount(response));
                if (merged.get(fresh) != null) {
                  data.put("newCount", merged.get(fresh));
                }
                return data;
              });
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
        config.baseUrl("https", 443) + "/api/v1",
        timeout(config),
        headers -> {
          headers.set(HttpHeaders.AUTHORIZATION, "token " + credential.material());
          headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        });
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }

  private static JsonNode get(RestClient client, String uri, Object... variables) {
    return client.get().uri(uri, variables).retrieve().body(JsonNode.class);
  }

  private static ResponseEntity<JsonNode> getEntity(
      RestClient client, String uri, Object... variables) {
    return client.get().uri(uri, variables).retrieve().toEntity(JsonNode.class);
  }

  private record OrgEnrichment(
      JsonNode org, SubCall<Long> repoCount, SubCall<Long> memberCount, SubCall<JsonNode> teams) {}
}
