package io.b2mash.dashhub.integration.microsoft365;

import static io.b2mash.dashhub.integration.http.UpstreamJson.elements;
import static io.b2mash.dashhub.integration.http.UpstreamJson.emptyArray;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.dashhub.integration.ConnectionTestResult;
import io.b2mash.dashhub.integration.IntegrationAdapter;
import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.OAuthCredentials;
import io.b2mash.dashhub.integration.aggregation.AggregationExecutor;
import io.b2mash.dashhub.integration.aggregation.SubCall;
import io.b2mash.dashhub.integration.auth.BearerExchangeAuthenticator;
import io.b2mash.dashhub.integration.auth.CachedCredential;
import io.b2mash.dashhub.integration.auth.CredentialManager;
import io.b2mash.dashhub.integration.auth.SessionAuthenticator;
import io.b2mash.dashhub.integration.capability.Capability;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import io.b2mash.dashhub.integration.metric.MetricDispatcher;
import io.b2mash.dashhub.integration.metric.MetricInfo;
import io.b2mash.dashhub.integration.metric.MetricResult;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;

/**
 * Microsoft 365 adapter on Microsoft Graph. Trades the configured OAuth refresh token for an
 * access token at the tenant's token endpoint; Graph itself needs no host configuration.
 */
@Component
public class Microsoft365Adapter implements IntegrationAdapter {

  private static final Logger log = LoggerFactory.getLogger(Microsoft365Adapter.class);

  static final String TYPE = "microsoft365";
  static final String DEFAULT_AUTHORITY = "https://login.microsoftonline.com";
  static final String DEFAULT_GRAPH_URL = "https://graph.microsoft.com/v1.0";
  private static final String SCOPE = "https://graph.microsoft.com/.default offline_access";
  private static final String CALENDAR_VIEW =
      "/me/calendarView?startDateTime={start}&endDateTime={end}&$orderby={orderBy}";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final UpstreamClientFactory clientFactory;
  private final CredentialManager credentialManager;
  private final AggregationExecutor aggregation;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final SessionAuthenticator authenticator;
  private final MetricDispatcher dispatcher;

  public Microsoft365Adapter(
      UpstreamClientFactory clientFactory,
      CredentialManager credentialManager,
      AggregationExecutor aggregation,
      ObjectMapper objectMapper,
      Clock clock) {
    this.clientFactory = clientFactory;
    this.credentialManager = credentialManager;
    this.aggregation = aggregation;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.authenticator =
        BearerExchangeAuthenticator.builder(clientFactory, clock)
            .baseUrl(config -> config.option("authorityUrl", DEFAULT_AUTHORITY))
            .tokenPath(config -> "/" + config.option("tenantId", "common") + "/oauth2/v2.0/token")
            .formBody(
                config -> {
                  var credentials = config.requireCredentials(OAuthCredentials.class);
                  var form = new LinkedMultiValueMap<String, String>();
                  form.add("grant_type", "refresh_token");
                  form.add("client_id", credentials.clientId());
                  form.add("client_secret", credentials.clientSecret());
                  form.add("refresh_token", credentials.refreshToken());
                  form.add("scope", SCOPE);
                  return form;
                })
            .refreshGrant()
            .build();
    this.dispatcher =
        MetricDispatcher.builder(TYPE)
            .metric(
                new MetricInfo(
                    "profile",
                    "Profile",
                    "User profile and presence",
                    List.of("microsoft365-profile")),
                this::profile)
            .metric(
                new MetricInfo(
                    "mail",
                    "Mail",
                    "Inbox status and recent messages",
                    List.of("microsoft365-mail")),
                this::mail)
            .metric(
                new MetricInfo(
                    "calendar",
                    "Calendar",
                    "Today's events and upcoming meetings",
                    List.of("microsoft365-calendar")),
                this::calendar)
            .metric(
                new MetricInfo(
                    "tasks", "Tasks", "To Do tasks and lists", List.of("microsoft365-tasks")),
                this::tasks)
            .build();
  }

  @Override
  public String type() {
    return TYPE;
  }

  @Override
  public String displayName() {
    return "Microsoft 365";
  }

  @Override
  public ConnectionTestResult testConnection(IntegrationConfig config) {
    try {
      var me = withClient(config, client -> get(client, "/me"));
      var displayName = me.path("displayName").asText("");
      var mail = me.path("mail").asText("");
      return ConnectionTestResult.success(
          "Connected as " + displayName + " (" + mail + ")",
          Map.of("displayName", displayName, "mail", mail));
    } catch (RuntimeException e) {
      var error = UpstreamErrorTranslator.translate(e);
      log.warn("Microsoft 365 connection test failed for {}: {}", config.id(), error.getMessage());
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
    return Microsoft365Capabilities.CATALOG;
  }

  // --- metrics ---

  /** The profile is required; presence, manager and photo are each optional. */
  private MetricResult profile(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var meCall = plan.required("me", () -> get(client, "/me"));
          var presenceCall =
              plan.optional(
                  "presence",
                  () -> get(client, "/me/presence"),
                  objectMapper
                      .createObjectNode()
                      .put("availability", "Unknown")
                      .put("activity", "Unknown"));
          var managerCall =
              plan.<JsonNode>optional("manager", () -> get(client, "/me/manager"), null);
          var photoCall =
              plan.<String>optional(
                  "photo",
                  () -> {
                    var bytes =
                        client
                            .get()
                            .uri("/me/photo/$value")
                            .accept(MediaType.ALL)
                            .retrieve()
                            .body(byte[].class);
                    return bytes == null || bytes.length == 0
                        ? null
                        : "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(bytes);
                  },
                  null);
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var me = merged.get(meCall);
                var user = new LinkedHashMap<String, Object>();
                for (var field :
                    List.of(
                        "id",
                        "displayName",
                        "mail",
                        "jobTitle",
                        "department",
                        "officeLocation",
                        "mobilePhone")) {
                  user.put(field, me.path(field).isValueNode() ? me.path(field).asText() : null);
                }
                user.put("photo", merged.get(photoCall));
                var presence = merged.get(presenceCall);
                var data = new LinkedHashMap<String, Object>();
                data.put("user", user);
                data.put(
                    "presence",
                    Map.of(
                        "availability", presence.path("availability").asText("Unknown"),
                        "activity", presence.path("activity").asText("Unknown")));
                var manager = merged.get(managerCall);
                if (manager != null) {
                  data.put(
                      "manager",
                      Map.of(
                          "displayName", manager.path("displayName").asText(""),
                          "mail", manager.path("mail").asText("")));
                }
                return data;
              });
        });
  }

  private MetricResult mail(IntegrationConfig config) {
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var inboxCall = plan.required("inbox", () -> get(client, "/me/mailFolders/Inbox"));
          var messagesCall =
              plan.required(
                  "messages",
                  () ->
                      get(
                          client,
                          "/me/messages?$top={top}&$orderby={orderBy}",
                          10,
                          "receivedDateTime desc"));
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var inbox = merged.get(inboxCall);
                var messages = new ArrayList<Map<String, Object>>();
                for (var message : elements(merged.get(messagesCall).path("value"))) {
                  var sender = message.path("from").path("emailAddress");
                  var entry = new LinkedHashMap<String, Object>();
                  entry.put("id", message.path("id").asText());
                  entry.put(
                      "subject", nonBlank(message.path("subject").asText(""), "(No subject)"));
                  entry.put(
                      "from",
                      Map.of(
                          "name", nonBlank(sender.path("name").asText(""), "Unknown"),
                          "email", sender.path("address").asText("")));
                  entry.put("receivedDateTime", message.path("receivedDateTime").asText(null));
                  entry.put("isRead", message.path("isRead").asBoolean());
                  entry.put("hasAttachments", message.path("hasAttachments").asBoolean());
                  entry.put("preview", message.path("bodyPreview").asText(""));
                  entry.put("importance", message.path("importance").asText("normal"));
                  messages.add(entry);
                }
                var data = new LinkedHashMap<String, Object>();
                data.put("unreadCount", inbox.path("unreadItemCount").asLong());
                data.put("totalCount", inbox.path("totalItemCount").asLong());
                data.put("recentMessages", messages);
                return data;
              });
        });
  }

  /**
   * Today's events and the next seven days. Days are computed in the {@code timeZone} option
   * (default UTC); Graph returns event times in UTC.
   */
  private MetricResult calendar(IntegrationConfig config) {
    var zone = ZoneId.of(config.option("timeZone", "UTC"));
    var now = clock.instant();
    var startOfDay = LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
    var endOfDay = startOfDay.plus(Duration.ofDays(1));
    var endOfWeek = startOfDay.plus(Duration.ofDays(7));
    return withClient(
        config,
        client -> {
          var plan = aggregation.plan(timeout(config));
          var todayCall =
              plan.required(
                  "today",
                  () ->
                      get(
                          client,
                          CALENDAR_VIEW,
                          startOfDay.toString(),
                          endOfDay.toString(),
                          "start/dateTime"));
          var weekCall =
              plan.required(
                  "week",
                  () ->
                      get(
                          client,
                          CALENDAR_VIEW + "&$top={top}",
                          now.toString(),
                          endOfWeek.toString(),
                          "start/dateTime",
                          20));
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var today = events(merged.get(todayCall));
                var upcoming = events(merged.get(weekCall));
                var nowUtc = LocalDateTime.ofInstant(now, ZoneId.of("UTC"));
                Map<String, Object> nextMeeting = null;
                for (var event : upcoming) {
                  var end = graphDateTime((JsonNode) event.get("end"));
                  boolean allDay = Boolean.TRUE.equals(event.get("isAllDay"));
                  if (!allDay && end != null && end.isAfter(nowUtc)) {
                    nextMeeting = event;
                    break;
                  }
                }
                var stats = new LinkedHashMap<String, Object>();
                stats.put("todayCount", today.size());
                stats.put("weekCount", upcoming.size());
                stats.put("nextMeeting", nextMeeting);
                var data = new LinkedHashMap<String, Object>();
                data.put("todayEvents", today);
                data.put("upcomingEvents", upcoming);
                data.put("stats", stats);
                return data;
              });
        });
  }

  /**
   * To Do lists, each with up to 50 tasks. A list whose tasks cannot be read is kept with no tasks
   * and reported as a warning.
   */
  private MetricResult tasks(IntegrationConfig config) {
    int listLimit = config.intOption("taskListLimit", 20);
    return withClient(
        config,
        client -> {
          var lists = elements(get(client, "/me/todo/lists").path("value"));
          var shown = lists.subList(0, Math.min(listLimit, lists.size()));
          var plan = aggregation.plan(timeout(config));
          var taskCalls = new ArrayList<SubCall<JsonNode>>();
          for (var list : shown) {
            var listId = list.path("id").asText();
            taskCalls.add(
                plan.optional(
                    "tasks:" + listId,
                    () -> get(client, "/me/todo/lists/{listId}/tasks?$top={top}", listId, 50),
                    objectMapper.createObjectNode().set("value", emptyArray())));
          }
          var merged = plan.execute();
          return merged.toResult(
              () -> {
                var today = LocalDate.ofInstant(clock.instant(), ZoneId.of("UTC"));
                var nowUtc = LocalDateTime.ofInstant(clock.instant(), ZoneId.of("UTC"));
                var todoLists = new ArrayList<Map<String, Object>>();
                long total = 0;
                long completed = 0;
                long overdue = 0;
                long dueToday = 0;
                for (int i = 0; i < shown.size(); i++) {
                  var list = shown.get(i);
                  var tasks = new ArrayList<Map<String, Object>>();
                  for (var task : elements(merged.get(taskCalls.get(i)).path("value"))) {
                    var due = graphDateTime(task.path("dueDateTime"));
                    boolean done = "completed".equals(task.path("status").asText());
                    total++;
                    if (done) {
                      completed++;
                    } else if (due != null) {
                      if (due.isBefore(nowUtc)) {
                        overdue++;
                      }
                      if (due.toLocalDate().equals(today)) {
                        dueToday++;
                      }
                    }
                    var entry = new LinkedHashMap<String, Object>();
                    entry.put("id", task.path("id").asText());
                    entry.put("title", task.path("title").asText(""));
                    entry.put("status", task.path("status").asText());
                    entry.put("importance", task.path("importance").asText("normal"));
                    entry.put(
                        "dueDateTime", task.path("dueDateTime").path("dateTime").asText(null));
                    entry.put("createdDateTime", task.path("createdDateTime").asText(null));
                    entry.put(
                        "completedDateTime",
                        task.path("completedDateTime").path("dateTime").asText(null));
                    tasks.add(entry);
                  }
                  var entry = new LinkedHashMap<String, Object>();
                  entry.put("id", list.path("id").asText());
                  entry.put("displayName", list.path("displayName").asText(""));
                  entry.put("isOwner", list.path("isOwner").asBoolean());
                  entry.put("isShared", list.path("isShared").asBoolean());
                  entry.put("tasks", tasks);
                  todoLists.add(entry);
                }
                var stats = new LinkedHashMap<String, Object>();
                stats.put("total", total);
                stats.put("completed", completed);
                stats.put("pending", total - completed);
                stats.put("overdue", overdue);
                stats.put("dueToday", dueToday);
                return Map.of("todoLists", todoLists, "stats", stats);
              });
        });
  }

  private static List<Map<String, Object>> events(JsonNode response) {
    var events = new ArrayList<Map<String, Object>>();
    for (var event : elements(response.path("value"))) {
      var entry = new LinkedHashMap<String, Object>();
      entry.put("id", event.path("id").asText());
      entry.put("subject", nonBlank(event.path("subject").asText(""), "(No title)"));
      entry.put("start", event.path("start"));
      entry.put("end", event.path("end"));
      entry.put("location", event.path("location").path("displayName").asText(null));
      entry.put("isAllDay", event.path("isAllDay").asBoolean());
      entry.put("showAs", event.path("showAs").asText(null));
      var organizer = event.path("organizer").path("emailAddress");
      if (!organizer.isMissingNode()) {
        entry.put(
            "organizer",
            Map.of(
                "name", organizer.path("name").asText(""),
                "email", organizer.path("address").asText("")));
      }
      var attendees = new ArrayList<Map<String, Object>>();
      for (var attendee : elements(event.path("attendees"))) {
        attendees.add(
            Map.of(
                "name", attendee.path("emailAddress").path("name").asText(""),
                "email", attendee.path("emailAddress").path("address").asText(""),
                "response", attendee.path("status").path("response").asText("none")));
      }
      entry.put("attendees", attendees);
      entry.put("isOnlineMeeting", event.path("isOnlineMeeting").asBoolean());
      entry.put("onlineMeetingUrl", event.path("onlineMeetingUrl").asText(null));
      events.add(entry);
    }
    return events;
  }

  /** Graph {@code dateTimeTimeZone} value as a local date-time, or {@code null}. */
  static LocalDateTime graphDateTime(JsonNode value) {
    var text = value == null ? null : value.path("dateTime").asText(null);
    if (text == null || text.isBlank()) {
      return null;
    }
    try {
      return LocalDateTime.parse(text);
    } catch (DateTimeParseException e) {
      log.debug("Unparseable Graph date-time {}", text);
      return null;
    }
  }

  private static String nonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  // --- plumbing ---

  private <T> T withClient(IntegrationConfig config, Function<RestClient, T> call) {
    return credentialManager.withCredential(
        config, authenticator, credential -> call.apply(client(config, credential)));
  }

  private RestClient client(IntegrationConfig config, CachedCredential credential) {
    return clientFactory.create(
        config,
        config.option("graphUrl", DEFAULT_GRAPH_URL),
        timeout(config),
        headers -> {
          headers.setBearerAuth(credential.material());
          headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        });
  }

  private static Duration timeout(IntegrationConfig config) {
    return config.timeoutOr(DEFAULT_TIMEOUT);
  }

  private static JsonNode get(RestClient client, String uri, Object... variables) {
    return client.get().uri(uri, variables).retrieve().body(JsonNode.class);
  }
}
