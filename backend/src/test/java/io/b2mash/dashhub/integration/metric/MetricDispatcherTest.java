package io.b2mash.dashhub.integration.metric;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.error.AuthenticationException;
import io.b2mash.dashhub.integration.error.ErrorCategory;
import io.b2mash.dashhub.integration.error.UnknownMetricException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

class MetricDispatcherTest {

  private static final IntegrationConfig CONFIG =
      new IntegrationConfig(
          "gitea-home", "gitea", "Gitea", "git.local", null, true, null, true, null, null);

  private final MetricDispatcher dispatcher =
      MetricDispatcher.builder("gitea")
          .metric(info("overview"), config -> MetricResult.success(Map.of("user", "alice")))
          .metric(
              info("issues"),
              config -> {
                throw new ResourceAccessException("Connection refused");
              })
          .metric(
              info("activity"),
              config -> {
                throw new AuthenticationException(
                    AuthenticationException.Reason.INVALID_CREDENTIALS, "token rejected");
              })
          .build();

  @Test
  void knownMetric_runsItsHandler() {
    var result = dispatcher.dispatch(CONFIG, "overview");

    assertThat(result).isEqualTo(MetricResult.success(Map.of("user", "alice")));
  }

  @Test
  void unknownMetric_listsValidMetrics() {
    assertThatThrownBy(() -> dispatcher.dispatch(CONFIG, "bogus"))
        .isInstanceOfSatisfying(
            UnknownMetricException.class,
            e -> {
              assertThat(e.validMetrics()).containsExactly("overview", "issues", "activity");
              assertThat(e.getMessage()).contains("bogus").contains("overview, issues, activity");
            });
  }

  @Test
  void handlerException_becomesCategorisedFailure() {
    var network = dispatcher.dispatch(CONFIG, "issues");
    var auth = dispatcher.dispatch(CONFIG, "activity");

    assertThat(network).isInstanceOf(MetricResult.Failure.class);
    assertThat(((MetricResult.Failure) network).error().getCategory())
        .isEqualTo(ErrorCategory.NETWORK);
    assertThat(((MetricResult.Failure) auth).error().getCategory())
        .isEqualTo(ErrorCategory.AUTHENTICATION);
  }

  @Test
  void metricList_isStableAndOrdered() {
    assertThat(dispatcher.metrics())
        .extracting(MetricInfo::id)
        .containsExactly("overview", "issues", "activity");
    assertThat(dispatcher.metrics()).isSameAs(dispatcher.metrics());
  }

  @Test
  void duplicateMetric_isRejectedAtBuildTime() {
    var builder =
        MetricDispatcher.builder("gitea")
            .metric(info("overview"), config -> MetricResult.success(Map.of()));

    assertThatThrownBy(
            () -> builder.metric(info("overview"), config -> MetricResult.success(Map.of())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void resultWithWarnings_isPartialSuccess() {
    assertThat(MetricResult.of(Map.of("a", 1), List.of("cpu unavailable")))
        .isInstanceOf(MetricResult.PartialSuccess.class);
    assertThat(MetricResult.of(Map.of("a", 1), List.of())).isInstanceOf(MetricResult.Success.class);
  }

  private static MetricInfo info(String id) {
    return new MetricInfo(id, id, id + " metric", List.of("gitea-" + id));
  }
}
