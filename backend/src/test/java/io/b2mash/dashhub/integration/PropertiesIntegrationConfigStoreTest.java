package io.b2mash.dashhub.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.OAuthCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.IntegrationProperties.Instance;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PropertiesIntegrationConfigStoreTest {

  @Test
  void apiKeyTakesPrecedenceOverOtherCredentials() {
    var store = store(instance("git", "gitea", "token", "admin", null, null));

    assertThat(store.findById("git").orElseThrow().credentials())
        .isEqualTo(new ApiKeyCredentials("token"));
  }

  @Test
  void oauthNeedsClientIdAndRefreshToken() {
    var store =
        store(
            instance("m365", "microsoft365", null, null, "client-1", "rt-1"),
            instance("qbt", "qbittorrent", null, "admin", "client-2", null));

    assertThat(store.findById("m365").orElseThrow().credentials())
        .isInstanceOf(OAuthCredentials.class);
    assertThat(store.findById("qbt").orElseThrow().credentials())
        .isEqualTo(new UsernamePasswordCredentials("admin", "secret"));
  }

  @Test
  void instanceWithoutCredentials_hasNone() {
    var store = store(instance("kvm", "pikvm", null, null, null, null));

    var config = store.findById("kvm").orElseThrow();

    assertThat(config.credentials()).isNull();
    assertThat(config.name()).isEqualTo("kvm");
  }

  @Test
  void findAll_keepsConfiguredOrder() {
    var store =
        store(
            instance("qbt", "qbittorrent", null, "admin", null, null),
            instance("git", "gitea", "token", null, null, null));

    assertThat(store.findAll()).extracting(IntegrationConfig::id).containsExactly("qbt", "git");
    assertThat(store.findById("nope")).isEmpty();
  }

  @Test
  void duplicateId_failsAtStartup() {
    assertThatThrownBy(
            () ->
                store(
                    instance("git", "gitea", "a", null, null, null),
                    instance("git", "gitea", "b", null, null, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate integration instance id: git");
  }

  @Test
  void missingType_failsAtStartup() {
    assertThatThrownBy(() -> store(instance("git", " ", "a", null, null, null)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("has no type");
  }

  private static PropertiesIntegrationConfigStore store(Instance... instances) {
    return new PropertiesIntegrationConfigStore(
        new IntegrationProperties(
            Duration.ofSeconds(60),
            1000,
            Duration.ofSeconds(30),
            Duration.ofSeconds(10),
            8,
            new IntegrationProperties.ExecutorSettings(8, 32, 200),
            List.of(instances)));
  }

  private static Instance instance(
      String id,
      String type,
      String apiKey,
      String username,
      String clientId,
      String refreshToken) {
    return new Instance(
        id,
        type,
        null,
        "host.local",
        null,
        true,
        null,
        true,
        apiKey,
        username,
        "secret",
        clientId,
        "client-secret",
        refreshToken,
        Map.of());
  }
}
