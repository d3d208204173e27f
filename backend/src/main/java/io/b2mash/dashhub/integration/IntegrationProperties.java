package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.OAuthCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** Integration framework settings and the configured upstream instances. */
@ConfigurationProperties(prefix = "dashhub.integration")
public record IntegrationProperties(
    @DefaultValue("60s") Duration credentialSafetyBuffer,
    @DefaultValue("1000") long credentialCacheMaxSize,
    @DefaultValue("30s") Duration defaultTimeout,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("8") int maxFanOut,
    @DefaultValue ExecutorSettings executor,
    List<Instance> instances) {

  public IntegrationProperties {
    instances = instances == null ? List.of() : List.copyOf(instances);
  }

  public record ExecutorSettings(
      @DefaultValue("8") int corePoolSize,
      @DefaultValue("32") int maxPoolSize,
      @DefaultValue("200") int queueCapacity) {}

  public record Instance(
      String id,
      String type,
      String name,
      String host,
      Integer port,
      @DefaultValue("true") boolean verifySsl,
      Duration timeout,
      @DefaultValue("true") boolean enabled,
      String apiKey,
      String username,
      String password,
      String clientId,
      String clientSecret,
      String refreshToken,
      Map<String, String> options) {

    IntegrationConfig toConfig() {
      return new IntegrationConfig(
          id,
          type,
          name != null ? name : id,
          host,
          port,
          verifySsl,
          timeout,
          enabled,
          credentials(),
          options);
    }

    private IntegrationCredentials credentials() {
      if (hasText(apiKey)) {
        return new ApiKeyCredentials(apiKey);
      }
      if (hasText(clientId) && hasText(refreshToken)) {
        return new OAuthCredentials(clientId, clientSecret, refreshToken);
      }
      if (hasText(username)) {
        return new UsernamePasswordCredentials(username, password);
      }
      return null;
    }

    private static boolean hasText(String value) {
      return value != null && !value.isBlank();
    }
  }
}
