package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.IntegrationCredentials.ApiKeyCredentials;
import io.b2mash.dashhub.integration.IntegrationCredentials.UsernamePasswordCredentials;
import io.b2mash.dashhub.integration.error.ConfigurationException;
import java.time.Clock;
import java.util.function.Function;

/**
 * Credential taken verbatim from configuration. No I/O, never expires, and re-running it after a
 * 401 would only produce the same material again.
 */
public final class StaticTokenAuthenticator implements SessionAuthenticator {

  private final Function<IntegrationConfig, String> materialExtractor;
  private final Clock clock;

  public StaticTokenAuthenticator(
      Function<IntegrationConfig, String> materialExtractor, Clock clock) {
    this.materialExtractor = materialExtractor;
    this.clock = clock;
  }

  /** Uses the configured API key. */
  public static StaticTokenAuthenticator apiKey(Clock clock) {
    return new StaticTokenAuthenticator(
        config -> config.requireCredentials(ApiKeyCredentials.class).apiKey(), clock);
  }

  /**
   * Uses the configured username and password as a {@code username:password} pair; see {@link
   * #splitUserPassword(String)}.
   */
  public static StaticTokenAuthenticator userPassword(Clock clock) {
    return new StaticTokenAuthenticator(
        config -> {
          var credentials = config.requireCredentials(UsernamePasswordCredentials.class);
          if (credentials.username().contains(":")) {
            throw new ConfigurationException(config.id(), "username must not contain ':'");
          }
          return credentials.username() + ":" + nullToEmpty(credentials.password());
        },
        clock);
  }

  /** Splits material produced by {@link #userPassword(Clock)} back into its two parts. */
  public static String[] splitUserPassword(String material) {
    int separator = material.indexOf(':');
    return new String[] {material.substring(0, separator), material.substring(separator + 1)};
  }

  @Override
  public CredentialKind kind() {
    return CredentialKind.STATIC_TOKEN;
  }

  @Override
  public CachedCredential authenticate(IntegrationConfig config) {
    var material = materialExtractor.apply(config);
    if (material == null || material.isBlank()) {
      throw new ConfigurationException(config.id(), "no token configured");
    }
    return CachedCredential.nonExpiring(material, clock.instant(), kind());
  }

  @Override
  public boolean canRefresh() {
    return false;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
