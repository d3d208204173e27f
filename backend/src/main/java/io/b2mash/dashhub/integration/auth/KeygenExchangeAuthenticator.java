package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.error.AuthenticationException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;

/**
 * Posts username and password to a key-generation endpoint and keeps the returned API key for a
 * fixed lifetime. Parameters travel form-encoded in the request body rather than in the URL.
 */
public final class KeygenExchangeAuthenticator implements SessionAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(KeygenExchangeAuthenticator.class);

  private final UpstreamClientFactory clientFactory;
  private final Clock clock;
  private final Function<IntegrationConfig, String> baseUrl;
  private final String keygenPath;
  private final Function<IntegrationConfig, MultiValueMap<String, String>> form;
  private final Function<String, String> keyExtractor;
  private final Duration ttl;
  private final Duration timeout;

  public KeygenExchangeAuthenticator(
      UpstreamClientFactory clientFactory,
      Clock clock,
      Function<IntegrationConfig, String> baseUrl,
      String keygenPath,
      Function<IntegrationConfig, MultiValueMap<String, String>> form,
      Function<String, String> keyExtractor,
      Duration ttl,
      Duration timeout) {
    this.clientFactory = Objects.requireNonNull(clientFactory);
    this.clock = Objects.requireNonNull(clock);
    this.baseUrl = baseUrl;
    this.keygenPath = keygenPath;
    this.form = form;
    this.keyExtractor = keyExtractor;
    this.ttl = ttl;
    this.timeout = timeout;
  }

  @Override
  public CredentialKind kind() {
    return CredentialKind.API_KEY;
  }

  @Override
  public CachedCredential authenticate(IntegrationConfig config) {
    var client = clientFactory.create(config, baseUrl.apply(config), config.timeoutOr(timeout));
    String body;
    try {
      body =
          client
              .post()
              .uri(keygenPath)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form.apply(config))
              .retrieve()
              .body(String.class);
    } catch (HttpClientErrorException e) {
      throw new AuthenticationException(
          AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Key generation for " + config.id() + " failed with HTTP " + e.getStatusCode().value(),
          e);
    } catch (RuntimeException e) {
      throw UpstreamErrorTranslator.translate(e);
    }

    var key = body != null ? keyExtractor.apply(body) : null;
    if (key == null || key.isBlank()) {
      throw new AuthenticationException(
          AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Key generation for " + config.id() + " returned no API key");
    }
    log.info("Generated API key for {} integration {} (ttl {})", config.type(), config.id(), ttl);
    return CachedCredential.expiringIn(key, clock.instant(), ttl, kind());
  }
}
