package io.b2mash.dashhub.integration.auth;

import com.fasterxml.jackson.databind.JsonNode;
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
import org.springframework.web.client.HttpClientErrorException;

/**
 * Exchanges configured credentials (username/password, or an OAuth refresh token) for a bearer
 * token at a token endpoint. The token lives for the server-declared {@code expires_in}, or for
 * the adapter's default when the server does not say.
 */
public final class BearerExchangeAuthenticator implements SessionAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(BearerExchangeAuthenticator.class);

  private final UpstreamClientFactory clientFactory;
  private final Clock clock;
  private final Function<IntegrationConfig, String> baseUrl;
  private final Function<IntegrationConfig, String> tokenPath;
  private final Function<IntegrationConfig, Object> requestBody;
  private final MediaType contentType;
  private final String tokenField;
  private final String expiresInField;
  private final Duration defaultTtl;
  private final Duration timeout;
  private final AuthenticationException.Reason rejectionReason;

  private BearerExchangeAuthenticator(Builder builder) {
    this.clientFactory = Objects.requireNonNull(builder.clientFactory);
    this.clock = Objects.requireNonNull(builder.clock);
    this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl");
    this.tokenPath = Objects.requireNonNull(builder.tokenPath, "tokenPath");
    this.requestBody = Objects.requireNonNull(builder.requestBody, "requestBody");
    this.contentType = builder.contentType;
    this.tokenField = builder.tokenField;
    this.expiresInField = builder.expiresInField;
    this.defaultTtl = builder.defaultTtl;
    this.timeout = builder.timeout;
    this.rejectionReason = builder.rejectionReason;
  }

  public static Builder builder(UpstreamClientFactory clientFactory, Clock clock) {
    return new Builder(clientFactory, clock);
  }

  @Override
  public CredentialKind kind() {
    return CredentialKind.BEARER_TOKEN;
  }

  @Override
  public CachedCredential authenticate(IntegrationConfig config) {
    var client =
        clientFactory.create(config, baseUrl.apply(config), config.timeoutOr(timeout));
    JsonNode response;
    try {
      response =
          client
              .post()
              .uri(tokenPath.apply(config))
              .contentType(contentType)
              .body(requestBody.apply(config))
              .retrieve()
              .body(JsonNode.class);
    } catch (HttpClientErrorException e) {
      throw rejected(config, e);
    } catch (RuntimeException e) {
      throw UpstreamErrorTranslator.translate(e);
    }

    var token = response != null ? response.path(tokenField).asText(null) : null;
    if (token == null || token.isBlank()) {
      throw new AuthenticationException(
          AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Token endpoint response for " + config.id() + " did not contain " + tokenField);
    }
    var ttl = defaultTtl;
    var expiresIn = response.path(expiresInField);
    if (expiresIn.canConvertToLong() && expiresIn.asLong() > 0) {
      ttl = Duration.ofSeconds(expiresIn.asLong());
    }
    log.info(
        "Obtained bearer token for {} integration {} (ttl {})", config.type(), config.id(), ttl);
    return CachedCredential.expiringIn(token, clock.instant(), ttl, kind());
  }

  private AuthenticationException rejected(IntegrationConfig config, HttpClientErrorException e) {
    int status = e.getStatusCode().value();
    var reason =
        status == 403 ? AuthenticationException.Reason.FORBIDDEN : rejectionReason;
    return new AuthenticationException(
        reason,
        "Token endpoint for " + config.id() + " rejected the credentials (HTTP " + status + ")",
        e);
  }

  public static final class Builder {

    private final UpstreamClientFactory clientFactory;
    private final Clock clock;
    private Function<IntegrationConfig, String> baseUrl;
    private Function<IntegrationConfig, String> tokenPath;
    private Function<IntegrationConfig, Object> requestBody;
    private MediaType contentType = MediaType.APPLICATION_JSON;
    private String tokenField = "access_token";
    private String expiresInField = "expires_in";
    private Duration defaultTtl = Duration.ofHours(1);
    private Duration timeout = Duration.ofSeconds(15);
    private AuthenticationException.Reason rejectionReason =
        AuthenticationException.Reason.INVALID_CREDENTIALS;

    private Builder(UpstreamClientFactory clientFactory, Clock clock) {
      this.clientFactory = clientFactory;
      this.clock = clock;
    }

    public Builder baseUrl(Function<IntegrationConfig, String> baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder tokenPath(Function<IntegrationConfig, String> tokenPath) {
      this.tokenPath = tokenPath;
      return this;
    }

    /** JSON request body, typically a {@code Map}. */
    public Builder jsonBody(Function<IntegrationConfig, Object> requestBody) {
      this.requestBody = requestBody;
      this.contentType = MediaType.APPLICATION_JSON;
      return this;
    }

    /** Form-encoded request body, a {@code MultiValueMap<String, String>}. */
    public Builder formBody(Function<IntegrationConfig, Object> requestBody) {
      this.requestBody = requestBody;
      this.contentType = MediaType.APPLICATION_FORM_URLENCODED;
      return this;
    }

    public Builder tokenField(String tokenField) {
      this.tokenField = tokenField;
      return this;
    }

    public Builder expiresInField(String expiresInField) {
      this.expiresInField = expiresInField;
      return this;
    }

    public Builder defaultTtl(Duration defaultTtl) {
      this.defaultTtl = defaultTtl;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Exchanging a refresh token: a 4xx means the grant itself has expired or been revoked. */
    public Builder refreshGrant() {
      this.rejectionReason = AuthenticationException.Reason.TOKEN_EXPIRED;
      return this;
    }

    public BearerExchangeAuthenticator build() {
      return new BearerExchangeAuthenticator(this);
    }
  }
}
