package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.error.AuthenticationException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import io.b2mash.dashhub.integration.http.UpstreamClientFactory;
import java.net.HttpCookie;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;

/**
 * Form login that yields a session cookie. The cookie is cached for its declared {@code
 * Max-Age}/{@code Expires} when the server sends one, otherwise for the configured fallback
 * lifetime.
 */
public final class SessionCookieAuthenticator implements SessionAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(SessionCookieAuthenticator.class);

  private final UpstreamClientFactory clientFactory;
  private final Clock clock;
  private final Function<IntegrationConfig, String> baseUrl;
  private final String loginPath;
  private final Function<IntegrationConfig, MultiValueMap<String, String>> form;
  private final String cookieName;
  private final Predicate<String> rejectedBody;
  private final Function<IntegrationConfig, HttpHeaders> extraHeaders;
  private final Duration fallbackTtl;
  private final Duration timeout;

  private SessionCookieAuthenticator(Builder builder) {
    this.clientFactory = Objects.requireNonNull(builder.clientFactory);
    this.clock = Objects.requireNonNull(builder.clock);
    this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl");
    this.loginPath = Objects.requireNonNull(builder.loginPath, "loginPath");
    this.form = Objects.requireNonNull(builder.form, "form");
    this.cookieName = Objects.requireNonNull(builder.cookieName, "cookieName");
    this.rejectedBody = builder.rejectedBody;
    this.extraHeaders = builder.extraHeaders;
    this.fallbackTtl = builder.fallbackTtl;
    this.timeout = builder.timeout;
  }

  public static Builder builder(UpstreamClientFactory clientFactory, Clock clock) {
    return new Builder(clientFactory, clock);
  }

  @Override
  public CredentialKind kind() {
    return CredentialKind.SESSION_COOKIE;
  }

  @Override
  public CachedCredential authenticate(IntegrationConfig config) {
    var client =
        clientFactory.create(
            config,
            baseUrl.apply(config),
            config.timeoutOr(timeout),
            headers -> headers.addAll(extraHeaders.apply(config)));
    ResponseEntity<String> response;
    try {
      response =
          client
              .post()
              .uri(loginPath)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form.apply(config))
              .retrieve()
              .toEntity(String.class);
    } catch (HttpClientErrorException e) {
      throw new AuthenticationException(
          e.getStatusCode().value() == 403
              ? AuthenticationException.Reason.FORBIDDEN
              : AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Login to " + config.id() + " failed with HTTP " + e.getStatusCode().value(),
          e);
    } catch (RuntimeException e) {
      throw UpstreamErrorTranslator.translate(e);
    }

    var body = response.getBody() != null ? response.getBody().trim() : "";
    if (rejectedBody.test(body)) {
      throw new AuthenticationException(
          AuthenticationException.Reason.INVALID_CREDENTIALS,
          "Login to " + config.id() + " was rejected: invalid username or password");
    }

    var cookie =
        findCookie(response.getHeaders().getOrEmpty(HttpHeaders.SET_COOKIE))
            .orElseThrow(
                () ->
                    new AuthenticationException(
                        AuthenticationException.Reason.INVALID_CREDENTIALS,
                        "Login to "
                            + config.id()
                            + " returned no "
                            + cookieName
                            + " session cookie"));

    var ttl = cookie.getMaxAge() > 0 ? Duration.ofSeconds(cookie.getMaxAge()) : fallbackTtl;
    log.info(
        "Opened {} session for {} integration {} (ttl {}{})",
        cookieName,
        config.type(),
        config.id(),
        ttl,
        cookie.getMaxAge() > 0 ? "" : ", assumed");
    return CachedCredential.expiringIn(
        cookieName + "=" + cookie.getValue(), clock.instant(), ttl, kind());
  }

  private Optional<HttpCookie> findCookie(List<String> setCookieHeaders) {
    for (var header : setCookieHeaders) {
      List<HttpCookie> cookies;
      try {
        cookies = HttpCookie.parse(header);
      } catch (IllegalArgumentException e) {
        log.debug("Ignoring unparseable Set-Cookie header: {}", e.getMessage());
        continue;
      }
      for (var cookie : cookies) {
        if (cookieName.equals(cookie.getName()) && !cookie.getValue().isEmpty()) {
          return Optional.of(cookie);
        }
      }
    }
    return Optional.empty();
  }

  public static final class Builder {

    private final UpstreamClientFactory clientFactory;
    private final Clock clock;
    private Function<IntegrationConfig, String> baseUrl;
    private String loginPath;
    private Function<IntegrationConfig, MultiValueMap<String, String>> form;
    private String cookieName;
    private Predicate<String> rejectedBody = body -> false;
    private Function<IntegrationConfig, HttpHeaders> extraHeaders = config -> new HttpHeaders();
    private Duration fallbackTtl = Duration.ofMinutes(30);
    private Duration timeout = Duration.ofSeconds(10);

    private Builder(UpstreamClientFactory clientFactory, Clock clock) {
      this.clientFactory = clientFactory;
      this.clock = clock;
    }

    public Builder baseUrl(Function<IntegrationConfig, String> baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder loginPath(String loginPath) {
      this.loginPath = loginPath;
      return this;
    }

    public Builder form(Function<IntegrationConfig, MultiValueMap<String, String>> form) {
      this.form = form;
      return this;
    }

    public Builder cookieName(String cookieName) {
      this.cookieName = cookieName;
      return this;
    }

    /** Some services answer a bad login with 200 and a sentinel body. */
    public Builder rejectedBody(Predicate<String> rejectedBody) {
      this.rejectedBody = rejectedBody;
      return this;
    }

    public Builder extraHeaders(Function<IntegrationConfig, HttpHeaders> extraHeaders) {
      this.extraHeaders = extraHeaders;
      return this;
    }

    public Builder fallbackTtl(Duration fallbackTtl) {
      this.fallbackTtl = fallbackTtl;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public SessionCookieAuthenticator build() {
      return new SessionCookieAuthenticator(this);
    }
  }
}
