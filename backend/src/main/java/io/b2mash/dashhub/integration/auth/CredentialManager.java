package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;
import io.b2mash.dashhub.integration.error.AuthenticationException;
import io.b2mash.dashhub.integration.error.UpstreamErrorTranslator;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;

/**
 * Runs upstream calls with a cached credential and owns the per-request authentication state
 * machine: authenticate on a cache miss, and on a 401/403 drop the credential, authenticate once
 * more and retry the call exactly once.
 */
@Component
public class CredentialManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final CredentialCache cache;

  public CredentialManager(CredentialCache cache) {
    this.cache = cache;
  }

  public CachedCredential ensureCredential(
      IntegrationConfig config, SessionAuthenticator authenticator) {
    return cache.ensure(
        IntegrationIdentity.of(config),
        () -> {
          log.debug("Authenticating {} integration {}", config.type(), config.id());
          return authenticator.authenticate(config);
        });
  }

  /**
   * Applies {@code call} with a valid credential. An auth rejection from the first attempt triggers
   * one re-authentication and one retry; a rejection from the retry, or from a credential that
   * cannot be refreshed, surfaces as {@link AuthenticationException}. Any other exception from
   * {@code call} propagates unchanged.
   *
   * <p>Each attempt runs inside a {@link CredentialAttempt}. A rejection that {@code call} absorbs
   * through {@link CredentialAttempt#recordRejection()} still drops the credential.
   */
  public <T> T withCredential(
      IntegrationConfig config,
      SessionAuthenticator authenticator,
      Function<CachedCredential, T> call) {
    var identity = IntegrationIdentity.of(config);
    var credential = ensureCredential(config, authenticator);
    try {
      return attempt(identity, credential, authenticator.canRefresh(), call);
    } catch (HttpStatusCodeException e) {
      if (!UpstreamErrorTranslator.isAuthRejection(e)) {
        throw e;
      }
      cache.invalidate(identity, credential);
      if (!authenticator.canRefresh()) {
        throw rejected(config, e, false);
      }
      log.info(
          "{} integration {} rejected cached {} with HTTP {}; re-authenticating",
          config.type(),
          config.id(),
          credential.kind(),
          e.getStatusCode().value());
    }

    var refreshed = ensureCredential(config, authenticator);
    try {
      return attempt(identity, refreshed, false, call);
    } catch (HttpStatusCodeException e) {
      if (!UpstreamErrorTranslator.isAuthRejection(e)) {
        throw e;
      }
      cache.invalidate(identity, refreshed);
      throw rejected(config, e, true);
    }
  }

  private <T> T attempt(
      IntegrationIdentity identity,
      CachedCredential credential,
      boolean retryable,
      Function<CachedCredential, T> call) {
    var attempt = CredentialAttempt.of(retryable);
    T result = attempt.run(() -> call.apply(credential));
    if (attempt.rejected()) {
      log.debug("Dropping {} after an absorbed auth rejection", credential.kind());
      cache.invalidate(identity, credential);
    }
    return result;
  }

  public void invalidate(IntegrationConfig config) {
    cache.invalidate(IntegrationIdentity.of(config));
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  public long cachedCredentials() {
    return cache.size();
  }

  private static AuthenticationException rejected(
      IntegrationConfig config, HttpStatusCodeException e, boolean afterRefresh) {
    int status = e.getStatusCode().value();
    var reason =
        status == 403
            ? AuthenticationException.Reason.FORBIDDEN
            : AuthenticationException.Reason.INVALID_CREDENTIALS;
    return new AuthenticationException(
        reason,
        config.type()
            + " integration "
            + config.id()
            + " rejected the credentials with HTTP "
            + status
            + (afterRefresh ? " after re-authentication" : ""),
        e);
  }
}
