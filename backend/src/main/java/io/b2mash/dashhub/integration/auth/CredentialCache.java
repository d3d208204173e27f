package io.b2mash.dashhub.integration.auth;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.dashhub.integration.IntegrationProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide, expiry-aware store of upstream credential material keyed by {@link
 * IntegrationIdentity}.
 *
 * <p>Entries are futures. A caller that finds no usable entry installs an incomplete future
 * atomically and then authenticates outside of any lock; every concurrent caller for the same
 * identity finds that future and waits on it, so an identity is authenticated at most once at a
 * time. Identities never wait on each other.
 */
@Component
public class CredentialCache {

  private static final Logger log = LoggerFactory.getLogger(CredentialCache.class);

  private final AsyncCache<IntegrationIdentity, CachedCredential> entries;
  private final Duration safetyBuffer;
  private final Clock clock;

  @Autowired
  public CredentialCache(IntegrationProperties properties) {
    this(
        properties.credentialSafetyBuffer(),
        properties.credentialCacheMaxSize(),
        Clock.systemUTC());
  }

  public CredentialCache(Duration safetyBuffer, long maximumSize, Clock clock) {
    this.safetyBuffer = safetyBuffer;
    this.clock = clock;
    this.entries = Caffeine.newBuilder().maximumSize(maximumSize).buildAsync();
  }

  /** Returns the usable credential for {@code identity}, or {@code null}. Never blocks. */
  public CachedCredential get(IntegrationIdentity identity) {
    var future = entries.getIfPresent(identity);
    return isUsable(future) ? future.join() : null;
  }

  /**
   * Returns a usable credential, running {@code authenticate} only when none is cached and no
   * other caller is already authenticating this identity. Failures are not cached; every waiter
   * of a failed attempt receives the same exception.
   */
  public CachedCredential ensure(
      IntegrationIdentity identity, Supplier<CachedCredential> authenticate) {
    var cached = get(identity);
    if (cached != null) {
      return cached;
    }

    var pending = new CompletableFuture<CachedCredential>();
    var winner =
        entries
            .asMap()
            .compute(
                identity,
                (key, existing) ->
                    existing != null && (!existing.isDone() || isUsable(existing))
                        ? existing
                        : pending);
    if (winner != pending) {
      return await(winner);
    }

    try {
      var credential = authenticate.get();
      if (credential == null) {
        throw new IllegalStateException("Authenticator returned no credential for " + identity);
      }
      pending.complete(credential);
      log.debug("Cached {} for {} integration at {}", credential, identity.type(), identity.host());
      return credential;
    } catch (RuntimeException e) {
      entries.asMap().remove(identity, pending);
      pending.completeExceptionally(e);
      throw e;
    }
  }

  public void invalidate(IntegrationIdentity identity) {
    entries.synchronous().invalidate(identity);
  }

  /**
   * Drops the entry only if it still holds {@code stale}, so a credential another request has
   * already refreshed is left in place.
   */
  public void invalidate(IntegrationIdentity identity, CachedCredential stale) {
    entries
        .asMap()
        .computeIfPresent(
            identity,
            (key, current) ->
                current.isDone() && !current.isCompletedExceptionally() && current.join() == stale
                    ? null
                    : current);
  }

  public void invalidateAll() {
    entries.synchronous().invalidateAll();
  }

  public long size() {
    return entries.synchronous().estimatedSize();
  }

  private boolean isUsable(CompletableFuture<CachedCredential> future) {
    return future != null
        && future.isDone()
        && !future.isCompletedExceptionally()
        && future.join().isUsableAt(clock.instant(), safetyBuffer);
  }

  private static CachedCredential await(CompletableFuture<CachedCredential> inFlight) {
    try {
      return inFlight.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
