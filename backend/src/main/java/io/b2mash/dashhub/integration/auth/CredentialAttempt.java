package io.b2mash.dashhub.integration.auth;

import java.util.function.Supplier;

/**
 * State of the credential attempt running on the current thread. Bound by {@link
 * CredentialManager} around each call, read by code that folds several upstream responses into
 * one result.
 *
 * <p>A retryable attempt is one whose auth rejection can still be answered with a fresh credential.
 * Outside any attempt, nothing is retryable.
 */
public final class CredentialAttempt {

  private static final ThreadLocal<CredentialAttempt> CURRENT = new ThreadLocal<>();

  private final boolean retryable;
  private boolean rejected;

  private CredentialAttempt(boolean retryable) {
    this.retryable = retryable;
  }

  /** Whether an auth rejection should be rethrown so the credential can be replaced. */
  public static boolean isRetryable() {
    var attempt = CURRENT.get();
    return attempt != null && attempt.retryable;
  }

  /** Notes a 401/403 that was absorbed instead of rethrown; the credential is dropped later. */
  public static void recordRejection() {
    var attempt = CURRENT.get();
    if (attempt != null) {
      attempt.rejected = true;
    }
  }

  static CredentialAttempt of(boolean retryable) {
    return new CredentialAttempt(retryable);
  }

  <T> T run(Supplier<T> call) {
    var previous = CURRENT.get();
    CURRENT.set(this);
    try {
      return call.get();
    } finally {
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    }
  }

  boolean rejected() {
    return rejected;
  }
}
