package io.b2mash.dashhub.integration.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Credential material obtained from an upstream, with the window in which it may be used. {@code
 * material} is the header/cookie/query value to send; it is masked in {@link #toString()}.
 */
public record CachedCredential(
    String material, Instant obtainedAt, Instant expiresAt, CredentialKind kind) {

  public static CachedCredential nonExpiring(String material, Instant now, CredentialKind kind) {
    return new CachedCredential(material, now, Instant.MAX, kind);
  }

  public static CachedCredential expiringIn(
      String material, Instant now, Duration ttl, CredentialKind kind) {
    return new CachedCredential(material, now, now.plus(ttl), kind);
  }

  public boolean expires() {
    return !Instant.MAX.equals(expiresAt);
  }

  /**
   * Usable while {@code now < expiresAt - buffer}. The buffer is capped at half the credential's
   * lifetime so that a short-lived token is not considered stale the moment it is issued.
   */
  public boolean isUsableAt(Instant now, Duration safetyBuffer) {
    if (!expires()) {
      return true;
    }
    var halfLife = Duration.between(obtainedAt, expiresAt).dividedBy(2);
    var buffer = safetyBuffer.compareTo(halfLife) > 0 ? halfLife : safetyBuffer;
    return now.isBefore(expiresAt.minus(buffer));
  }

  @Override
  public String toString() {
    return "CachedCredential[kind="
        + kind
        + ", obtainedAt="
        + obtainedAt
        + ", expiresAt="
        + (expires() ? expiresAt : "never")
        + ", material=***]";
  }
}
