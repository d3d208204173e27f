package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache key for credential material: who is talking to which upstream. Two instances of the same
 * adapter type pointing at different hosts, or using different principals, never share a
 * credential. The fingerprint is a digest, so the raw secret is never part of the key.
 */
public record IntegrationIdentity(String type, String host, int port, String authFingerprint) {

  public static IntegrationIdentity of(IntegrationConfig config) {
    var credentials = config.credentials();
    return new IntegrationIdentity(
        config.type(),
        config.host() != null ? config.host().trim().toLowerCase() : "",
        config.port() != null ? config.port() : 0,
        fingerprint(credentials != null ? credentials.fingerprintMaterial() : ""));
  }

  static String fingerprint(String material) {
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
