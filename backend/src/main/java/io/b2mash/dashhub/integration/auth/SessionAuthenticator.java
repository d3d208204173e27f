package io.b2mash.dashhub.integration.auth;

import io.b2mash.dashhub.integration.IntegrationConfig;

/**
 * Obtains fresh credential material for an integration instance. Implementations perform network
 * I/O (except {@link StaticTokenAuthenticator}) and are only ever invoked through {@link
 * CredentialCache#ensure}, which guarantees a single in-flight call per identity.
 *
 * @throws io.b2mash.dashhub.integration.error.AuthenticationException when the upstream rejects
 *     the configured credentials
 * @throws io.b2mash.dashhub.integration.error.NetworkException when the upstream cannot be reached
 */
public interface SessionAuthenticator {

  CredentialKind kind();

  CachedCredential authenticate(IntegrationConfig config);

  /** Whether a fresh {@link #authenticate} can cure a 401/403 seen with the previous material. */
  default boolean canRefresh() {
    return true;
  }
}
