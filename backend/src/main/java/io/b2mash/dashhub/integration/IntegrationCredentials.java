package io.b2mash.dashhub.integration;

/**
 * Credentials configured for one integration instance. {@code toString()} never prints secret
 * material, so instances are safe to log.
 */
public sealed interface IntegrationCredentials {

  /** Stable, non-secret name of who is authenticating (api key prefix, username or client id). */
  String principal();

  /**
   * Everything that identifies the credential, secrets included. Only ever fed into a digest,
   * never stored or logged.
   */
  String fingerprintMaterial();

  record ApiKeyCredentials(String apiKey) implements IntegrationCredentials {

    @Override
    public String principal() {
      return apiKey == null || apiKey.length() < 4 ? "api-key" : apiKey.substring(0, 4) + "...";
    }

    @Override
    public String fingerprintMaterial() {
      return "api-key|" + apiKey;
    }

    @Override
    public String toString() {
      return "ApiKeyCredentials[apiKey=***]";
    }
  }

  record UsernamePasswordCredentials(String username, String password)
      implements IntegrationCredentials {

    @Override
    public String principal() {
      return username;
    }

    @Override
    public String fingerprintMaterial() {
      return "basic|" + username + "|" + password;
    }

    @Override
    public String toString() {
      return "UsernamePasswordCredentials[username=" + username + ", password=***]";
    }
  }

  record OAuthCredentials(String clientId, String clientSecret, String refreshToken)
      implements IntegrationCredentials {

    @Override
    public String principal() {
      return clientId;
    }

    @Override
    public String fingerprintMaterial() {
      return "oauth|" + clientId + "|" + clientSecret + "|" + refreshToken;
    }

    @Override
    public String toString() {
      return "OAuthCredentials[clientId=" + clientId + ", clientSecret=***, refreshToken=***]";
    }
  }
}
