package io.b2mash.dashhub.integration.auth;

public enum CredentialKind {
  STATIC_TOKEN,
  BEARER_TOKEN,
  SESSION_COOKIE,
  API_KEY
}
