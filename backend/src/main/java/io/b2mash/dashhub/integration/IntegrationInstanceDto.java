package io.b2mash.dashhub.integration;

/** Configured instance as exposed over the API; carries no secret material. */
public record IntegrationInstanceDto(
    String id,
    String type,
    String name,
    String host,
    Integer port,
    boolean enabled,
    boolean verifySsl,
    String credentialType,
    String principal,
    boolean adapterAvailable) {

  public static IntegrationInstanceDto from(IntegrationConfig config, boolean adapterAvailable) {
    var credentials = config.credentials();
    return new IntegrationInstanceDto(
        config.id(),
        config.type(),
        config.name(),
        config.host(),
        config.port(),
        config.enabled(),
        config.verifySsl(),
        credentials != null ? credentials.getClass().getSimpleName() : null,
        credentials != null ? credentials.principal() : null,
        adapterAvailable);
  }
}
