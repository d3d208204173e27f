package io.b2mash.dashhub.integration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Serves the instances bound from {@code dashhub.integration.instances}. */
@Component
public class PropertiesIntegrationConfigStore implements IntegrationConfigStore {

  private static final Logger log = LoggerFactory.getLogger(PropertiesIntegrationConfigStore.class);

  private final Map<String, IntegrationConfig> configs;

  public PropertiesIntegrationConfigStore(IntegrationProperties properties) {
    var byId = new LinkedHashMap<String, IntegrationConfig>();
    for (var instance : properties.instances()) {
      if (instance.id() == null || instance.id().isBlank()) {
        throw new IllegalStateException("Integration instance without id: type=" + instance.type());
      }
      if (instance.type() == null || instance.type().isBlank()) {
        throw new IllegalStateException("Integration instance " + instance.id() + " has no type");
      }
      var existing = byId.putIfAbsent(instance.id(), instance.toConfig());
      if (existing != null) {
        throw new IllegalStateException("Duplicate integration instance id: " + instance.id());
      }
    }
    this.configs = Collections.unmodifiableMap(byId);
    log.info("Loaded {} configured integration instance(s)", configs.size());
  }

  @Override
  public List<IntegrationConfig> findAll() {
    return List.copyOf(configs.values());
  }

  @Override
  public Optional<IntegrationConfig> findById(String id) {
    return Optional.ofNullable(configs.get(id));
  }
}
