package io.b2mash.dashhub.integration;

import java.util.List;
import java.util.Optional;

/** Source of configured integration instances. */
public interface IntegrationConfigStore {

  List<IntegrationConfig> findAll();

  Optional<IntegrationConfig> findById(String id);
}
