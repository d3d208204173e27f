package io.b2mash.dashhub.integration.capability;

import io.b2mash.dashhub.integration.IntegrationRegistry;
import io.b2mash.dashhub.integration.error.IntegrationNotFoundException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Read-only view over the capability catalogs of all registered adapters. */
@Component
public class CapabilityRegistry {

  private final Map<String, List<Capability>> catalogs = new LinkedHashMap<>();

  public CapabilityRegistry(IntegrationRegistry integrationRegistry) {
    for (var adapter : integrationRegistry.adapters()) {
      var capabilities = adapter.getApiCapabilities();
      var ids = new HashSet<String>();
      for (var capability : capabilities) {
        if (!ids.add(capability.id())) {
          throw new IllegalStateException(
              "Duplicate capability id '" + capability.id() + "' in " + adapter.type());
        }
      }
      catalogs.put(adapter.type(), capabilities);
    }
  }

  public List<Capability> capabilitiesFor(String type) {
    var capabilities = catalogs.get(type);
    if (capabilities == null) {
      throw IntegrationNotFoundException.type(type);
    }
    return capabilities;
  }

  public Optional<Capability> find(String type, String capabilityId) {
    return catalogs.getOrDefault(type, List.of()).stream()
        .filter(capability -> capability.id().equals(capabilityId))
        .findFirst();
  }

  public CatalogSummary summary(String type) {
    var capabilities = capabilitiesFor(type);
    var categories = new TreeSet<String>();
    int implemented = 0;
    for (var capability : capabilities) {
      categories.add(capability.category());
      if (capability.implemented()) {
        implemented++;
      }
    }
    return new CatalogSummary(type, capabilities.size(), implemented, List.copyOf(categories));
  }

  public record CatalogSummary(
      String type, int total, int implemented, List<String> categories) {}
}
