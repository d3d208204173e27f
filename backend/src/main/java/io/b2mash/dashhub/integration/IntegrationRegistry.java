package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.error.IntegrationNotFoundException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class IntegrationRegistry {

  private static final Logger log = LoggerFactory.getLogger(IntegrationRegistry.class);

  // Built at startup: type -> adapter bean, sorted by type
  private final Map<String, IntegrationAdapter> adapters = new TreeMap<>();

  public IntegrationRegistry(ApplicationContext applicationContext) {
    // Fail fast if two adapters register the same type.
    applicationContext
        .getBeansOfType(IntegrationAdapter.class)
        .forEach(
            (name, adapter) -> {
              var existing = adapters.putIfAbsent(adapter.type(), adapter);
              if (existing != null) {
                throw new IllegalStateException(
                    "Duplicate IntegrationAdapter: type="
                        + adapter.type()
                        + " registered by both "
                        + existing.getClass().getName()
                        + " and "
                        + adapter.getClass().getName());
              }
            });
    log.info("Registered integration adapters: {}", adapters.keySet());
  }

  /**
   * Resolves the adapter registered for {@code type}.
   *
   * @throws IntegrationNotFoundException if no adapter is registered for the type
   */
  public IntegrationAdapter resolve(String type) {
    var adapter = adapters.get(type);
    if (adapter == null) {
      throw IntegrationNotFoundException.type(type);
    }
    return adapter;
  }

  /** The adapter for {@code type} as {@code extension}, when it implements that extension. */
  public <T> Optional<T> resolveExtension(String type, Class<T> extension) {
    var adapter = resolve(type);
    return extension.isInstance(adapter) ? Optional.of(extension.cast(adapter)) : Optional.empty();
  }

  /** Lists registered adapters ordered by type. */
  public List<IntegrationAdapter> adapters() {
    return List.copyOf(adapters.values());
  }

  public List<String> availableTypes() {
    return List.copyOf(adapters.keySet());
  }
}
