package io.b2mash.dashhub.integration.capability;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Catalog entry describing one upstream API operation. Purely descriptive: nothing is executed
 * unless a caller explicitly invokes it through a {@code CapabilityExecutor}. {@code endpoint} may
 * contain {@code {name}} placeholders.
 */
public record Capability(
    String id,
    String name,
    String description,
    CapabilityMethod method,
    String endpoint,
    boolean implemented,
    String category,
    List<CapabilityParameter> parameters,
    String documentationUrl) {

  public Capability {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(endpoint, "endpoint");
    parameters = List.copyOf(parameters);
  }

  public static Builder get(String id, String endpoint) {
    return new Builder(id, CapabilityMethod.GET, endpoint);
  }

  public static Builder post(String id, String endpoint) {
    return new Builder(id, CapabilityMethod.POST, endpoint);
  }

  public static Builder put(String id, String endpoint) {
    return new Builder(id, CapabilityMethod.PUT, endpoint);
  }

  public static Builder patch(String id, String endpoint) {
    return new Builder(id, CapabilityMethod.PATCH, endpoint);
  }

  public static Builder delete(String id, String endpoint) {
    return new Builder(id, CapabilityMethod.DELETE, endpoint);
  }

  public static final class Builder {

    private final String id;
    private final CapabilityMethod method;
    private final String endpoint;
    private String name;
    private String description = "";
    private boolean implemented;
    private String category = "General";
    private final List<CapabilityParameter> parameters = new ArrayList<>();
    private String documentationUrl;

    private Builder(String id, CapabilityMethod method, String endpoint) {
      this.id = id;
      this.method = method;
      this.endpoint = endpoint;
      this.name = id;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /** Marks the operation as one the adapter itself already uses for a metric or action. */
    public Builder implemented() {
      this.implemented = true;
      return this;
    }

    public Builder param(String name, String type, boolean required, String description) {
      parameters.add(new CapabilityParameter(name, type, required, description));
      return this;
    }

    public Builder docs(String documentationUrl) {
      this.documentationUrl = documentationUrl;
      return this;
    }

    public Capability build() {
      return new Capability(
          id,
          name,
          description,
          method,
          endpoint,
          implemented,
          category,
          parameters,
          documentationUrl);
    }
  }
}
