package io.b2mash.dashhub.integration;

import io.b2mash.dashhub.integration.capability.CapabilityExecutionResult;
import io.b2mash.dashhub.integration.capability.CapabilityMethod;
import java.util.Map;

/** Optional adapter extension for pass-through invocation of cataloged capabilities. */
public interface CapabilityExecutor {

  CapabilityExecutionResult executeCapability(
      IntegrationConfig config,
      String capabilityId,
      CapabilityMethod method,
      String endpoint,
      Map<String, Object> params);
}
