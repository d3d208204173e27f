package io.b2mash.dashhub.integration;

import java.util.List;
import java.util.Map;

/** Optional adapter extension for state-changing operations on the upstream. */
public interface ActionPerformer {

  List<String> supportedActions();

  /** Never throws; an unknown action or an upstream failure is an unsuccessful result. */
  ActionResult performAction(IntegrationConfig config, String action, Map<String, Object> params);
}
