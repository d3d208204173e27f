package io.b2mash.dashhub.integration.metric;

import java.util.List;

/** Describes one metric an adapter can produce and the widgets able to render it. */
public record MetricInfo(String id, String name, String description, List<String> widgetTypes) {

  public MetricInfo {
    widgetTypes = List.copyOf(widgetTypes);
  }
}
