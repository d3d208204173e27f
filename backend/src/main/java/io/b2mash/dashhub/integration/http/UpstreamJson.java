package io.b2mash.dashhub.integration.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.ResponseEntity;

/** Small helpers for picking apart upstream JSON responses. */
public final class UpstreamJson {

  private UpstreamJson() {}

  /** Elements of a JSON array; empty for anything else, including {@code null}. */
  public static List<JsonNode> elements(JsonNode node) {
    var elements = new ArrayList<JsonNode>();
    if (node != null && node.isArray()) {
      node.forEach(elements::add);
    }
    return elements;
  }

  public static ArrayNode emptyArray() {
    return JsonNodeFactory.instance.arrayNode();
  }

  /**
   * Total reported in the {@code X-Total-Count} header, falling back to the size of the returned
   * array.
   */
  public static long totalCount(ResponseEntity<JsonNode> response) {
    var header = response.getHeaders().getFirst("X-Total-Count");
    if (header != null && header.trim().matches("\\d{1,18}")) {
      return Long.parseLong(header.trim());
    }
    return elements(response.getBody()).size();
  }

  /** Number of elements matching a boolean field. */
  public static long countWhere(JsonNode array, String field, boolean value) {
    return elements(array).stream().filter(node -> node.path(field).asBoolean() == value).count();
  }
}
