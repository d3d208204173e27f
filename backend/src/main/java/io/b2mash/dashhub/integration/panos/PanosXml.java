package io.b2mash.dashhub.integration.panos;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.b2mash.dashhub.integration.error.UpstreamException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

/**
 * Reads PAN-OS XML API envelopes ({@code <response status="..."><result>...</result></response>}).
 * Attributes and child elements both become object fields; repeated elements become arrays.
 */
final class PanosXml {

  private static final XmlMapper XML = new XmlMapper();
  private static final Pattern UPTIME =
      Pattern.compile("(\\d+)\\s*days?,?\\s*(\\d+):(\\d+):(\\d+)");

  private PanosXml() {}

  /**
   * The {@code result} element of a successful response. An error envelope with code 401 or 403
   * (invalid or expired key) is raised as the matching HTTP client error so the caller can
   * re-authenticate; other error envelopes become {@link UpstreamException}.
   */
  static JsonNode result(String body) {
    var response = parse(body);
    var status = response.path("status").asText("success");
    if (!"success".equals(status)) {
      var message = errorMessage(response);
      var code = response.path("code").asText("");
      if ("401".equals(code) || "403".equals(code)) {
        throw HttpClientErrorException.create(
            message,
            HttpStatus.valueOf(Integer.parseInt(code)),
            message,
            HttpHeaders.EMPTY,
            body.getBytes(StandardCharsets.UTF_8),
            StandardCharsets.UTF_8);
      }
      throw new UpstreamException(0, body, "PAN-OS API error: " + message, null);
    }
    var result = response.path("result");
    return result.isMissingNode() ? response : result;
  }

  /** API key from a {@code type=keygen} response, or {@code null}. */
  static String key(String body) {
    var key = parse(body).path("result").path("key");
    return key.isValueNode() ? key.asText() : null;
  }

  /** A node that may hold one entry (object), several (array) or none. */
  static List<JsonNode> entries(JsonNode node) {
    var entries = new ArrayList<JsonNode>();
    if (node == null || node.isMissingNode() || node.isNull()) {
      return entries;
    }
    if (node.isArray()) {
      node.forEach(entries::add);
    } else if (node.isObject()) {
      entries.add(node);
    }
    return entries;
  }

  /** First present text among {@code fields}, else {@code fallback}. */
  static String text(JsonNode node, String fallback, String... fields) {
    for (var field : fields) {
      var value = node.path(field);
      if (value.isValueNode() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return fallback;
  }

  static long number(JsonNode node, String... fields) {
    var text = text(node, "0", fields).trim();
    return text.matches("-?\\d{1,18}") ? Long.parseLong(text) : 0L;
  }

  /** Seconds in an uptime such as {@code 15 days, 3:45:22}; 0 when unparseable. */
  static long uptimeSeconds(String uptime) {
    var matcher = UPTIME.matcher(uptime == null ? "" : uptime);
    if (!matcher.find()) {
      return 0;
    }
    return Long.parseLong(matcher.group(1)) * 86400
        + Long.parseLong(matcher.group(2)) * 3600
        + Long.parseLong(matcher.group(3)) * 60
        + Long.parseLong(matcher.group(4));
  }

  private static JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      throw new UpstreamException("Empty response from PAN-OS API", null);
    }
    try {
      return XML.readTree(body);
    } catch (JsonProcessingException e) {
      throw new UpstreamException(0, body, "Could not parse PAN-OS XML response", e);
    }
  }

  private static String errorMessage(JsonNode response) {
    var msg = response.path("result").path("msg");
    if (msg.isMissingNode()) {
      msg = response.path("msg");
    }
    if (msg.isValueNode()) {
      return msg.asText();
    }
    var line = msg.path("line");
    if (line.isValueNode()) {
      return line.asText();
    }
    if (line.isArray() && !line.isEmpty()) {
      return line.get(0).asText();
    }
    return "API request failed";
  }
}
