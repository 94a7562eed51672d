package com.chainindexer.common.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Optional;

/** Null-safe accessors over loosely shaped webhook documents. */
public final class JsonFields {
  private JsonFields() {}

  /** Non-empty text at {@code field}, or null when absent, blank or not textual. */
  public static String text(JsonNode node, String field) {
    if (node == null || !node.isObject()) {
      return null;
    }
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isEmpty()) {
      return null;
    }
    return value.asText();
  }

  public static Optional<String> optionalText(JsonNode node, String field) {
    return Optional.ofNullable(text(node, field));
  }

  /** Follows {@code path} through nested objects; never returns null. */
  public static JsonNode at(JsonNode node, String... path) {
    JsonNode current = node;
    for (String field : path) {
      if (current == null || !current.isObject()) {
        return MissingNode.getInstance();
      }
      current = current.get(field);
    }
    return current == null ? MissingNode.getInstance() : current;
  }

  /** The array at {@code path}, or a missing node when the value is not an array. */
  public static JsonNode array(JsonNode node, String... path) {
    final JsonNode value = at(node, path);
    return value.isArray() ? value : MissingNode.getInstance();
  }

  /** True when {@code field} is present and not JSON null. */
  public static boolean isPresentNonNull(JsonNode node, String field) {
    if (node == null || !node.isObject()) {
      return false;
    }
    final JsonNode value = node.get(field);
    return value != null && !value.isNull() && !value.isMissingNode();
  }
}
