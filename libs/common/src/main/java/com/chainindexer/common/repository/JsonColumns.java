package com.chainindexer.common.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.sql.SQLException;

/** Reads jsonb columns selected as text. */
final class JsonColumns {
  private JsonColumns() {}

  static JsonNode read(ObjectMapper objectMapper, String text, String column) throws SQLException {
    if (text == null) {
      return NullNode.getInstance();
    }
    try {
      return objectMapper.readTree(text);
    } catch (JsonProcessingException ex) {
      throw new SQLException("column " + column + " does not contain valid json", ex);
    }
  }

  static String write(JsonNode node) {
    return node == null ? null : node.toString();
  }
}
