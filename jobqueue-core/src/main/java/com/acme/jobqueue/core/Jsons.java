package com.acme.jobqueue.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson mapper for job records, payloads and CLI output. */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize " + o.getClass().getName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot parse " + clazz.getSimpleName() + " JSON", e);
    }
  }

  /** Converts a value to a JSON tree. A tree is returned as-is; null becomes JSON null. */
  public static JsonNode toTree(Object o) {
    if (o == null) {
      return NullNode.getInstance();
    }
    if (o instanceof JsonNode node) {
      return node;
    }
    return M.valueToTree(o);
  }

  public static JsonNode readTree(String json) {
    try {
      return M.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot parse JSON", e);
    }
  }

  public static <T> T convert(JsonNode node, Class<T> clazz) {
    return M.convertValue(node, clazz);
  }
}
