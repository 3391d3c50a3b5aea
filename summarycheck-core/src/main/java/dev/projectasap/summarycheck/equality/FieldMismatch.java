/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.equality;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.projectasap.summarycheck.datamodel.SerializableToSink;

/** A single field that differs between an expected and an actual output record. */
public final class FieldMismatch implements SerializableToSink {
  public final String field;
  public final JsonNode expected;
  public final JsonNode actual;
  public final String reason;

  public FieldMismatch(String field, JsonNode expected, JsonNode actual, String reason) {
    this.field = field;
    this.expected = expected;
    this.actual = actual;
    this.reason = reason;
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectNode node = new ObjectMapper().createObjectNode();
    node.put("field", field);
    node.set("expected", expected);
    node.set("actual", actual);
    node.put("reason", reason);
    return node;
  }

  @Override
  public String toString() {
    return String.format(
        "field '%s': expected %s but was %s (%s)", field, render(expected), render(actual), reason);
  }

  private static String render(JsonNode node) {
    return node == null ? "<absent>" : node.toString();
  }
}
