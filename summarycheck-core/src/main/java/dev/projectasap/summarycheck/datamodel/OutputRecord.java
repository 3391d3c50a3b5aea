/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.datamodel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Rendered output of a summarizer: an ordered collection of named, typed fields. Backed by a
 * Jackson {@link ObjectNode}, so integral, floating, text, boolean, array and nested fields keep
 * their declared type and order. This is the unit compared by the tolerance-aware equality.
 */
public final class OutputRecord implements SerializableToSink {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ObjectNode fields;

  private OutputRecord(ObjectNode fields) {
    this.fields = fields;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> fieldNames() {
    List<String> names = new ArrayList<>();
    Iterator<String> it = fields.fieldNames();
    it.forEachRemaining(names::add);
    return names;
  }

  public int size() {
    return fields.size();
  }

  /** Returns the field value, or null if there is no such field. */
  public JsonNode get(String field) {
    return fields.get(field);
  }

  public double getDouble(String field) {
    JsonNode node = requireField(field);
    return node.asDouble();
  }

  public long getLong(String field) {
    JsonNode node = requireField(field);
    if (!node.isIntegralNumber()) {
      throw new IllegalArgumentException("Field '" + field + "' is not integral: " + node);
    }
    return node.asLong();
  }

  private JsonNode requireField(String field) {
    JsonNode node = fields.get(field);
    if (node == null) {
      throw new IllegalArgumentException("No field '" + field + "' in " + this);
    }
    return node;
  }

  @Override
  public JsonNode serializeToJson() {
    return fields.deepCopy();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof OutputRecord && fields.equals(((OutputRecord) o).fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return fields.toString();
  }

  /** Builder appending fields in declaration order. */
  public static final class Builder {
    private final ObjectNode fields = MAPPER.createObjectNode();

    private Builder() {}

    public Builder put(String name, double value) {
      checkNew(name);
      fields.put(name, value);
      return this;
    }

    public Builder put(String name, long value) {
      checkNew(name);
      fields.put(name, value);
      return this;
    }

    public Builder put(String name, int value) {
      checkNew(name);
      fields.put(name, value);
      return this;
    }

    public Builder put(String name, String value) {
      checkNew(name);
      fields.put(name, value);
      return this;
    }

    public Builder put(String name, boolean value) {
      checkNew(name);
      fields.put(name, value);
      return this;
    }

    public Builder putNull(String name) {
      checkNew(name);
      fields.putNull(name);
      return this;
    }

    public Builder putArray(String name, double... values) {
      checkNew(name);
      ArrayNode array = fields.putArray(name);
      for (double value : values) {
        array.add(value);
      }
      return this;
    }

    public Builder putRecord(String name, OutputRecord nested) {
      checkNew(name);
      fields.set(name, nested.fields.deepCopy());
      return this;
    }

    private void checkNew(String name) {
      if (fields.has(name)) {
        throw new IllegalArgumentException("Field '" + name + "' is already defined");
      }
    }

    public OutputRecord build() {
      return new OutputRecord(fields.deepCopy());
    }
  }
}
