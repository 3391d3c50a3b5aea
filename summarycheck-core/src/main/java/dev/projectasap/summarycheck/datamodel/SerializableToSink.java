/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.datamodel;

import com.fasterxml.jackson.databind.JsonNode;

/** Interface for objects that can be written to a report sink as JSON. */
public interface SerializableToSink {
  JsonNode serializeToJson();

  default String serializeToString() {
    // Default to JSON string
    return serializeToJson().toString();
  }
}
