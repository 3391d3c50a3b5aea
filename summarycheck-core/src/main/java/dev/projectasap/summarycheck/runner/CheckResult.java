/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.datamodel.SerializableToSink;
import dev.projectasap.summarycheck.equality.FieldMismatch;
import dev.projectasap.summarycheck.property.Phase;
import dev.projectasap.summarycheck.property.PropertyViolation;
import java.util.List;

/** Result of checking one property on one dataset. */
public final class CheckResult implements SerializableToSink {
  public final String property;
  public final int datasetIndex;
  public final String datasetLabel;
  public final CheckStatus status;
  public final Phase phase;
  public final String locator;
  public final ImmutableList<FieldMismatch> mismatches;
  public final String message;

  private CheckResult(
      String property,
      int datasetIndex,
      String datasetLabel,
      CheckStatus status,
      Phase phase,
      String locator,
      List<FieldMismatch> mismatches,
      String message) {
    this.property = property;
    this.datasetIndex = datasetIndex;
    this.datasetLabel = datasetLabel;
    this.status = status;
    this.phase = phase;
    this.locator = locator;
    this.mismatches = ImmutableList.copyOf(mismatches);
    this.message = message;
  }

  public static CheckResult passed(
      String property, int datasetIndex, String datasetLabel, Phase phase) {
    return new CheckResult(
        property, datasetIndex, datasetLabel, CheckStatus.PASSED, phase, null, List.of(), null);
  }

  public static CheckResult failed(
      int datasetIndex, String datasetLabel, Phase phase, PropertyViolation violation) {
    return new CheckResult(
        violation.getProperty(),
        datasetIndex,
        datasetLabel,
        CheckStatus.FAILED,
        phase,
        violation.getLocator(),
        violation.getMismatches(),
        violation.getMessage());
  }

  public static CheckResult setupError(
      String property, int datasetIndex, String datasetLabel, Phase phase, String message) {
    return new CheckResult(
        property,
        datasetIndex,
        datasetLabel,
        CheckStatus.SETUP_ERROR,
        phase,
        null,
        List.of(),
        message);
  }

  public static CheckResult error(
      String property, int datasetIndex, String datasetLabel, Phase phase, Throwable cause) {
    return new CheckResult(
        property,
        datasetIndex,
        datasetLabel,
        CheckStatus.ERROR,
        phase,
        null,
        List.of(),
        cause.getClass().getSimpleName() + ": " + cause.getMessage());
  }

  public boolean isPassed() {
    return status == CheckStatus.PASSED;
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("property", property);
    jsonNode.put("dataset_index", datasetIndex);
    jsonNode.put("dataset", datasetLabel);
    jsonNode.put("status", status.name());
    jsonNode.put("phase", phase.name());
    if (locator != null) {
      jsonNode.put("locator", locator);
    }
    if (!mismatches.isEmpty()) {
      ArrayNode mismatchArray = jsonNode.putArray("mismatches");
      for (FieldMismatch mismatch : mismatches) {
        mismatchArray.add(mismatch.serializeToJson());
      }
    }
    if (message != null) {
      jsonNode.put("message", message);
    }
    return jsonNode;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(status)
        .append(' ')
        .append(property)
        .append(" with ")
        .append(datasetIndex)
        .append("-th dataset (")
        .append(datasetLabel)
        .append(')');
    if (locator != null) {
      sb.append(" at ").append(locator);
    }
    if (status == CheckStatus.SETUP_ERROR || status == CheckStatus.ERROR) {
      sb.append(": ").append(message);
    }
    for (FieldMismatch mismatch : mismatches) {
      sb.append("\n    ").append(mismatch);
    }
    return sb.toString();
  }
}
