/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.equality;

import com.fasterxml.jackson.databind.JsonNode;
import dev.projectasap.summarycheck.datamodel.OutputRecord;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Field-wise near-equality of rendered output records.
 *
 * <p>Integral, text and boolean fields must match exactly; integral fields compare by value
 * whatever their width. Floating-point fields must be within the configured {@link Tolerance};
 * NaN matches NaN. Arrays are compared element by element and nested records recursively. Fields
 * are visited in the expected record's declaration order, followed by any field that only the
 * actual record has. Every mismatch is collected.
 */
public class ToleranceComparator {
  private final Tolerance tolerance;

  public ToleranceComparator(Tolerance tolerance) {
    this.tolerance = tolerance;
  }

  public Tolerance getTolerance() {
    return tolerance;
  }

  /**
   * Compares two output records.
   *
   * @param expected the reference record
   * @param actual the record under test
   * @return the mismatching fields, empty if the records are almost equal
   */
  public List<FieldMismatch> compare(OutputRecord expected, OutputRecord actual) {
    List<FieldMismatch> mismatches = new ArrayList<>();
    compareNodes("", expected.serializeToJson(), actual.serializeToJson(), mismatches);
    return mismatches;
  }

  public boolean almostEquals(OutputRecord expected, OutputRecord actual) {
    return compare(expected, actual).isEmpty();
  }

  private void compareNodes(
      String path, JsonNode expected, JsonNode actual, List<FieldMismatch> mismatches) {
    if (expected.isObject() && actual.isObject()) {
      compareObjects(path, expected, actual, mismatches);
    } else if (expected.isArray() && actual.isArray()) {
      if (expected.size() != actual.size()) {
        mismatches.add(
            new FieldMismatch(
                path,
                expected,
                actual,
                "array length " + expected.size() + " != " + actual.size()));
        return;
      }
      for (int i = 0; i < expected.size(); i++) {
        compareNodes(path + "[" + i + "]", expected.get(i), actual.get(i), mismatches);
      }
    } else if (isFloating(expected) || isFloating(actual)) {
      if (!isFloating(expected) || !isFloating(actual)) {
        mismatches.add(new FieldMismatch(path, expected, actual, "type mismatch"));
      } else if (!tolerance.isClose(expected.doubleValue(), actual.doubleValue())) {
        mismatches.add(
            new FieldMismatch(
                path,
                expected,
                actual,
                "difference "
                    + Math.abs(expected.doubleValue() - actual.doubleValue())
                    + " exceeds "
                    + tolerance));
      }
    } else if (expected.isIntegralNumber() && actual.isIntegralNumber()) {
      if (!expected.bigIntegerValue().equals(actual.bigIntegerValue())) {
        mismatches.add(new FieldMismatch(path, expected, actual, "values differ"));
      }
    } else if (expected.getNodeType() != actual.getNodeType()) {
      mismatches.add(new FieldMismatch(path, expected, actual, "type mismatch"));
    } else if (!expected.equals(actual)) {
      mismatches.add(new FieldMismatch(path, expected, actual, "values differ"));
    }
  }

  private void compareObjects(
      String path, JsonNode expected, JsonNode actual, List<FieldMismatch> mismatches) {
    Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String fieldPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
      JsonNode other = actual.get(field.getKey());
      if (other == null) {
        mismatches.add(new FieldMismatch(fieldPath, field.getValue(), null, "missing field"));
      } else {
        compareNodes(fieldPath, field.getValue(), other, mismatches);
      }
    }
    Iterator<String> actualNames = actual.fieldNames();
    while (actualNames.hasNext()) {
      String name = actualNames.next();
      if (!expected.has(name)) {
        String fieldPath = path.isEmpty() ? name : path + "." + name;
        mismatches.add(new FieldMismatch(fieldPath, null, actual.get(name), "unexpected field"));
      }
    }
  }

  private static boolean isFloating(JsonNode node) {
    return node.isFloatingPointNumber();
  }
}
