/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.equality.FieldMismatch;
import java.util.List;

/**
 * Assertion failure raised when two renders that an algebraic law requires to be equal are not
 * almost equal. Names the property, the dataset and where in the check the outputs diverged.
 */
public class PropertyViolation extends AssertionError {
  private final String property;
  private final String dataset;
  private final String locator;
  private final OutputRecord expected;
  private final OutputRecord actual;
  private final ImmutableList<FieldMismatch> mismatches;

  public PropertyViolation(
      String property,
      String dataset,
      String locator,
      OutputRecord expected,
      OutputRecord actual,
      List<FieldMismatch> mismatches) {
    super(describe(property, dataset, locator, mismatches));
    this.property = property;
    this.dataset = dataset;
    this.locator = locator;
    this.expected = expected;
    this.actual = actual;
    this.mismatches = ImmutableList.copyOf(mismatches);
  }

  private static String describe(
      String property, String dataset, String locator, List<FieldMismatch> mismatches) {
    StringBuilder sb = new StringBuilder();
    sb.append(property).append(" violated on dataset '").append(dataset).append('\'');
    if (locator != null) {
      sb.append(" at ").append(locator);
    }
    for (FieldMismatch mismatch : mismatches) {
      sb.append("\n  ").append(mismatch);
    }
    return sb.toString();
  }

  public String getProperty() {
    return property;
  }

  public String getDataset() {
    return dataset;
  }

  public String getLocator() {
    return locator;
  }

  public OutputRecord getExpected() {
    return expected;
  }

  public OutputRecord getActual() {
    return actual;
  }

  public ImmutableList<FieldMismatch> getMismatches() {
    return mismatches;
  }
}
