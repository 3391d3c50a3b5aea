/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.equality.FieldMismatch;
import dev.projectasap.summarycheck.equality.ToleranceComparator;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import java.util.List;

/**
 * State of one (property, dataset) check. Tracks the phase the check has reached and performs the
 * tolerance comparisons, turning the first divergent comparison into a {@link PropertyViolation}.
 *
 * <p>Phases only move forward, except that iterative checks may go from {@code COMPARE} back to
 * {@code COMPUTE} for their next step.
 */
public final class CheckContext {
  private final String property;
  private final Dataset dataset;
  private final ToleranceComparator comparator;
  private final TreeReducer reducer;
  private Phase phase = Phase.INIT;
  private int comparisons;

  public CheckContext(
      String property, Dataset dataset, ToleranceComparator comparator, TreeReducer reducer) {
    this.property = property;
    this.dataset = dataset;
    this.comparator = comparator;
    this.reducer = reducer;
  }

  public Phase phase() {
    return phase;
  }

  /** Number of comparisons that have passed so far. */
  public int comparisons() {
    return comparisons;
  }

  public TreeReducer reducer() {
    return reducer;
  }

  public void buildInputs() {
    advance(Phase.BUILD_INPUTS);
  }

  public void compute() {
    advance(Phase.COMPUTE);
  }

  /**
   * Compares two renders.
   *
   * @param expected the reference output
   * @param actual the output that must match it
   * @param locator where in the check the comparison happens, e.g. {@code depth=3}
   * @throws PropertyViolation if the outputs are not almost equal
   */
  public void assertAlmostEquals(OutputRecord expected, OutputRecord actual, String locator) {
    advance(Phase.COMPARE);
    List<FieldMismatch> mismatches = comparator.compare(expected, actual);
    if (!mismatches.isEmpty()) {
      throw new PropertyViolation(property, dataset.label(), locator, expected, actual, mismatches);
    }
    comparisons++;
  }

  private void advance(Phase next) {
    boolean forward = next.ordinal() >= phase.ordinal();
    boolean nextStep = phase == Phase.COMPARE && next == Phase.COMPUTE;
    if (!forward && !nextStep) {
      throw new IllegalStateException(
          property + " cannot move from " + phase + " back to " + next);
    }
    phase = next;
  }
}
