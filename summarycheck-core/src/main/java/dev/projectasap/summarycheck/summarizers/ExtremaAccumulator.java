/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import java.util.Arrays;

/** Running minimum and maximum per column; infinities when empty. */
public class ExtremaAccumulator {
  final double[] min;
  final double[] max;

  public ExtremaAccumulator(int columns) {
    this.min = new double[columns];
    this.max = new double[columns];
    Arrays.fill(min, Double.POSITIVE_INFINITY);
    Arrays.fill(max, Double.NEGATIVE_INFINITY);
  }

  void add(int column, double value) {
    // NaN values are skipped
    if (!Double.isNaN(value)) {
      min[column] = Math.min(min[column], value);
      max[column] = Math.max(max[column], value);
    }
  }

  /** Merges another accumulator into this one and returns this. */
  public ExtremaAccumulator merge(ExtremaAccumulator other) {
    if (min.length != other.min.length) {
      throw new IllegalArgumentException("Cannot merge: column count mismatch!");
    }
    for (int i = 0; i < min.length; i++) {
      min[i] = Math.min(min[i], other.min[i]);
      max[i] = Math.max(max[i], other.max[i]);
    }
    return this;
  }
}
