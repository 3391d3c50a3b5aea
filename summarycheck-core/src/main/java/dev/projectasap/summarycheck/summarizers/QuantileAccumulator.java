/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import com.datadoghq.sketch.ddsketch.DDSketch;
import com.datadoghq.sketch.ddsketch.DDSketches;

/**
 * One Datadog DDSketch per column. The sketches use an unbounded store, so bins are never
 * collapsed and merging only adds bin counts.
 */
public class QuantileAccumulator {
  final DDSketch[] sketches;

  public QuantileAccumulator(int columns, double relativeAccuracy) {
    this.sketches = new DDSketch[columns];
    for (int i = 0; i < columns; i++) {
      // Grows to accommodate the input range, exactly logarithmic mapping
      sketches[i] = DDSketches.logarithmicUnboundedDense(relativeAccuracy);
    }
  }

  void add(int column, double value) {
    sketches[column].accept(value);
  }

  /** Merges another accumulator into this one and returns this. */
  public QuantileAccumulator merge(QuantileAccumulator other) {
    if (sketches.length != other.sketches.length) {
      throw new IllegalArgumentException("Cannot merge: column count mismatch!");
    }
    for (int i = 0; i < sketches.length; i++) {
      sketches[i].mergeWith(other.sketches[i]);
    }
    return this;
  }

  /** Value at the rank, NaN if the column has no values. */
  public double quantile(int column, double rank) {
    DDSketch sketch = sketches[column];
    return sketch.isEmpty() ? Double.NaN : sketch.getValueAtQuantile(rank);
  }

  public long count(int column) {
    return (long) sketches[column].getCount();
  }
}
