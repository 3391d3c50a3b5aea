/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

/** Accumulator holding one compensated sum per column and the number of rows added. */
public class SumAccumulator {
  final CompensatedSum[] sums;
  long count;

  public SumAccumulator(int columns) {
    this.sums = new CompensatedSum[columns];
    for (int i = 0; i < columns; i++) {
      sums[i] = new CompensatedSum();
    }
  }

  /** Merges another accumulator into this one and returns this. */
  public SumAccumulator merge(SumAccumulator other) {
    if (sums.length != other.sums.length) {
      throw new IllegalArgumentException("Cannot merge: column count mismatch!");
    }
    for (int i = 0; i < sums.length; i++) {
      sums[i].merge(other.sums[i]);
    }
    count += other.count;
    return this;
  }

  public double sum(int column) {
    return sums[column].value();
  }

  public long count() {
    return count;
  }
}
