/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import java.util.Arrays;

/**
 * Count, mean and sum of squared deviations (M2) per column, updated with Welford's method.
 * Removal applies the inverse update and merging uses the pairwise formula of Chan et al.
 */
public class MomentsAccumulator {
  long count;
  final double[] mean;
  final double[] m2;

  public MomentsAccumulator(int columns) {
    this.mean = new double[columns];
    this.m2 = new double[columns];
  }

  void add(double[] values) {
    count++;
    for (int i = 0; i < values.length; i++) {
      double delta = values[i] - mean[i];
      mean[i] += delta / count;
      m2[i] += delta * (values[i] - mean[i]);
    }
  }

  void subtract(double[] values) {
    if (count <= 1) {
      count = 0;
      Arrays.fill(mean, 0.0);
      Arrays.fill(m2, 0.0);
      return;
    }
    long remaining = count - 1;
    for (int i = 0; i < values.length; i++) {
      double delta = values[i] - mean[i];
      double newMean = mean[i] - delta / remaining;
      m2[i] -= delta * (values[i] - newMean);
      mean[i] = newMean;
    }
    count = remaining;
  }

  /** Merges another accumulator into this one and returns this. */
  public MomentsAccumulator merge(MomentsAccumulator other) {
    if (mean.length != other.mean.length) {
      throw new IllegalArgumentException("Cannot merge: column count mismatch!");
    }
    if (other.count == 0) {
      return this;
    }
    if (count == 0) {
      count = other.count;
      System.arraycopy(other.mean, 0, mean, 0, mean.length);
      System.arraycopy(other.m2, 0, m2, 0, m2.length);
      return this;
    }
    long total = count + other.count;
    for (int i = 0; i < mean.length; i++) {
      double delta = other.mean[i] - mean[i];
      mean[i] += delta * other.count / total;
      m2[i] += other.m2[i] + delta * delta * ((double) count * other.count / total);
    }
    count = total;
    return this;
  }

  public long count() {
    return count;
  }

  public double mean(int column) {
    return count > 0 ? mean[column] : Double.NaN;
  }

  /** Sample variance, NaN for fewer than two rows. */
  public double variance(int column) {
    return count > 1 ? Math.max(0.0, m2[column]) / (count - 1) : Double.NaN;
  }
}
