/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

/**
 * Running sum with Neumaier compensation. The rounding error of each addition is kept separately,
 * which keeps sums of many values of mixed magnitude, and sums assembled in different orders,
 * close to each other.
 */
public final class CompensatedSum {
  private double sum;
  private double compensation;

  public CompensatedSum add(double value) {
    double t = sum + value;
    if (Math.abs(sum) >= Math.abs(value)) {
      compensation += (sum - t) + value;
    } else {
      compensation += (value - t) + sum;
    }
    sum = t;
    return this;
  }

  public CompensatedSum subtract(double value) {
    return add(-value);
  }

  /** Adds another sum into this one. The other sum is not modified. */
  public CompensatedSum merge(CompensatedSum other) {
    add(other.sum);
    compensation += other.compensation;
    return this;
  }

  public double value() {
    return sum + compensation;
  }

  public CompensatedSum copy() {
    CompensatedSum copy = new CompensatedSum();
    copy.sum = sum;
    copy.compensation = compensation;
    return copy;
  }
}
