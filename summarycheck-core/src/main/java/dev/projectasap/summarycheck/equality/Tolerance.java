/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.equality;

import com.google.common.base.Preconditions;
import java.io.Serializable;

/**
 * Absolute and relative tolerance for floating-point fields. Two values a and b are close when
 * {@code |a - b| <= absolute + relative * max(|a|, |b|)}.
 */
public final class Tolerance implements Serializable {
  public static final double DEFAULT_ABSOLUTE = 1e-9;
  public static final double DEFAULT_RELATIVE = 1e-9;

  private static final Tolerance DEFAULT = new Tolerance(DEFAULT_ABSOLUTE, DEFAULT_RELATIVE);

  private final double absolute;
  private final double relative;

  private Tolerance(double absolute, double relative) {
    this.absolute = absolute;
    this.relative = relative;
  }

  /**
   * Creates a tolerance.
   *
   * @param absolute non-negative absolute slack
   * @param relative non-negative slack proportional to the larger magnitude
   */
  public static Tolerance of(double absolute, double relative) {
    Preconditions.checkArgument(
        absolute >= 0.0 && relative >= 0.0,
        "Tolerances must be non-negative, got absolute=%s relative=%s",
        absolute,
        relative);
    return new Tolerance(absolute, relative);
  }

  public static Tolerance absolute(double absolute) {
    return of(absolute, 0.0);
  }

  public static Tolerance relative(double relative) {
    return of(0.0, relative);
  }

  public static Tolerance defaults() {
    return DEFAULT;
  }

  public double absolute() {
    return absolute;
  }

  public double relative() {
    return relative;
  }

  public boolean isClose(double a, double b) {
    if (Double.isNaN(a) || Double.isNaN(b)) {
      return Double.isNaN(a) && Double.isNaN(b);
    }
    if (Double.isInfinite(a) || Double.isInfinite(b)) {
      return a == b;
    }
    return Math.abs(a - b) <= absolute + relative * Math.max(Math.abs(a), Math.abs(b));
  }

  @Override
  public String toString() {
    return "Tolerance{absolute=" + absolute + ", relative=" + relative + '}';
  }
}
