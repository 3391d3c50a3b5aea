/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import java.util.Random;

/** Produces the value of one column for a generated row. */
@FunctionalInterface
public interface ColumnGenerator {

  /**
   * Generates a value.
   *
   * @param time the row timestamp
   * @param id the series id
   * @param random the fixture's seeded random source, shared across all columns and rows
   * @return the column value
   */
  double generate(long time, int id, Random random);

  /** Values drawn uniformly from {@code [offset, offset + scale)}, or the mirror for scale < 0. */
  static ColumnGenerator uniform(double scale, double offset) {
    return (time, id, random) -> offset + scale * random.nextDouble();
  }
}
