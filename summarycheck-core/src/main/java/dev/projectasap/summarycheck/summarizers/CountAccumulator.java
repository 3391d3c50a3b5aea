/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

/** Accumulator holding the number of rows added. */
public class CountAccumulator {
  long count;

  /** Merges another accumulator into this one and returns this. */
  public CountAccumulator merge(CountAccumulator other) {
    count += other.count;
    return this;
  }

  public long count() {
    return count;
  }
}
