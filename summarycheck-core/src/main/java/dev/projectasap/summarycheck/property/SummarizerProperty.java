/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;

/** An algebraic law that a summarizer must satisfy on a dataset. */
public interface SummarizerProperty {

  String name();

  /**
   * Checks the law. Returns normally when it holds.
   *
   * @param dataset the fixture to check against
   * @param factory creates the summarizer under test for the dataset's schema
   * @param context phase tracking, comparisons and the reduction driver for this check
   * @throws PropertyViolation if the law does not hold
   * @throws dev.projectasap.summarycheck.summarizer.UnsupportedCapabilityException if the law
   *     needs a capability the summarizer lacks
   */
  void test(Dataset dataset, SummarizerFactory factory, CheckContext context);
}
