/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;

/**
 * Base class binding a fresh summarizer to the dataset's schema before delegating to the typed
 * check. Subclasses see the accumulator type as a type variable.
 */
public abstract class AbstractSummarizerProperty implements SummarizerProperty {
  private final String name;

  protected AbstractSummarizerProperty(String name) {
    this.name = name;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public final void test(Dataset dataset, SummarizerFactory factory, CheckContext context) {
    Summarizer<?> summarizer = factory.apply(dataset.schema());
    verify(dataset, summarizer, context);
  }

  protected abstract <U> void verify(
      Dataset dataset, Summarizer<U> summarizer, CheckContext context);

  @Override
  public String toString() {
    return name;
  }
}
