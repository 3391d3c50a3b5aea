/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.summarizer.Summarizer;

/** 0 + 0 = 0. */
public class IdentityProperty extends AbstractSummarizerProperty {

  public IdentityProperty() {
    super("IdentityProperty");
  }

  @Override
  protected <U> void verify(Dataset dataset, Summarizer<U> summarizer, CheckContext context) {
    context.buildInputs();
    OutputRecord zero = summarizer.render(summarizer.zero());

    context.compute();
    OutputRecord mergedZero =
        summarizer.render(summarizer.merge(summarizer.zero(), summarizer.zero()));

    context.assertAlmostEquals(zero, mergedZero, "merge(zero, zero)");
  }
}
