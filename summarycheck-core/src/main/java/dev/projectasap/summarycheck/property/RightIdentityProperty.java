/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import java.util.List;

/** 0 + a = a, with a folded from the first rows of the dataset. */
public class RightIdentityProperty extends AbstractSummarizerProperty {
  public static final int PREFIX_ROWS = 100;

  public RightIdentityProperty() {
    super("RightIdentityProperty");
  }

  @Override
  protected <U> void verify(Dataset dataset, Summarizer<U> summarizer, CheckContext context) {
    context.buildInputs();
    List<Row> rows = dataset.take(PREFIX_ROWS);
    U nonZero = TreeReducer.fold(summarizer, rows);
    OutputRecord expected = summarizer.render(nonZero);

    context.compute();
    OutputRecord merged = summarizer.render(summarizer.merge(summarizer.zero(), nonZero));

    context.assertAlmostEquals(expected, merged, "merge(zero, prefix[" + rows.size() + "])");
  }
}
