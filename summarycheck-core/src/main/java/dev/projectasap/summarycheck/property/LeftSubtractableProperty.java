/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.FixtureException;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import dev.projectasap.summarycheck.summarizer.LeftSubtractableSummarizer;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import dev.projectasap.summarycheck.summarizer.UnsupportedCapabilityException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * (a + b) + c - a = b + c: slides a window over the first rows of the dataset, adding the newest
 * row and subtracting the oldest at each step, and requires the incrementally maintained window to
 * match a window folded from scratch. Window sizes start at 11 and are squared while they stay
 * below the sample size.
 */
public class LeftSubtractableProperty extends AbstractSummarizerProperty {
  private static final Logger LOG = LoggerFactory.getLogger(LeftSubtractableProperty.class);

  public static final int SAMPLE_ROWS = 1000;
  public static final int INITIAL_WINDOW = 11;

  public LeftSubtractableProperty() {
    super("LeftSubtractableProperty");
  }

  @Override
  protected <U> void verify(Dataset dataset, Summarizer<U> summarizer, CheckContext context) {
    LeftSubtractableSummarizer<U> subtractable =
        summarizer
            .leftSubtractable()
            .orElseThrow(
                () -> new UnsupportedCapabilityException(summarizer.toString(), "subtract"));

    context.buildInputs();
    List<Row> rows = dataset.take(SAMPLE_ROWS);
    if (rows.size() <= INITIAL_WINDOW) {
      throw new FixtureException(
          "Dataset '"
              + dataset.label()
              + "' has "
              + rows.size()
              + " rows, a sliding window of "
              + INITIAL_WINDOW
              + " needs more");
    }

    for (int window = INITIAL_WINDOW; window < rows.size(); window *= window) {
      slide(subtractable, rows, window, context);
      LOG.debug("Window {} matched over {} rows of '{}'", window, rows.size(), dataset.label());
    }
  }

  private static <U> void slide(
      LeftSubtractableSummarizer<U> summarizer, List<Row> rows, int window, CheckContext context) {
    context.compute();
    U s1 = TreeReducer.fold(summarizer, rows.subList(0, window));

    for (int i = window; i < rows.size(); i++) {
      context.compute();
      s1 = summarizer.add(s1, rows.get(i));
      s1 = summarizer.subtract(s1, rows.get(i - window));

      int start = i - window + 1;
      U s2 = TreeReducer.fold(summarizer, rows.subList(start, i + 1));

      context.assertAlmostEquals(
          summarizer.render(s2),
          summarizer.render(s1),
          "window=" + window + ",offset=" + start);
    }
  }
}
