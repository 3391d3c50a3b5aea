/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.summarizer.LeftSubtractableSummarizer;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import dev.projectasap.summarycheck.summarizer.UnsupportedCapabilityException;
import java.util.List;

/**
 * (s + r) - r = s: for every prefix s of the first rows, adding the next row and subtracting it
 * again must render equal to s.
 */
public class AddSubtractRoundTripProperty extends AbstractSummarizerProperty {
  public static final int PREFIX_ROWS = 100;

  public AddSubtractRoundTripProperty() {
    super("AddSubtractRoundTripProperty");
  }

  @Override
  protected <U> void verify(Dataset dataset, Summarizer<U> summarizer, CheckContext context) {
    LeftSubtractableSummarizer<U> subtractable =
        summarizer
            .leftSubtractable()
            .orElseThrow(
                () -> new UnsupportedCapabilityException(summarizer.toString(), "subtract"));

    context.buildInputs();
    List<Row> rows = dataset.take(PREFIX_ROWS);

    U state = subtractable.zero();
    for (int k = 0; k < rows.size(); k++) {
      context.compute();
      Row row = rows.get(k);
      OutputRecord expected = subtractable.render(state);
      state = subtractable.subtract(subtractable.add(state, row), row);
      context.assertAlmostEquals(expected, subtractable.render(state), "prefix=" + k);
      state = subtractable.add(state, row);
    }
  }
}
