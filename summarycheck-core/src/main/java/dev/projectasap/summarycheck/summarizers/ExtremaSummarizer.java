/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import java.util.List;

/**
 * Minimum and maximum of each column, rendered as {@code <column>_min} and {@code <column>_max}.
 * Extremes cannot be un-added, so this summarizer is mergeable only.
 */
public class ExtremaSummarizer extends AbstractColumnSummarizer<ExtremaAccumulator> {

  public ExtremaSummarizer(Schema schema, List<String> columns) {
    super(schema, columns);
  }

  public static SummarizerFactory factory(String... columns) {
    return SummarizerFactory.named(
        "extrema" + List.of(columns), schema -> new ExtremaSummarizer(schema, List.of(columns)));
  }

  @Override
  public ExtremaAccumulator zero() {
    return new ExtremaAccumulator(indices.length);
  }

  @Override
  public ExtremaAccumulator add(ExtremaAccumulator state, Row row) {
    requireSchema(row);
    for (int i = 0; i < indices.length; i++) {
      state.add(i, value(row, i));
    }
    return state;
  }

  @Override
  public ExtremaAccumulator merge(ExtremaAccumulator left, ExtremaAccumulator right) {
    return left.merge(right);
  }

  @Override
  public OutputRecord render(ExtremaAccumulator state) {
    OutputRecord.Builder builder = OutputRecord.builder();
    for (int i = 0; i < columns.size(); i++) {
      builder.put(columns.get(i) + "_min", state.min[i]);
      builder.put(columns.get(i) + "_max", state.max[i]);
    }
    return builder.build();
  }
}
