/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.summarizer.LeftSubtractableSummarizer;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import java.util.List;

/**
 * Arithmetic mean of each column, rendered as {@code <column>_mean}, plus the integral row {@code
 * count}. The mean of no rows is NaN.
 */
public class MeanSummarizer extends AbstractColumnSummarizer<SumAccumulator>
    implements LeftSubtractableSummarizer<SumAccumulator> {

  public MeanSummarizer(Schema schema, List<String> columns) {
    super(schema, columns);
  }

  public static SummarizerFactory factory(String... columns) {
    return SummarizerFactory.named(
        "mean" + List.of(columns), schema -> new MeanSummarizer(schema, List.of(columns)));
  }

  @Override
  public SumAccumulator zero() {
    return new SumAccumulator(indices.length);
  }

  @Override
  public SumAccumulator add(SumAccumulator state, Row row) {
    requireSchema(row);
    for (int i = 0; i < indices.length; i++) {
      state.sums[i].add(value(row, i));
    }
    state.count++;
    return state;
  }

  @Override
  public SumAccumulator subtract(SumAccumulator state, Row row) {
    requireSchema(row);
    for (int i = 0; i < indices.length; i++) {
      state.sums[i].subtract(value(row, i));
    }
    state.count--;
    return state;
  }

  @Override
  public SumAccumulator merge(SumAccumulator left, SumAccumulator right) {
    return left.merge(right);
  }

  @Override
  public OutputRecord render(SumAccumulator state) {
    OutputRecord.Builder builder = OutputRecord.builder().put("count", state.count());
    for (int i = 0; i < columns.size(); i++) {
      double mean = state.count() > 0 ? state.sum(i) / state.count() : Double.NaN;
      builder.put(columns.get(i) + "_mean", mean);
    }
    return builder.build();
  }
}
