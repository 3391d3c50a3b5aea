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

/** Sum of each column, rendered as {@code <column>_sum}. */
public class SumSummarizer extends AbstractColumnSummarizer<SumAccumulator>
    implements LeftSubtractableSummarizer<SumAccumulator> {

  public SumSummarizer(Schema schema, List<String> columns) {
    super(schema, columns);
  }

  public static SummarizerFactory factory(String... columns) {
    return SummarizerFactory.named(
        "sum" + List.of(columns), schema -> new SumSummarizer(schema, List.of(columns)));
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
    OutputRecord.Builder builder = OutputRecord.builder();
    for (int i = 0; i < columns.size(); i++) {
      builder.put(columns.get(i) + "_sum", state.sum(i));
    }
    return builder.build();
  }
}
