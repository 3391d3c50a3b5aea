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

/** Number of rows, rendered as the integral field {@code count}. */
public class CountSummarizer extends AbstractColumnSummarizer<CountAccumulator>
    implements LeftSubtractableSummarizer<CountAccumulator> {

  public CountSummarizer(Schema schema) {
    super(schema);
  }

  public static SummarizerFactory factory() {
    return SummarizerFactory.named("count", CountSummarizer::new);
  }

  @Override
  public CountAccumulator zero() {
    return new CountAccumulator();
  }

  @Override
  public CountAccumulator add(CountAccumulator state, Row row) {
    requireSchema(row);
    state.count++;
    return state;
  }

  @Override
  public CountAccumulator subtract(CountAccumulator state, Row row) {
    requireSchema(row);
    state.count--;
    return state;
  }

  @Override
  public CountAccumulator merge(CountAccumulator left, CountAccumulator right) {
    return left.merge(right);
  }

  @Override
  public OutputRecord render(CountAccumulator state) {
    return OutputRecord.builder().put("count", state.count()).build();
  }

  @Override
  public String toString() {
    return "CountSummarizer";
  }
}
