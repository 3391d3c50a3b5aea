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
 * Sample variance and standard deviation of each column, rendered as {@code <column>_variance}
 * and {@code <column>_stddev} next to the integral {@code count}.
 *
 * <p>Uses the sample formula {@code sum((x - mean)^2) / (n - 1)}; fewer than two rows give NaN.
 */
public class VarianceSummarizer extends AbstractColumnSummarizer<MomentsAccumulator>
    implements LeftSubtractableSummarizer<MomentsAccumulator> {

  public VarianceSummarizer(Schema schema, List<String> columns) {
    super(schema, columns);
  }

  public static SummarizerFactory factory(String... columns) {
    return SummarizerFactory.named(
        "variance" + List.of(columns), schema -> new VarianceSummarizer(schema, List.of(columns)));
  }

  @Override
  public MomentsAccumulator zero() {
    return new MomentsAccumulator(indices.length);
  }

  @Override
  public MomentsAccumulator add(MomentsAccumulator state, Row row) {
    requireSchema(row);
    state.add(values(row));
    return state;
  }

  @Override
  public MomentsAccumulator subtract(MomentsAccumulator state, Row row) {
    requireSchema(row);
    state.subtract(values(row));
    return state;
  }

  @Override
  public MomentsAccumulator merge(MomentsAccumulator left, MomentsAccumulator right) {
    return left.merge(right);
  }

  @Override
  public OutputRecord render(MomentsAccumulator state) {
    OutputRecord.Builder builder = OutputRecord.builder().put("count", state.count());
    for (int i = 0; i < columns.size(); i++) {
      double variance = state.variance(i);
      builder.put(columns.get(i) + "_variance", variance);
      builder.put(columns.get(i) + "_stddev", Math.sqrt(variance));
    }
    return builder.build();
  }

  private double[] values(Row row) {
    double[] values = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      values[i] = value(row, i);
    }
    return values;
  }
}
