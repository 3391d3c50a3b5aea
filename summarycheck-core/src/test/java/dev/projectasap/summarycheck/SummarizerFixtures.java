/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.fixture.ColumnGenerator;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.FixtureSpec;
import dev.projectasap.summarycheck.fixture.TimeSeriesGenerator;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import dev.projectasap.summarycheck.summarizers.SumAccumulator;
import dev.projectasap.summarycheck.summarizers.SumSummarizer;
import java.util.List;

/** Datasets and deliberately broken summarizers shared by the tests. */
public final class SummarizerFixtures {

  private SummarizerFixtures() {}

  /** Uniform dataset with columns x0 in [0, 1) and x1 in [-5, 5), one row per time slot. */
  public static Dataset dataset(String label, long rows, int partitions, long seed) {
    return new TimeSeriesGenerator(
            FixtureSpec.builder()
                .label(label)
                .begin(0L)
                .end(rows)
                .frequency(1L)
                .column("x0", ColumnGenerator.uniform(1.0, 0.0))
                .column("x1", ColumnGenerator.uniform(10.0, -5.0))
                .partitionCount(partitions)
                .seed(seed)
                .build())
        .generate();
  }

  /** One row per partition, the row's time equal to its partition index. */
  public static Dataset onePerPartition(int partitions) {
    return dataset("one-per-partition", partitions, partitions, 7L);
  }

  /** Renders the association order of merges, e.g. {@code ((0 1) 2)}, as field "plan". */
  public static class PlanSummarizer implements Summarizer<String> {
    @Override
    public String zero() {
      return "";
    }

    @Override
    public String add(String state, Row row) {
      return state.isEmpty() ? String.valueOf(row.time()) : state + "+" + row.time();
    }

    @Override
    public String merge(String left, String right) {
      if (left.isEmpty()) {
        return right;
      }
      if (right.isEmpty()) {
        return left;
      }
      return "(" + left + " " + right + ")";
    }

    @Override
    public OutputRecord render(String state) {
      return OutputRecord.builder().put("plan", state).build();
    }
  }

  /** Sums x0 but merges by averaging, which depends on the association order. */
  public static final class AveragingMergeSummarizer implements Summarizer<Double> {
    @Override
    public Double zero() {
      return 0.0;
    }

    @Override
    public Double add(Double state, Row row) {
      return state + row.getDouble("x0");
    }

    @Override
    public Double merge(Double left, Double right) {
      return (left + right) / 2;
    }

    @Override
    public OutputRecord render(Double state) {
      return OutputRecord.builder().put("x0_sum", state).build();
    }
  }

  /** Sums x0 starting from 1, so its zero is not an identity. */
  public static final class OffsetZeroSummarizer implements Summarizer<Double> {
    @Override
    public Double zero() {
      return 1.0;
    }

    @Override
    public Double add(Double state, Row row) {
      return state + row.getDouble("x0");
    }

    @Override
    public Double merge(Double left, Double right) {
      return left + right;
    }

    @Override
    public OutputRecord render(Double state) {
      return OutputRecord.builder().put("x0_sum", state).build();
    }
  }

  /** A sum whose subtract removes the row twice. */
  public static SummarizerFactory doubleSubtractingSum() {
    return SummarizerFactory.named(
        "double-subtracting-sum",
        schema ->
            new SumSummarizer(schema, List.of("x0")) {
              @Override
              public SumAccumulator subtract(SumAccumulator state, Row row) {
                return super.subtract(super.subtract(state, row), row);
              }
            });
  }

  public static SummarizerFactory factory(String name, Summarizer<?> summarizer) {
    return SummarizerFactory.named(name, (Schema schema) -> summarizer);
  }
}
