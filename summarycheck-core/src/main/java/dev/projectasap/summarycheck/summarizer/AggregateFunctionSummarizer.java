/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizer;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import java.util.Objects;
import java.util.function.Function;
import org.apache.flink.api.common.functions.AggregateFunction;

/**
 * Adapts a Flink {@link AggregateFunction} to the {@link Summarizer} contract so that the same
 * function used in a windowed Flink job can be checked for the monoid laws. {@code
 * createAccumulator} is the zero, {@code add} and {@code merge} map directly, and the result of
 * {@code getResult} is projected by a renderer.
 *
 * <p>Flink aggregate functions cannot remove values, so the adapter is never left-subtractable.
 *
 * @param <ACC> the Flink accumulator type
 * @param <OUT> the Flink result type
 */
public class AggregateFunctionSummarizer<ACC, OUT> implements Summarizer<ACC> {
  private final AggregateFunction<Row, ACC, OUT> function;
  private final Function<? super OUT, OutputRecord> renderer;

  /**
   * Constructs an AggregateFunctionSummarizer.
   *
   * @param function the aggregate function under test
   * @param renderer projection of the function's result to a comparable record
   */
  public AggregateFunctionSummarizer(
      AggregateFunction<Row, ACC, OUT> function, Function<? super OUT, OutputRecord> renderer) {
    this.function = Objects.requireNonNull(function, "function");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
  }

  @Override
  public ACC zero() {
    return function.createAccumulator();
  }

  @Override
  public ACC add(ACC state, Row row) {
    return function.add(row, state);
  }

  @Override
  public ACC merge(ACC left, ACC right) {
    return function.merge(left, right);
  }

  @Override
  public OutputRecord render(ACC state) {
    return renderer.apply(function.getResult(state));
  }

  @Override
  public String toString() {
    return "AggregateFunctionSummarizer{" + function.getClass().getSimpleName() + '}';
  }
}
