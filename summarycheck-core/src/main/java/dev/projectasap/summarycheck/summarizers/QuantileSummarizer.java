/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import com.google.common.base.Splitter;
import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Approximate quantiles of each column backed by DDSketch, rendered as {@code <column>_count} and
 * one array {@code <column>_quantiles} holding the value at each requested rank. Mergeable only.
 *
 * <p>Parameters: {@code relativeAccuracy} (default 0.01) and {@code quantiles}, a comma-separated
 * list of ranks in [0, 1] (default 0.5,0.9,0.99).
 */
public class QuantileSummarizer extends AbstractColumnSummarizer<QuantileAccumulator> {
  public static final double DEFAULT_RELATIVE_ACCURACY = 0.01;
  public static final String DEFAULT_QUANTILES = "0.5,0.9,0.99";

  private final double relativeAccuracy;
  private final double[] ranks;

  public QuantileSummarizer(Schema schema, List<String> columns) {
    this(schema, columns, Map.of());
  }

  /**
   * Constructs a QuantileSummarizer.
   *
   * @param schema the input schema
   * @param columns the columns to sketch
   * @param parameters configuration parameters including "relativeAccuracy" and "quantiles"
   */
  public QuantileSummarizer(Schema schema, List<String> columns, Map<String, String> parameters) {
    super(schema, columns);
    this.relativeAccuracy =
        Double.parseDouble(
            parameters.getOrDefault(
                "relativeAccuracy", String.valueOf(DEFAULT_RELATIVE_ACCURACY)));
    if (!(relativeAccuracy > 0.0 && relativeAccuracy < 1.0)) {
      throw new IllegalArgumentException(
          "Relative accuracy (" + relativeAccuracy + ") must be in (0, 1)");
    }

    List<Double> parsed = new ArrayList<>();
    for (String rank :
        Splitter.on(',')
            .trimResults()
            .omitEmptyStrings()
            .split(parameters.getOrDefault("quantiles", DEFAULT_QUANTILES))) {
      double value = Double.parseDouble(rank);
      if (value < 0.0 || value > 1.0) {
        throw new IllegalArgumentException("Quantile rank (" + value + ") must be in [0, 1]");
      }
      parsed.add(value);
    }
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException("At least one quantile rank is required");
    }
    this.ranks = parsed.stream().mapToDouble(Double::doubleValue).toArray();
  }

  public static SummarizerFactory factory(Map<String, String> parameters, String... columns) {
    return SummarizerFactory.named(
        "quantile" + List.of(columns),
        schema -> new QuantileSummarizer(schema, List.of(columns), parameters));
  }

  @Override
  public QuantileAccumulator zero() {
    return new QuantileAccumulator(indices.length, relativeAccuracy);
  }

  @Override
  public QuantileAccumulator add(QuantileAccumulator state, Row row) {
    requireSchema(row);
    for (int i = 0; i < indices.length; i++) {
      state.add(i, value(row, i));
    }
    return state;
  }

  @Override
  public QuantileAccumulator merge(QuantileAccumulator left, QuantileAccumulator right) {
    return left.merge(right);
  }

  @Override
  public OutputRecord render(QuantileAccumulator state) {
    OutputRecord.Builder builder = OutputRecord.builder();
    for (int i = 0; i < columns.size(); i++) {
      double[] values = new double[ranks.length];
      for (int r = 0; r < ranks.length; r++) {
        values[r] = state.quantile(i, ranks[r]);
      }
      builder.put(columns.get(i) + "_count", state.count(i));
      builder.putArray(columns.get(i) + "_quantiles", values);
    }
    return builder.build();
  }
}
