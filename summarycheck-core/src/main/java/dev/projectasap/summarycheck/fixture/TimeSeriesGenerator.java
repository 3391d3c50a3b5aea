/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import dev.projectasap.summarycheck.datamodel.Schema;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates reproducible partitioned time-series datasets from a {@link FixtureSpec}.
 *
 * <p>The time range is divided into cycles of {@code frequency} time units. A uniform fixture puts
 * each cycle at its slot start; a non-uniform fixture jitters it inside its slot, so timestamps
 * never decrease. Each id appears in a cycle with probability {@code ratioOfCycleSize},
 * in id order. A single {@link Random} seeded from the fixture seed drives every draw in row
 * order, so the output depends only on the fixture parameters.
 *
 * <p>Rows are split into {@code partitionCount} contiguous slices whose sizes differ by at most
 * one.
 */
public class TimeSeriesGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesGenerator.class);

  private final FixtureSpec spec;

  public TimeSeriesGenerator(FixtureSpec spec) {
    this.spec = spec;
  }

  /**
   * Generates the dataset.
   *
   * @throws FixtureException if the spec yields fewer rows than partitions
   */
  public Dataset generate() {
    Schema schema = spec.schema();
    List<ColumnGenerator> generators = spec.columns.values().asList();
    Random random = new Random(spec.seed);

    List<Long> times = new ArrayList<>();
    List<Integer> ids = new ArrayList<>();
    List<double[]> values = new ArrayList<>();

    long cycles = spec.cycles();
    for (long cycle = 0; cycle < cycles; cycle++) {
      long slot = spec.begin + cycle * spec.frequency;
      long time =
          spec.uniform ? slot : slot + jitter(random, Math.min(spec.frequency, spec.end - slot));
      for (int id : spec.ids) {
        if (spec.ratioOfCycleSize < 1.0 && random.nextDouble() >= spec.ratioOfCycleSize) {
          continue;
        }
        double[] row = new double[generators.size()];
        for (int c = 0; c < row.length; c++) {
          row[c] = generators.get(c).generate(time, id, random);
        }
        times.add(time);
        ids.add(id);
        values.add(row);
      }
    }

    int rowCount = times.size();
    if (rowCount < spec.partitionCount) {
      throw new FixtureException(
          "Fixture '"
              + spec.label
              + "' has "
              + rowCount
              + " rows, fewer than its "
              + spec.partitionCount
              + " partitions");
    }

    List<Partition> partitions = new ArrayList<>(spec.partitionCount);
    for (int p = 0; p < spec.partitionCount; p++) {
      int from = (int) ((long) p * rowCount / spec.partitionCount);
      int to = (int) ((long) (p + 1) * rowCount / spec.partitionCount);
      double[][] columns = new double[generators.size()][to - from];
      for (int i = from; i < to; i++) {
        double[] row = values.get(i);
        for (int c = 0; c < row.length; c++) {
          columns[c][i - from] = row[c];
        }
      }
      partitions.add(
          new Partition(
              p,
              schema,
              Longs.toArray(times.subList(from, to)),
              Ints.toArray(ids.subList(from, to)),
              columns));
    }

    Dataset dataset = new Dataset(spec.label, schema, partitions);
    LOG.debug("Generated {} from {}", dataset, spec);
    return dataset;
  }

  private static long jitter(Random random, long width) {
    return width <= 1 ? 0L : (long) (random.nextDouble() * width);
  }
}
