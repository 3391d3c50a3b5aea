/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.math3.primes.Primes;

/**
 * The two canonical conformance datasets. Both have one series and four columns; the first is
 * non-uniformly spaced with values in [0, 1), the second is uniformly spaced with columns of mixed
 * sign and scale.
 *
 * <p>The partition count defaults to the smallest prime above 1024, which no tree level divides
 * evenly.
 */
public final class StandardFixtures {
  public static final long DEFAULT_CYCLES = 10000L;
  public static final long DEFAULT_FREQUENCY = 100L;
  public static final int DEFAULT_PARTITIONS = Primes.nextPrime(1024);

  public static final long NON_UNIFORM_SEED = 31415926L;
  public static final long UNIFORM_SEED = 19811112L;

  private StandardFixtures() {}

  /** Builds both datasets with the default shape. */
  public static ImmutableList<Dataset> create() {
    return create(DEFAULT_CYCLES, DEFAULT_FREQUENCY, DEFAULT_PARTITIONS);
  }

  /**
   * Builds both datasets.
   *
   * @param cycles number of sampling cycles
   * @param frequency time units per cycle
   * @param partitionCount number of partitions of each dataset
   */
  public static ImmutableList<Dataset> create(long cycles, long frequency, int partitionCount) {
    return ImmutableList.of(
        new TimeSeriesGenerator(nonUniform(cycles, frequency, partitionCount)).generate(),
        new TimeSeriesGenerator(uniform(cycles, frequency, partitionCount)).generate());
  }

  public static FixtureSpec nonUniform(long cycles, long frequency, int partitionCount) {
    return FixtureSpec.builder()
        .label("non-uniform")
        .begin(0L)
        .end(cycles * frequency)
        .frequency(frequency)
        .uniform(false)
        .ids(List.of(1))
        .ratioOfCycleSize(1.0)
        .column("x0", ColumnGenerator.uniform(1.0, 0.0))
        .column("x1", ColumnGenerator.uniform(1.0, 0.0))
        .column("x2", ColumnGenerator.uniform(1.0, 0.0))
        .column("x3", ColumnGenerator.uniform(1.0, 0.0))
        .partitionCount(partitionCount)
        .seed(NON_UNIFORM_SEED)
        .build();
  }

  public static FixtureSpec uniform(long cycles, long frequency, int partitionCount) {
    return FixtureSpec.builder()
        .label("uniform")
        .begin(0L)
        .end(cycles * frequency)
        .frequency(frequency)
        .uniform(true)
        .ids(List.of(1))
        .ratioOfCycleSize(1.0)
        .column("x0", ColumnGenerator.uniform(1.0, -1.0))
        .column("x1", ColumnGenerator.uniform(-1.0, 0.0))
        .column("x2", ColumnGenerator.uniform(10.0, 0.0))
        .column("x3", ColumnGenerator.uniform(1.0, 1.0))
        .partitionCount(partitionCount)
        .seed(UNIFORM_SEED)
        .build();
  }
}
