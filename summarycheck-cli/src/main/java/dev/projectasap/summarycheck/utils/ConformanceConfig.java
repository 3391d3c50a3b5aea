/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.utils;

import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.equality.Tolerance;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.StandardFixtures;
import dev.projectasap.summarycheck.fixture.TimeSeriesGenerator;
import java.util.ArrayList;
import java.util.List;

/** Configuration for a conformance run. Contains fixtures, tolerance and summarizers. */
public class ConformanceConfig {
  public Tolerance tolerance = Tolerance.defaults();
  public int parallelism = 1;

  /** Cycles of the two standard datasets, or null when they are not used. */
  public Long standardCycles;

  public long standardFrequency = StandardFixtures.DEFAULT_FREQUENCY;
  public int standardPartitions = StandardFixtures.DEFAULT_PARTITIONS;
  public List<DatasetConfig> datasets = new ArrayList<>();
  public List<SummarizerConfig> summarizers = new ArrayList<>();

  /**
   * Generates the fixture datasets: the standard pair first, if configured, then the custom ones.
   *
   * @throws IllegalArgumentException if no dataset is configured
   */
  public ImmutableList<Dataset> buildFixtures() {
    ImmutableList.Builder<Dataset> fixtures = ImmutableList.builder();
    if (standardCycles != null) {
      fixtures.addAll(
          StandardFixtures.create(standardCycles, standardFrequency, standardPartitions));
    }
    for (DatasetConfig dataset : datasets) {
      fixtures.add(new TimeSeriesGenerator(dataset.toFixtureSpec()).generate());
    }
    ImmutableList<Dataset> built = fixtures.build();
    if (built.isEmpty()) {
      throw new IllegalArgumentException("No datasets configured");
    }
    return built;
  }
}
