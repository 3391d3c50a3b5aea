/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.utils;

import dev.projectasap.summarycheck.fixture.ColumnGenerator;
import dev.projectasap.summarycheck.fixture.FixtureSpec;
import java.util.ArrayList;
import java.util.List;

/** Configuration for one generated fixture dataset. */
public class DatasetConfig {
  public String label = "fixture";
  public long begin;
  public long end;
  public long frequency = 1L;
  public boolean uniform = true;
  public List<Integer> ids = new ArrayList<>(List.of(1));
  public double ratioOfCycleSize = 1.0;
  public int partitions = 1;
  public long seed;
  public List<ColumnConfig> columns = new ArrayList<>();

  /** A uniformly distributed column {@code offset + scale * U[0, 1)}. */
  public static class ColumnConfig {
    public String name;
    public double scale = 1.0;
    public double offset;
  }

  public FixtureSpec toFixtureSpec() {
    FixtureSpec.Builder builder =
        FixtureSpec.builder()
            .label(label)
            .begin(begin)
            .end(end)
            .frequency(frequency)
            .uniform(uniform)
            .ids(ids)
            .ratioOfCycleSize(ratioOfCycleSize)
            .partitionCount(partitions)
            .seed(seed);
    for (ColumnConfig column : columns) {
      builder.column(column.name, ColumnGenerator.uniform(column.scale, column.offset));
    }
    return builder.build();
  }
}
