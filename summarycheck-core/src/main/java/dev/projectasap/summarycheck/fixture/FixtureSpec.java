/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import dev.projectasap.summarycheck.datamodel.Schema;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of a synthetic time-series dataset. Two specs with equal parameters
 * generate identical datasets.
 */
public final class FixtureSpec {
  public final String label;
  public final long begin;
  public final long end;
  public final long frequency;
  public final boolean uniform;
  public final ImmutableList<Integer> ids;
  public final double ratioOfCycleSize;
  public final ImmutableMap<String, ColumnGenerator> columns;
  public final int partitionCount;
  public final long seed;

  private FixtureSpec(Builder builder) {
    this.label = builder.label;
    this.begin = builder.begin;
    this.end = builder.end;
    this.frequency = builder.frequency;
    this.uniform = builder.uniform;
    this.ids = ImmutableList.copyOf(builder.ids);
    this.ratioOfCycleSize = builder.ratioOfCycleSize;
    this.columns = ImmutableMap.copyOf(builder.columns);
    this.partitionCount = builder.partitionCount;
    this.seed = builder.seed;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Schema schema() {
    return Schema.of(columns.keySet().asList());
  }

  /** Number of cycles in {@code [begin, end)}. */
  public long cycles() {
    return (end - begin + frequency - 1) / frequency;
  }

  @Override
  public String toString() {
    return "FixtureSpec{"
        + "label='"
        + label
        + '\''
        + ", begin="
        + begin
        + ", end="
        + end
        + ", frequency="
        + frequency
        + ", uniform="
        + uniform
        + ", ids="
        + ids
        + ", ratioOfCycleSize="
        + ratioOfCycleSize
        + ", columns="
        + columns.keySet()
        + ", partitionCount="
        + partitionCount
        + ", seed="
        + seed
        + '}';
  }

  /** Builder for {@link FixtureSpec}; {@link #build()} validates the parameters. */
  public static final class Builder {
    private String label = "fixture";
    private long begin = 0L;
    private long end;
    private long frequency = 1L;
    private boolean uniform = true;
    private List<Integer> ids = List.of(1);
    private double ratioOfCycleSize = 1.0;
    private final Map<String, ColumnGenerator> columns = new LinkedHashMap<>();
    private int partitionCount = 1;
    private long seed;

    private Builder() {}

    public Builder label(String label) {
      this.label = label;
      return this;
    }

    public Builder begin(long begin) {
      this.begin = begin;
      return this;
    }

    public Builder end(long end) {
      this.end = end;
      return this;
    }

    public Builder frequency(long frequency) {
      this.frequency = frequency;
      return this;
    }

    public Builder uniform(boolean uniform) {
      this.uniform = uniform;
      return this;
    }

    public Builder ids(List<Integer> ids) {
      this.ids = ids;
      return this;
    }

    public Builder ratioOfCycleSize(double ratioOfCycleSize) {
      this.ratioOfCycleSize = ratioOfCycleSize;
      return this;
    }

    public Builder column(String name, ColumnGenerator generator) {
      if (columns.put(name, generator) != null) {
        throw new FixtureException("Duplicate column '" + name + "'");
      }
      return this;
    }

    public Builder partitionCount(int partitionCount) {
      this.partitionCount = partitionCount;
      return this;
    }

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    /**
     * Validates and builds the spec.
     *
     * @throws FixtureException if the parameters cannot describe a non-empty dataset
     */
    public FixtureSpec build() {
      if (frequency <= 0) {
        throw new FixtureException("Frequency must be positive, got: " + frequency);
      }
      if (end <= begin) {
        throw new FixtureException("Empty time range [" + begin + ", " + end + ")");
      }
      if (ids == null || ids.isEmpty()) {
        throw new FixtureException("At least one series id is required");
      }
      if (!(ratioOfCycleSize > 0.0 && ratioOfCycleSize <= 1.0)) {
        throw new FixtureException(
            "ratioOfCycleSize must be in (0, 1], got: " + ratioOfCycleSize);
      }
      if (columns.isEmpty()) {
        throw new FixtureException("At least one column generator is required");
      }
      if (partitionCount <= 0) {
        throw new FixtureException("Partition count must be positive, got: " + partitionCount);
      }
      try {
        Schema.of(List.copyOf(columns.keySet()));
      } catch (IllegalArgumentException e) {
        throw new FixtureException("Invalid columns: " + e.getMessage());
      }
      return new FixtureSpec(this);
    }
  }
}
