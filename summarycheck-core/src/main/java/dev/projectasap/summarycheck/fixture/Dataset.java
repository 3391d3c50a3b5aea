/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;
import org.apache.commons.codec.digest.XXHash32;

/**
 * A partitioned time-series dataset. Partitions are ordered and non-empty, and their rows are in
 * timestamp order across partition boundaries.
 */
public final class Dataset {
  private final String label;
  private final Schema schema;
  private final ImmutableList<Partition> partitions;
  private final long rowCount;

  /**
   * Constructs a Dataset.
   *
   * @param label display label used in reports
   * @param schema the row schema
   * @param partitions ordered partitions
   * @throws FixtureException if there are no partitions or the rows are out of order
   */
  public Dataset(String label, Schema schema, List<Partition> partitions) {
    if (partitions.isEmpty()) {
      throw new FixtureException("Dataset '" + label + "' has no partitions");
    }
    long count = 0;
    for (int i = 0; i < partitions.size(); i++) {
      Partition partition = partitions.get(i);
      if (i > 0 && partitions.get(i - 1).lastTime() > partition.firstTime()) {
        throw new FixtureException(
            "Dataset '" + label + "' partition " + i + " starts before its predecessor ends");
      }
      count += partition.size();
    }
    this.label = label;
    this.schema = schema;
    this.partitions = ImmutableList.copyOf(partitions);
    this.rowCount = count;
  }

  public String label() {
    return label;
  }

  public Schema schema() {
    return schema;
  }

  public ImmutableList<Partition> partitions() {
    return partitions;
  }

  public int partitionCount() {
    return partitions.size();
  }

  public long rowCount() {
    return rowCount;
  }

  /**
   * Returns the first {@code n} rows in dataset order, or all rows if there are fewer.
   *
   * @param n the maximum number of rows
   */
  public ImmutableList<Row> take(int n) {
    ImmutableList.Builder<Row> rows = ImmutableList.builder();
    int remaining = n;
    for (Partition partition : partitions) {
      for (int i = 0; i < partition.size() && remaining > 0; i++, remaining--) {
        rows.add(partition.row(i));
      }
      if (remaining == 0) {
        break;
      }
    }
    return rows.build();
  }

  /**
   * Hash of every row's time, id and values in dataset order. Equal specs yield equal
   * fingerprints, which makes the reproducibility of a fixture checkable.
   */
  public long fingerprint() {
    XXHash32 hash = new XXHash32(0);
    ByteBuffer buffer =
        ByteBuffer.allocate(Long.BYTES + Integer.BYTES + Double.BYTES * schema.size())
            .order(ByteOrder.LITTLE_ENDIAN);
    for (Partition partition : partitions) {
      for (int i = 0; i < partition.size(); i++) {
        Row row = partition.row(i);
        buffer.clear();
        buffer.putLong(row.time());
        buffer.putInt(row.id());
        for (int c = 0; c < schema.size(); c++) {
          buffer.putDouble(row.getDouble(c));
        }
        hash.update(buffer.array(), 0, buffer.position());
      }
      // partition boundary
      hash.update(-1);
    }
    return hash.getValue();
  }

  @Override
  public String toString() {
    return "Dataset{'"
        + label
        + "', rows="
        + rowCount
        + ", partitions="
        + partitions.size()
        + ", "
        + schema
        + '}';
  }
}
