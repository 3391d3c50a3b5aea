/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import java.util.AbstractList;
import java.util.List;

/**
 * An ordered, immutable slice of a dataset. Rows are stored column-wise and materialized on
 * access, in timestamp order.
 */
public final class Partition {
  private final int index;
  private final Schema schema;
  private final long[] times;
  private final int[] ids;
  private final double[][] columns;

  Partition(int index, Schema schema, long[] times, int[] ids, double[][] columns) {
    if (times.length == 0) {
      throw new FixtureException("Partition " + index + " is empty");
    }
    this.index = index;
    this.schema = schema;
    this.times = times;
    this.ids = ids;
    this.columns = columns;
  }

  public int size() {
    return times.length;
  }

  public Row row(int i) {
    double[] values = new double[columns.length];
    for (int c = 0; c < columns.length; c++) {
      values[c] = columns[c][i];
    }
    return new Row(schema, times[i], ids[i], values);
  }

  /** Read-only view of the rows of this partition. */
  public List<Row> rows() {
    return new AbstractList<Row>() {
      @Override
      public Row get(int i) {
        return row(i);
      }

      @Override
      public int size() {
        return times.length;
      }
    };
  }

  long firstTime() {
    return times[0];
  }

  long lastTime() {
    return times[times.length - 1];
  }
}
