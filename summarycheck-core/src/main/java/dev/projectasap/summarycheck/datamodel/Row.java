/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.datamodel;

import java.util.Arrays;

/**
 * One observation of a time series: a timestamp, a series id and one double per schema column.
 * Rows are immutable; the values array is never exposed.
 */
public final class Row {
  private final Schema schema;
  private final long time;
  private final int id;
  private final double[] values;

  /**
   * Constructs a Row.
   *
   * @param schema the schema the values conform to
   * @param time the observation timestamp
   * @param id the series id
   * @param values one value per schema column, copied
   */
  public Row(Schema schema, long time, int id, double... values) {
    if (values.length != schema.size()) {
      throw new IllegalArgumentException(
          "Row has " + values.length + " values but " + schema + " expects " + schema.size());
    }
    this.schema = schema;
    this.time = time;
    this.id = id;
    this.values = values.clone();
  }

  public Schema schema() {
    return schema;
  }

  public long time() {
    return time;
  }

  public int id() {
    return id;
  }

  public double getDouble(int index) {
    return values[index];
  }

  /**
   * Reads a value column by name.
   *
   * @throws IllegalArgumentException if the column is not part of this row's schema
   */
  public double getDouble(String column) {
    return values[schema.indexOf(column)];
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    Row other = (Row) o;
    return time == other.time
        && id == other.id
        && schema.equals(other.schema)
        && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Long.hashCode(time) + id) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "Row{time=" + time + ", id=" + id + ", values=" + Arrays.toString(values) + '}';
  }
}
