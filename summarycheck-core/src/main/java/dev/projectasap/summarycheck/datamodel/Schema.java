/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Input schema of a time-series dataset. Every row carries an implicit {@code time} (long) and
 * {@code id} (int) column followed by the ordered double-valued columns named here.
 */
public final class Schema {
  public static final String TIME = "time";
  public static final String ID = "id";

  private final ImmutableList<String> columns;

  private Schema(List<String> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  /**
   * Creates a schema over the given value columns.
   *
   * @param columns value column names, in row order
   * @return the schema
   * @throws IllegalArgumentException if a name is blank, reserved or repeated
   */
  public static Schema of(List<String> columns) {
    Set<String> seen = new HashSet<>();
    for (String column : columns) {
      Preconditions.checkArgument(
          column != null && !column.isBlank(), "Column names must not be blank");
      Preconditions.checkArgument(
          !TIME.equals(column) && !ID.equals(column), "Column name '%s' is reserved", column);
      Preconditions.checkArgument(seen.add(column), "Duplicate column '%s'", column);
    }
    return new Schema(columns);
  }

  public static Schema of(String... columns) {
    return of(List.of(columns));
  }

  public ImmutableList<String> columns() {
    return columns;
  }

  public int size() {
    return columns.size();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Resolves a value column to its index.
   *
   * @throws IllegalArgumentException if the schema has no such column
   */
  public int indexOf(String column) {
    int index = columns.indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException(
          "Column '" + column + "' is not part of schema " + columns);
    }
    return index;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema && columns.equals(((Schema) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "Schema{time, id, " + String.join(", ", columns) + "}";
  }
}
