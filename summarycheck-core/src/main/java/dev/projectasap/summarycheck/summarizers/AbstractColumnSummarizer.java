/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizers;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.datamodel.Schema;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import java.util.List;

/**
 * Base class for summarizers over a fixed set of value columns. Resolves the columns against the
 * schema once and rejects rows of any other schema. Row-only summarizers bind no columns.
 *
 * @param <U> the accumulator type
 */
public abstract class AbstractColumnSummarizer<U> implements Summarizer<U> {
  protected final Schema schema;
  protected final ImmutableList<String> columns;
  protected final int[] indices;

  /**
   * Binds the summarizer to columns of a schema.
   *
   * @throws IllegalArgumentException if no column is given or the schema lacks one
   */
  protected AbstractColumnSummarizer(Schema schema, List<String> columns) {
    Preconditions.checkArgument(!columns.isEmpty(), "At least one column is required");
    this.schema = schema;
    this.columns = ImmutableList.copyOf(columns);
    this.indices = new int[columns.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = schema.indexOf(columns.get(i));
    }
  }

  /** Binds the summarizer to a schema without reading any value column. */
  protected AbstractColumnSummarizer(Schema schema) {
    this.schema = schema;
    this.columns = ImmutableList.of();
    this.indices = new int[0];
  }

  /** Value of the i-th bound column in the row. */
  protected double value(Row row, int i) {
    return row.getDouble(indices[i]);
  }

  protected void requireSchema(Row row) {
    if (!schema.equals(row.schema())) {
      throw new IllegalArgumentException(
          this + " is bound to " + schema + " but got a row of " + row.schema());
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + columns;
  }
}
