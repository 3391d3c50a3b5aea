/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizer;

import dev.projectasap.summarycheck.datamodel.Row;
import java.util.Optional;

/**
 * A summarizer that can remove rows it previously added, oldest first. This allows a sliding
 * window to be maintained with one {@code add} and one {@code subtract} per step instead of a full
 * recomputation.
 *
 * <p>Declaring this capability promises that {@code subtract(add(s, row), row)} renders equal to
 * {@code s} and that removing the oldest rows of a window renders equal to folding the remaining
 * rows from {@link #zero()}.
 *
 * @param <U> the accumulator type
 */
public interface LeftSubtractableSummarizer<U> extends Summarizer<U> {

  /**
   * Removes the effect of a previously added row.
   *
   * @param state an accumulator that includes {@code row}, possibly updated in place
   * @param row the row to remove
   * @return the accumulator without the row
   */
  U subtract(U state, Row row);

  @Override
  default Optional<LeftSubtractableSummarizer<U>> leftSubtractable() {
    return Optional.of(this);
  }
}
