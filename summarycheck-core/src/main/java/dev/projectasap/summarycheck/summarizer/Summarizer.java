/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizer;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.datamodel.Row;
import java.util.Optional;

/**
 * An incremental aggregation over rows, bound to a fixed input schema. The accumulator type U is
 * opaque to callers; they only move it through the operations below.
 *
 * <p>For correct parallel and multi-stage execution a summarizer must form a monoid: {@link
 * #zero()} is a two-sided identity of {@link #merge} and {@code merge} is associative, both with
 * respect to the rendered output.
 *
 * <p>Accumulators belong to the caller. Implementations may update the accumulator passed to
 * {@code add} or as the left argument of {@code merge} in place and return it, so a caller must
 * not reuse an accumulator after handing it to one of those operations.
 *
 * @param <U> the accumulator type
 */
public interface Summarizer<U> {

  /** Returns a fresh identity accumulator. Every call returns an equivalent value. */
  U zero();

  /**
   * Folds one row into an accumulator.
   *
   * @param state the accumulator, possibly updated in place
   * @param row the row to add
   * @return the accumulator including the row
   */
  U add(U state, Row row);

  /**
   * Combines accumulators over disjoint, order-adjacent row sets. The rows of {@code left}
   * precede the rows of {@code right}. This operation should be associative.
   *
   * @param left the accumulator over the earlier rows, possibly updated in place
   * @param right the accumulator over the later rows, left untouched
   * @return the accumulator over both row sets
   */
  U merge(U left, U right);

  /** Projects an accumulator to its externally comparable output. Must be pure. */
  OutputRecord render(U state);

  /**
   * Capability query for FIFO row removal. Summarizers that support {@code subtract} implement
   * {@link LeftSubtractableSummarizer}, which overrides this method.
   *
   * @return this summarizer viewed as left-subtractable, or empty if it does not support removal
   */
  default Optional<LeftSubtractableSummarizer<U>> leftSubtractable() {
    return Optional.empty();
  }
}
