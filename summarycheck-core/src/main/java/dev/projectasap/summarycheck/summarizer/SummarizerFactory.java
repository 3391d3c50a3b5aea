/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizer;

import dev.projectasap.summarycheck.datamodel.Schema;
import java.util.function.Function;

/**
 * Creates summarizers bound to an input schema. A factory may be invoked once per property check
 * and dataset, so it must not hand out shared mutable state.
 */
public interface SummarizerFactory {

  /**
   * Binds a summarizer to a schema.
   *
   * @throws IllegalArgumentException if the schema lacks a column the summarizer needs
   */
  Summarizer<?> apply(Schema schema);

  /** Name used in logs and reports. */
  default String name() {
    return getClass().getSimpleName();
  }

  static SummarizerFactory named(String name, Function<Schema, Summarizer<?>> function) {
    return new SummarizerFactory() {
      @Override
      public Summarizer<?> apply(Schema schema) {
        return function.apply(schema);
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }
}
