/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

/**
 * Thrown for malformed or empty fixtures. A fixture error invalidates every check that would use
 * the dataset, so it aborts the whole conformance run.
 */
public class FixtureException extends RuntimeException {
  public FixtureException(String message) {
    super(message);
  }
}
