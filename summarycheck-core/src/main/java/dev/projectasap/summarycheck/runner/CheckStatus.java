/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.runner;

/** Outcome of one (property, dataset) check. */
public enum CheckStatus {
  /** The law holds. */
  PASSED,
  /** Two renders required to be equal were not almost equal. */
  FAILED,
  /** The summarizer lacks a capability the property needs. */
  SETUP_ERROR,
  /** The summarizer threw while the property ran. */
  ERROR
}
