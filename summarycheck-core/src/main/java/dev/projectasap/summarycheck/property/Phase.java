/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

/** Progress of a single property check. */
public enum Phase {
  INIT,
  BUILD_INPUTS,
  COMPUTE,
  COMPARE
}
