/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.summarizer;

/**
 * Thrown when a check needs a capability, such as row removal, that the summarizer under test does
 * not declare. This is a setup error and not an algebraic violation.
 */
public class UnsupportedCapabilityException extends RuntimeException {
  private final String capability;

  public UnsupportedCapabilityException(String summarizer, String capability) {
    super("Summarizer " + summarizer + " does not support " + capability);
    this.capability = capability;
  }

  public String getCapability() {
    return capability;
  }
}
