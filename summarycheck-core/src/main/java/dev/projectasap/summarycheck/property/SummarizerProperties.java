/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import com.google.common.collect.ImmutableList;

/** The property sets a summarizer is checked against. */
public final class SummarizerProperties {

  private SummarizerProperties() {}

  /** Monoid laws every summarizer must satisfy. */
  public static ImmutableList<SummarizerProperty> standard() {
    return ImmutableList.of(
        new AssociativeLawProperty(),
        new RightIdentityProperty(),
        new LeftIdentityProperty(),
        new IdentityProperty());
  }

  /** The monoid laws plus the laws of left-subtractable summarizers. */
  public static ImmutableList<SummarizerProperty> subtractable() {
    return ImmutableList.<SummarizerProperty>builder()
        .addAll(standard())
        .add(new LeftSubtractableProperty())
        .add(new AddSubtractRoundTripProperty())
        .build();
  }

  /**
   * Looks up a property by its name.
   *
   * @throws IllegalArgumentException if no property has that name
   */
  public static SummarizerProperty byName(String name) {
    for (SummarizerProperty property : subtractable()) {
      if (property.name().equals(name)) {
        return property;
      }
    }
    throw new IllegalArgumentException("Unknown property: " + name);
  }
}
