/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.summarycheck.SummarizerFixtures;
import dev.projectasap.summarycheck.datamodel.OutputRecord;
import org.junit.jupiter.api.Test;

class CheckContextTest {
  private final CheckContext context =
      PropertyTestSupport.context(
          new IdentityProperty(), SummarizerFixtures.dataset("context", 10, 1, 1L));

  @Test
  void phasesAdvanceAndComparisonsAreCounted() {
    assertThat(context.phase()).isEqualTo(Phase.INIT);

    context.buildInputs();
    context.compute();
    context.assertAlmostEquals(record(1.0), record(1.0), "first");
    context.compute();
    context.assertAlmostEquals(record(2.0), record(2.0), "second");

    assertThat(context.phase()).isEqualTo(Phase.COMPARE);
    assertThat(context.comparisons()).isEqualTo(2);
  }

  @Test
  void phasesCannotGoBackToInputs() {
    context.buildInputs();
    context.compute();

    assertThatThrownBy(context::buildInputs).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void failedComparisonCarriesTheLocator() {
    assertThatThrownBy(() -> context.assertAlmostEquals(record(1.0), record(1.5), "step=3"))
        .isInstanceOf(PropertyViolation.class)
        .hasMessageContaining("IdentityProperty violated on dataset 'context' at step=3")
        .hasMessageContaining("field 'v'");
    assertThat(context.comparisons()).isZero();
  }

  @Test
  void propertiesAreFoundByName() {
    assertThat(SummarizerProperties.standard()).hasSize(4);
    assertThat(SummarizerProperties.subtractable())
        .extracting(SummarizerProperty::name)
        .endsWith("LeftSubtractableProperty", "AddSubtractRoundTripProperty");
    assertThat(SummarizerProperties.byName("LeftIdentityProperty"))
        .isInstanceOf(LeftIdentityProperty.class);
    assertThatThrownBy(() -> SummarizerProperties.byName("Commutativity"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static OutputRecord record(double value) {
    return OutputRecord.builder().put("v", value).build();
  }
}
