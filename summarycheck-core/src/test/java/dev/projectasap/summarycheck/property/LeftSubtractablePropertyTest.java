/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import static dev.projectasap.summarycheck.property.PropertyTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import dev.projectasap.summarycheck.SummarizerFixtures;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.FixtureException;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import dev.projectasap.summarycheck.summarizer.UnsupportedCapabilityException;
import dev.projectasap.summarycheck.summarizers.CountSummarizer;
import dev.projectasap.summarycheck.summarizers.ExtremaSummarizer;
import dev.projectasap.summarycheck.summarizers.MeanSummarizer;
import dev.projectasap.summarycheck.summarizers.SumSummarizer;
import dev.projectasap.summarycheck.summarizers.VarianceSummarizer;
import org.junit.jupiter.api.Test;

class LeftSubtractablePropertyTest {
  private final LeftSubtractableProperty property = new LeftSubtractableProperty();
  private final Dataset dataset = SummarizerFixtures.dataset("windows", 3000, 5, 17L);

  @Test
  void slidesWindowsOf11And121OverTheFirstThousandRows() {
    for (SummarizerFactory factory :
        new SummarizerFactory[] {
          SumSummarizer.factory("x0", "x1"),
          CountSummarizer.factory(),
          MeanSummarizer.factory("x0", "x1"),
          VarianceSummarizer.factory("x0", "x1")
        }) {
      CheckContext context = context(property, dataset);

      property.test(dataset, factory, context);

      assertThat(context.comparisons()).as("%s", factory).isEqualTo((1000 - 11) + (1000 - 121));
    }
  }

  @Test
  void brokenSubtractIsReportedAtTheFirstSlide() {
    PropertyViolation violation =
        catchThrowableOfType(
            () ->
                property.test(
                    dataset, SummarizerFixtures.doubleSubtractingSum(), context(property, dataset)),
            PropertyViolation.class);

    assertThat(violation.getLocator()).isEqualTo("window=11,offset=1");
    assertThat(violation.getMismatches()).extracting(m -> m.field).containsExactly("x0_sum");
  }

  @Test
  void mergeOnlySummarizerIsASetupError() {
    CheckContext context = context(property, dataset);

    assertThatThrownBy(() -> property.test(dataset, ExtremaSummarizer.factory("x0"), context))
        .isInstanceOf(UnsupportedCapabilityException.class)
        .satisfies(
            e ->
                assertThat(((UnsupportedCapabilityException) e).getCapability())
                    .isEqualTo("subtract"));
    assertThat(context.phase()).isEqualTo(Phase.INIT);
  }

  @Test
  void datasetNoLongerThanTheFirstWindowIsAFixtureError() {
    Dataset tiny = SummarizerFixtures.dataset("tiny", 11, 1, 1L);

    assertThatThrownBy(
            () -> property.test(tiny, SumSummarizer.factory("x0"), context(property, tiny)))
        .isInstanceOf(FixtureException.class)
        .hasMessageContaining("'tiny'");
  }
}
