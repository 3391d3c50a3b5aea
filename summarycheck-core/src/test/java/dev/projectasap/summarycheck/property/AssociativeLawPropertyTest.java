/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import static dev.projectasap.summarycheck.property.PropertyTestSupport.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import dev.projectasap.summarycheck.SummarizerFixtures;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.summarizers.SumSummarizer;
import org.junit.jupiter.api.Test;

class AssociativeLawPropertyTest {
  private final AssociativeLawProperty property = new AssociativeLawProperty();

  @Test
  void sumAgreesAtEveryDepth() {
    Dataset dataset = SummarizerFixtures.dataset("sum", 2000, 37, 3L);
    CheckContext context = context(property, dataset);

    property.test(dataset, SumSummarizer.factory("x0", "x1"), context);

    assertThat(context.comparisons()).isEqualTo(6);
    assertThat(context.phase()).isEqualTo(Phase.COMPARE);
  }

  @Test
  void orderSensitiveMergeIsReportedAtTheFirstDivergingDepth() {
    Dataset dataset = SummarizerFixtures.onePerPartition(4);
    CheckContext context = context(property, dataset);

    PropertyViolation violation =
        catchThrowableOfType(
            () ->
                property.test(
                    dataset,
                    SummarizerFixtures.factory("plan", new SummarizerFixtures.PlanSummarizer()),
                    context),
            PropertyViolation.class);

    assertThat(violation.getProperty()).isEqualTo("AssociativeLawProperty");
    assertThat(violation.getLocator()).isEqualTo("depth=2");
    assertThat(violation.getMismatches())
        .singleElement()
        .satisfies(
            m -> {
              assertThat(m.field).isEqualTo("plan");
              assertThat(m.expected.asText()).isEqualTo("(((0 1) 2) 3)");
              assertThat(m.actual.asText()).isEqualTo("((0 1) (2 3))");
            });
    assertThat(violation.getMessage())
        .startsWith("AssociativeLawProperty violated on dataset 'one-per-partition' at depth=2");
  }

  @Test
  void averagingMergeViolatesAssociativity() {
    Dataset dataset = SummarizerFixtures.dataset("avg", 500, 7, 11L);

    PropertyViolation violation =
        catchThrowableOfType(
            () ->
                property.test(
                    dataset,
                    SummarizerFixtures.factory(
                        "avg", new SummarizerFixtures.AveragingMergeSummarizer()),
                    context(property, dataset)),
            PropertyViolation.class);

    assertThat(violation.getLocator()).startsWith("depth=");
    assertThat(violation.getMismatches()).extracting(m -> m.field).containsExactly("x0_sum");
  }
}
