/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.property.LeftSubtractableProperty;
import dev.projectasap.summarycheck.property.SummarizerProperty;
import dev.projectasap.summarycheck.summarizers.SumSummarizer;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Paths;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

  private static String resource(String name) throws URISyntaxException {
    return Paths.get(ConfigLoaderTest.class.getResource("/" + name).toURI()).toString();
  }

  @Test
  void loadsDatasetsAndSummarizers() throws Exception {
    ConformanceConfig config = ConfigLoader.loadConfig(resource("test-conformance.yaml"));

    assertThat(config.tolerance.absolute()).isEqualTo(1e-6);
    assertThat(config.tolerance.relative()).isEqualTo(1e-9);
    assertThat(config.parallelism).isEqualTo(2);
    assertThat(config.standardCycles).isNull();

    assertThat(config.datasets).hasSize(1);
    DatasetConfig dataset = config.datasets.get(0);
    assertThat(dataset.label).isEqualTo("small");
    assertThat(dataset.uniform).isFalse();
    assertThat(dataset.ids).containsExactly(1, 2);
    assertThat(dataset.partitions).isEqualTo(7);
    assertThat(dataset.columns).extracting(c -> c.name).containsExactly("a", "b");
    assertThat(dataset.columns.get(1).scale).isEqualTo(1.0);

    assertThat(config.summarizers)
        .extracting(s -> s.type)
        .containsExactly("SumSummarizer", "ExtremaSummarizer", "QuantileSummarizer");
    assertThat(config.summarizers.get(2).parameters).containsEntry("relativeAccuracy", "0.02");
  }

  @Test
  void buildsFixturesFromDatasetConfigs() throws Exception {
    List<Dataset> fixtures =
        ConfigLoader.loadConfig(resource("test-conformance.yaml")).buildFixtures();

    assertThat(fixtures).hasSize(1);
    assertThat(fixtures.get(0).label()).isEqualTo("small");
    assertThat(fixtures.get(0).partitionCount()).isEqualTo(7);
    assertThat(fixtures.get(0).schema().columns()).containsExactly("a", "b");
  }

  @Test
  void standardFixturesShortcut() throws IOException {
    ConformanceConfig config =
        ConfigLoader.parseConfig(
            "standardFixtures:\n"
                + "  cycles: 100\n"
                + "  frequency: 10\n"
                + "  partitions: 11\n"
                + "summarizers:\n"
                + "  - type: CountSummarizer\n");

    List<Dataset> fixtures = config.buildFixtures();

    assertThat(config.tolerance.absolute()).isEqualTo(1e-9);
    assertThat(fixtures).extracting(Dataset::label).containsExactly("non-uniform", "uniform");
    assertThat(fixtures.get(0).rowCount()).isEqualTo(100L);
    assertThat(fixtures.get(0).partitionCount()).isEqualTo(11);
  }

  @Test
  void missingKeysAreReported() {
    assertThatThrownBy(() -> ConfigLoader.parseConfig("parallelism: 2\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'summarizers'");
    assertThatThrownBy(
            () ->
                ConfigLoader.parseConfig(
                    "datasets:\n  - label: x\n    columns: [{name: a}]\nsummarizers: []\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'end'");
    assertThatThrownBy(() -> ConfigLoader.parseConfig("summarizers:\n  - columns: [a]\n"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'type'");
  }

  @Test
  void configWithoutDatasetsCannotBuildFixtures() throws IOException {
    ConformanceConfig config =
        ConfigLoader.parseConfig("summarizers:\n  - type: CountSummarizer\n");

    assertThatThrownBy(config::buildFixtures).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void summarizerTypeResolvesReflectively() throws Exception {
    ConformanceConfig config = ConfigLoader.loadConfig(resource("test-conformance.yaml"));
    Dataset dataset = config.buildFixtures().get(0);

    SummarizerConfig sum = config.summarizers.get(0);
    assertThat(sum.toFactory().name()).isEqualTo("SumSummarizer[a, b]");
    assertThat(sum.toFactory().apply(dataset.schema())).isInstanceOf(SumSummarizer.class);
    assertThat(sum.resolveProperties(dataset.schema()))
        .extracting(SummarizerProperty::name)
        .contains("LeftSubtractableProperty");

    SummarizerConfig extrema = config.summarizers.get(1);
    assertThat(extrema.resolveProperties(dataset.schema()))
        .extracting(SummarizerProperty::name)
        .containsExactly("AssociativeLawProperty", "IdentityProperty");

    SummarizerConfig quantile = config.summarizers.get(2);
    assertThat(quantile.resolveProperties(dataset.schema()))
        .noneMatch(p -> p instanceof LeftSubtractableProperty);
  }

  @Test
  void unknownSummarizerTypeIsRejected() {
    SummarizerConfig config = new SummarizerConfig();
    config.type = "MedianOfMediansSummarizer";

    assertThatThrownBy(config::toFactory)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("MedianOfMediansSummarizer");
  }
}
