/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.fixture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.projectasap.summarycheck.datamodel.Row;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeSeriesGeneratorTest {

  private static FixtureSpec.Builder spec() {
    return FixtureSpec.builder()
        .label("test")
        .begin(0L)
        .end(1000L)
        .frequency(10L)
        .column("a", ColumnGenerator.uniform(1.0, 0.0))
        .column("b", ColumnGenerator.uniform(2.0, -1.0))
        .partitionCount(7)
        .seed(12345L);
  }

  @Test
  void sameSpecGeneratesSameDataset() {
    Dataset first = new TimeSeriesGenerator(spec().build()).generate();
    Dataset second = new TimeSeriesGenerator(spec().build()).generate();

    assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
    assertThat(first.take(100)).isEqualTo(second.take(100));
  }

  @Test
  void differentSeedChangesFingerprint() {
    Dataset first = new TimeSeriesGenerator(spec().build()).generate();
    Dataset second = new TimeSeriesGenerator(spec().seed(54321L).build()).generate();

    assertThat(first.fingerprint()).isNotEqualTo(second.fingerprint());
  }

  @Test
  void fingerprintSeesPartitionBoundaries() {
    Dataset seven = new TimeSeriesGenerator(spec().build()).generate();
    Dataset five = new TimeSeriesGenerator(spec().partitionCount(5).build()).generate();

    assertThat(seven.take(100)).isEqualTo(five.take(100));
    assertThat(seven.fingerprint()).isNotEqualTo(five.fingerprint());
  }

  @Test
  void uniformSpecHasOneRowPerSlotAndId() {
    Dataset dataset = new TimeSeriesGenerator(spec().ids(List.of(1, 2)).build()).generate();

    assertThat(dataset.rowCount()).isEqualTo(200L);
    List<Row> rows = dataset.take(4);
    assertThat(rows).extracting(Row::time).containsExactly(0L, 0L, 10L, 10L);
    assertThat(rows).extracting(Row::id).containsExactly(1, 2, 1, 2);
  }

  @Test
  void rowsAreSplitIntoContiguousBalancedPartitions() {
    Dataset dataset = new TimeSeriesGenerator(spec().build()).generate();

    assertThat(dataset.partitionCount()).isEqualTo(7);
    assertThat(dataset.partitions()).extracting(Partition::size).containsOnly(14, 15);
    assertThat(dataset.partitions().stream().mapToLong(Partition::size).sum()).isEqualTo(100L);

    long previous = Long.MIN_VALUE;
    for (Partition partition : dataset.partitions()) {
      for (Row row : partition.rows()) {
        assertThat(row.time()).isGreaterThanOrEqualTo(previous);
        previous = row.time();
      }
    }
  }

  @Test
  void valuesFollowColumnGenerators() {
    Dataset dataset = new TimeSeriesGenerator(spec().build()).generate();

    for (Row row : dataset.take(100)) {
      assertThat(row.getDouble("a")).isBetween(0.0, 1.0);
      assertThat(row.getDouble("b")).isBetween(-1.0, 1.0);
    }
  }

  @Test
  void nonUniformTimesStayWithinTheirSlot() {
    Dataset dataset = new TimeSeriesGenerator(spec().uniform(false).build()).generate();

    List<Row> rows = dataset.take(100);
    for (int i = 0; i < rows.size(); i++) {
      assertThat(rows.get(i).time()).isBetween(i * 10L, i * 10L + 9L);
    }
    assertThat(rows).extracting(Row::time).anyMatch(t -> t % 10 != 0);
  }

  @Test
  void partialCyclesDropSomeRows() {
    Dataset dataset =
        new TimeSeriesGenerator(spec().ids(List.of(1, 2, 3)).ratioOfCycleSize(0.5).build())
            .generate();

    assertThat(dataset.rowCount()).isBetween(100L, 200L);
  }

  @Test
  void takeStopsAtTheEndOfTheDataset() {
    Dataset dataset = new TimeSeriesGenerator(spec().build()).generate();

    assertThat(dataset.take(1000)).hasSize(100);
    assertThat(dataset.take(0)).isEmpty();
  }

  @Test
  void invalidSpecsAreFixtureErrors() {
    assertThatThrownBy(() -> spec().frequency(0L).build()).isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().end(0L).build()).isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().ids(List.of()).build()).isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().ratioOfCycleSize(0.0).build())
        .isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().partitionCount(0).build())
        .isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> FixtureSpec.builder().end(10L).build())
        .isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().column("time", ColumnGenerator.uniform(1.0, 0.0)).build())
        .isInstanceOf(FixtureException.class);
    assertThatThrownBy(() -> spec().column("a", ColumnGenerator.uniform(1.0, 0.0)))
        .isInstanceOf(FixtureException.class);
  }

  @Test
  void fewerRowsThanPartitionsIsAFixtureError() {
    FixtureSpec tooSmall = spec().end(50L).partitionCount(7).build();

    assertThatThrownBy(() -> new TimeSeriesGenerator(tooSmall).generate())
        .isInstanceOf(FixtureException.class)
        .hasMessageContaining("fewer than its 7 partitions");
  }
}
