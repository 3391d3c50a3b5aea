/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.datamodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SchemaTest {

  @Test
  void columnsKeepDeclarationOrder() {
    Schema schema = Schema.of("x0", "x1", "x2");

    assertThat(schema.columns()).containsExactly("x0", "x1", "x2");
    assertThat(schema.size()).isEqualTo(3);
    assertThat(schema.indexOf("x2")).isEqualTo(2);
    assertThat(schema.hasColumn("x3")).isFalse();
  }

  @Test
  void unknownColumnIsRejected() {
    assertThatThrownBy(() -> Schema.of("x0").indexOf("y"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'y'");
  }

  @Test
  void reservedAndDuplicateNamesAreRejected() {
    assertThatThrownBy(() -> Schema.of("time")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Schema.of("id")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Schema.of("a", "a")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Schema.of(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rowsReadValuesByIndexAndName() {
    Schema schema = Schema.of("a", "b");
    double[] values = {1.5, -2.0};
    Row row = new Row(schema, 100L, 3, values);
    values[0] = 99.0;

    assertThat(row.time()).isEqualTo(100L);
    assertThat(row.id()).isEqualTo(3);
    assertThat(row.getDouble(0)).isEqualTo(1.5);
    assertThat(row.getDouble("b")).isEqualTo(-2.0);
    assertThat(row).isEqualTo(new Row(schema, 100L, 3, 1.5, -2.0));
  }

  @Test
  void rowMustMatchSchemaWidth() {
    assertThatThrownBy(() -> new Row(Schema.of("a", "b"), 0L, 1, 1.0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
