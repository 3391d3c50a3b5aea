/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.sinks;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.summarycheck.property.Phase;
import dev.projectasap.summarycheck.runner.CheckResult;
import dev.projectasap.summarycheck.runner.ConformanceReport;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportWriterTest {

  @Test
  void writesOneJsonLinePerReport(@TempDir Path dir) throws Exception {
    ConformanceReport first =
        new ConformanceReport(
            "sum", List.of(CheckResult.passed("IdentityProperty", 0, "a", Phase.COMPARE)));
    ConformanceReport second =
        new ConformanceReport(
            "extrema",
            List.of(
                CheckResult.setupError(
                    "LeftSubtractableProperty", 1, "b", Phase.INIT, "no subtract")));
    Path output = dir.resolve("out/report.jsonl");

    new ReportWriter().write(output.toString(), List.of(first, second));

    List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(2);
    ObjectMapper mapper = new ObjectMapper();
    JsonNode firstJson = mapper.readTree(lines.get(0));
    JsonNode secondJson = mapper.readTree(lines.get(1));
    assertThat(firstJson.get("summarizer").asText()).isEqualTo("sum");
    assertThat(firstJson.get("passed").asBoolean()).isTrue();
    assertThat(secondJson.get("passed").asBoolean()).isFalse();
    assertThat(secondJson.get("results").get(0).get("message").asText()).isEqualTo("no subtract");
  }
}
