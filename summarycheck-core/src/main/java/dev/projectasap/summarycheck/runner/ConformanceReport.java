/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.datamodel.SerializableToSink;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** All check results of one summarizer, in the order they ran. */
public final class ConformanceReport implements SerializableToSink {
  private final String summarizer;
  private final ImmutableList<CheckResult> results;

  public ConformanceReport(String summarizer, List<CheckResult> results) {
    this.summarizer = summarizer;
    this.results = ImmutableList.copyOf(results);
  }

  public String getSummarizer() {
    return summarizer;
  }

  public ImmutableList<CheckResult> getResults() {
    return results;
  }

  /** True if every check passed. */
  public boolean passed() {
    return results.stream().allMatch(CheckResult::isPassed);
  }

  /** Checks that did not pass. */
  public List<CheckResult> failures() {
    return results.stream().filter(r -> !r.isPassed()).collect(Collectors.toList());
  }

  public long count(CheckStatus status) {
    return results.stream().filter(r -> r.status == status).count();
  }

  @Override
  public JsonNode serializeToJson() {
    ObjectMapper objectMapper = new ObjectMapper();
    ObjectNode jsonNode = objectMapper.createObjectNode();
    jsonNode.put("summarizer", summarizer);
    jsonNode.put("passed", passed());
    ObjectNode counts = jsonNode.putObject("counts");
    for (CheckStatus status : CheckStatus.values()) {
      counts.put(status.name().toLowerCase(Locale.ROOT), count(status));
    }
    ArrayNode resultArray = jsonNode.putArray("results");
    for (CheckResult result : results) {
      resultArray.add(result.serializeToJson());
    }
    return jsonNode;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("\n========== CONFORMANCE REPORT ==========\n");
    sb.append(String.format("Summarizer:    %s\n", summarizer));
    sb.append(String.format("Checks:        %d\n", results.size()));
    sb.append(String.format("Passed:        %d\n", count(CheckStatus.PASSED)));
    sb.append(String.format("Failed:        %d\n", count(CheckStatus.FAILED)));
    sb.append(String.format("Setup errors:  %d\n", count(CheckStatus.SETUP_ERROR)));
    sb.append(String.format("Errors:        %d\n", count(CheckStatus.ERROR)));
    for (CheckResult failure : failures()) {
      sb.append("  ").append(failure).append('\n');
    }
    sb.append("========================================");
    return sb.toString();
  }
}
