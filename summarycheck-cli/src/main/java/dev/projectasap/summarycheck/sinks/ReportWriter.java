/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.sinks;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.summarycheck.runner.ConformanceReport;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes conformance reports as JSON lines, one report per summarizer. */
public class ReportWriter {
  private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

  private final ObjectMapper objectMapper = new ObjectMapper();

  /**
   * Writes the reports to a file, replacing any previous content.
   *
   * @param outputFilePath the output file path
   * @param reports reports in run order
   * @throws IOException if the file cannot be written
   */
  public void write(String outputFilePath, List<ConformanceReport> reports) throws IOException {
    Path path = Paths.get(outputFilePath);
    if (path.getParent() != null) {
      Files.createDirectories(path.getParent());
    }
    logger.info("Writing {} reports to {}", reports.size(), path);
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      write(writer, reports);
    }
  }

  public void write(Writer writer, List<ConformanceReport> reports) throws IOException {
    for (ConformanceReport report : reports) {
      writer.write(objectMapper.writeValueAsString(report.serializeToJson()));
      writer.write("\n");
    }
    writer.flush();
  }
}
