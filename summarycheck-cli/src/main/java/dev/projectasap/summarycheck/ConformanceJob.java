/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck;

import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import dev.projectasap.summarycheck.runner.ConformanceReport;
import dev.projectasap.summarycheck.runner.ConformanceRunner;
import dev.projectasap.summarycheck.sinks.ReportWriter;
import dev.projectasap.summarycheck.utils.ConfigLoader;
import dev.projectasap.summarycheck.utils.ConformanceConfig;
import dev.projectasap.summarycheck.utils.SummarizerConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point. Loads a YAML configuration, generates the fixture datasets once and
 * checks every configured summarizer against its properties.
 */
public class ConformanceJob {
  private static final Logger LOG = LoggerFactory.getLogger(ConformanceJob.class);

  static ArgumentParser buildParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("ConformanceJob")
            .build()
            .defaultHelp(true)
            .description("Summarizer algebra conformance check");

    parser
        .addArgument("--configFilePath")
        .type(String.class)
        .required(true)
        .help("Configuration file path");

    parser.addArgument("--outputFilePath").type(String.class).help("JSON report output path");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .help("Worker threads for partition folds, overrides the configuration");

    parser
        .addArgument("--failOnViolation")
        .type(Boolean.class)
        .setDefault(true)
        .help("Exit with status 1 when any check does not pass (default: true)");

    return parser;
  }

  /**
   * Runs all configured summarizers.
   *
   * @param config the loaded configuration
   * @param parallelism worker threads for the reducer, 1 runs on the calling thread
   * @return one report per summarizer, in configuration order
   */
  static List<ConformanceReport> run(ConformanceConfig config, int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("Parallelism must be positive: " + parallelism);
    }
    List<Dataset> fixtures = config.buildFixtures();
    LOG.info("Generated {} fixture datasets", fixtures.size());

    ExecutorService executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism) : null;
    try {
      TreeReducer reducer = new TreeReducer(executor);
      List<ConformanceReport> reports = new ArrayList<>();
      for (SummarizerConfig summarizer : config.summarizers) {
        ConformanceRunner runner =
            new ConformanceRunner(
                fixtures,
                summarizer.resolveProperties(fixtures.get(0).schema()),
                config.tolerance,
                reducer);
        reports.add(runner.run(summarizer.toFactory()));
      }
      return reports;
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }
  }

  /**
   * Main entry point for the conformance check.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the configuration cannot be loaded or the report cannot be written
   */
  public static void main(String[] args) throws Exception {
    ArgumentParser parser = buildParser();
    Namespace parsedArgs;
    try {
      parsedArgs = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }

    // Set log level based on command line argument
    if (parsedArgs.getString("logLevel") != null) {
      System.setProperty("log.level", parsedArgs.getString("logLevel"));
    }

    LOG.info("Starting with log level: {}", System.getProperty("log.level", "INFO"));

    ConformanceConfig config = ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));
    Integer parallelism = parsedArgs.getInt("parallelism");
    List<ConformanceReport> reports =
        run(config, parallelism != null ? parallelism : config.parallelism);

    String outputFilePath = parsedArgs.getString("outputFilePath");
    if (outputFilePath != null) {
      new ReportWriter().write(outputFilePath, reports);
    }

    boolean allPassed = reports.stream().allMatch(ConformanceReport::passed);
    LOG.info("Conformance run finished: {}", allPassed ? "all checks passed" : "violations found");
    if (!allPassed && parsedArgs.getBoolean("failOnViolation")) {
      System.exit(1);
    }
  }
}
