/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.runner;

import com.google.common.collect.ImmutableList;
import dev.projectasap.summarycheck.equality.Tolerance;
import dev.projectasap.summarycheck.equality.ToleranceComparator;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.FixtureException;
import dev.projectasap.summarycheck.property.CheckContext;
import dev.projectasap.summarycheck.property.PropertyViolation;
import dev.projectasap.summarycheck.property.SummarizerProperty;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import dev.projectasap.summarycheck.summarizer.SummarizerFactory;
import dev.projectasap.summarycheck.summarizer.UnsupportedCapabilityException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a summarizer against every property on every fixture dataset.
 *
 * <p>Each (property, dataset) pair is isolated: a violation, a missing capability or an exception
 * thrown by the summarizer is recorded for that pair and the run continues. Fixture errors and
 * schema mismatches ({@link IllegalArgumentException}) are not recorded; they propagate and end
 * the run.
 *
 * <p>Fixtures are built once by the caller and shared read-only across runs.
 */
public class ConformanceRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ConformanceRunner.class);

  private final ImmutableList<Dataset> fixtures;
  private final ImmutableList<SummarizerProperty> properties;
  private final ToleranceComparator comparator;
  private final TreeReducer reducer;

  public ConformanceRunner(
      List<Dataset> fixtures, List<SummarizerProperty> properties, Tolerance tolerance) {
    this(fixtures, properties, tolerance, new TreeReducer());
  }

  /**
   * Constructs a ConformanceRunner.
   *
   * @param fixtures datasets every property is checked on, in report order
   * @param properties properties to check, in report order
   * @param tolerance tolerance for floating-point fields
   * @param reducer reduction driver used by the associativity check
   */
  public ConformanceRunner(
      List<Dataset> fixtures,
      List<SummarizerProperty> properties,
      Tolerance tolerance,
      TreeReducer reducer) {
    if (fixtures.isEmpty()) {
      throw new IllegalArgumentException("At least one fixture dataset is required");
    }
    this.fixtures = ImmutableList.copyOf(fixtures);
    this.properties = ImmutableList.copyOf(properties);
    this.comparator = new ToleranceComparator(tolerance);
    this.reducer = reducer;
  }

  /**
   * Runs every property on every dataset.
   *
   * @param factory creates the summarizer under test
   * @return one result per (property, dataset) pair, properties outermost
   */
  public ConformanceReport run(SummarizerFactory factory) {
    LOG.info(
        "Checking {} against {} properties on {} datasets with {}",
        factory.name(),
        properties.size(),
        fixtures.size(),
        comparator.getTolerance());

    List<CheckResult> results = new ArrayList<>(properties.size() * fixtures.size());
    for (SummarizerProperty property : properties) {
      for (int i = 0; i < fixtures.size(); i++) {
        results.add(check(property, i, fixtures.get(i), factory));
      }
    }

    ConformanceReport report = new ConformanceReport(factory.name(), results);
    LOG.info("{}", report);
    return report;
  }

  /** Runs a single property on a single dataset. */
  public CheckResult check(
      SummarizerProperty property, int datasetIndex, Dataset dataset, SummarizerFactory factory) {
    LOG.info(
        "Satisfy property {} with {}-th dataset ({})",
        property.name(),
        datasetIndex,
        dataset.label());
    CheckContext context = new CheckContext(property.name(), dataset, comparator, reducer);
    try {
      property.test(dataset, factory, context);
      return CheckResult.passed(property.name(), datasetIndex, dataset.label(), context.phase());
    } catch (PropertyViolation violation) {
      LOG.warn("{}", violation.getMessage());
      return CheckResult.failed(datasetIndex, dataset.label(), context.phase(), violation);
    } catch (UnsupportedCapabilityException e) {
      LOG.warn(
          "Skipping {} on dataset {}: {}", property.name(), dataset.label(), e.getMessage());
      return CheckResult.setupError(
          property.name(), datasetIndex, dataset.label(), context.phase(), e.getMessage());
    } catch (FixtureException | IllegalArgumentException e) {
      throw e;
    } catch (RuntimeException e) {
      LOG.error(
          "{} threw while checking {} on dataset {}",
          factory.name(),
          property.name(),
          dataset.label(),
          e);
      return CheckResult.error(property.name(), datasetIndex, dataset.label(), context.phase(), e);
    }
  }
}
