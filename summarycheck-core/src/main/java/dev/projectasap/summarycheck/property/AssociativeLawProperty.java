/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.property;

import dev.projectasap.summarycheck.datamodel.OutputRecord;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.reduction.TreeReducer;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * (a + b) + c = a + (b + c): reduces the whole dataset at every depth from 1 to {@code
 * ceil(log2(partitions))} and requires every render to match the depth-1 render.
 */
public class AssociativeLawProperty extends AbstractSummarizerProperty {
  private static final Logger LOG = LoggerFactory.getLogger(AssociativeLawProperty.class);

  public AssociativeLawProperty() {
    super("AssociativeLawProperty");
  }

  @Override
  protected <U> void verify(Dataset dataset, Summarizer<U> summarizer, CheckContext context) {
    context.buildInputs();
    int maxDepth = TreeReducer.maxDepth(dataset.partitionCount());

    context.compute();
    List<OutputRecord> renders = new ArrayList<>(maxDepth);
    for (int depth = 1; depth <= maxDepth; depth++) {
      renders.add(summarizer.render(context.reducer().reduce(dataset, summarizer, depth)));
      LOG.debug("Reduced '{}' at depth {}", dataset.label(), depth);
    }

    for (int depth = 1; depth <= maxDepth; depth++) {
      context.assertAlmostEquals(renders.get(0), renders.get(depth - 1), "depth=" + depth);
    }
  }
}
