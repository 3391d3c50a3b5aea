/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.summarycheck.reduction;

import com.google.common.base.Preconditions;
import dev.projectasap.summarycheck.datamodel.Row;
import dev.projectasap.summarycheck.fixture.Dataset;
import dev.projectasap.summarycheck.fixture.Partition;
import dev.projectasap.summarycheck.summarizer.Summarizer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a partitioned dataset to one accumulator through a configurable number of merge levels,
 * emulating the plans a parallel engine may pick.
 *
 * <p>Each partition is first folded from {@code zero()} in row order. A reduction of depth {@code
 * d} then runs {@code d - 1} pairwise levels and finally folds the survivors left to right. A
 * pairwise level merges neighbours anchored at the end of the level, {@code ..., (n-4, n-3),
 * (n-2, n-1)}, so an odd level carries its leading accumulator up unmerged. The last partition
 * therefore sits exactly {@code d} merges below the root, which makes every depth a different
 * association order. Depth 1 is a flat fold and the maximum depth is a nearly balanced binary
 * tree. Merges always keep the earlier rows on the left.
 *
 * <p>When an executor is supplied, partition folds and the merges of one level run concurrently;
 * every level waits for the previous one to complete.
 */
public class TreeReducer {
  private static final Logger LOG = LoggerFactory.getLogger(TreeReducer.class);

  private final ExecutorService executor;

  /** Creates a reducer that runs on the calling thread. */
  public TreeReducer() {
    this(null);
  }

  /**
   * Creates a reducer.
   *
   * @param executor executor for folds and merges, or null to run on the calling thread
   */
  public TreeReducer(ExecutorService executor) {
    this.executor = executor;
  }

  /**
   * Deepest meaningful reduction for a partition count: {@code ceil(log2(partitionCount))}, and at
   * least 1.
   */
  public static int maxDepth(int partitionCount) {
    Preconditions.checkArgument(
        partitionCount > 0, "Partition count must be positive, got: %s", partitionCount);
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(partitionCount - 1));
  }

  /**
   * Reduces the dataset with the given depth.
   *
   * @param dataset the partitioned input
   * @param summarizer the summarizer under test
   * @param depth reduction depth in {@code [1, maxDepth(partitionCount)]}
   * @return the accumulator over every row of the dataset
   */
  public <U> U reduce(Dataset dataset, Summarizer<U> summarizer, int depth) {
    int maxDepth = maxDepth(dataset.partitionCount());
    Preconditions.checkArgument(
        depth >= 1 && depth <= maxDepth,
        "Depth must be in [1, %s] for %s partitions, got: %s",
        maxDepth,
        dataset.partitionCount(),
        depth);

    List<U> level = foldPartitions(dataset, summarizer);
    for (int l = 1; l < depth && level.size() > 1; l++) {
      level = mergeNeighbours(level, summarizer);
      LOG.debug("Depth {}: level {} left {} accumulators", depth, l, level.size());
    }

    U result = level.get(0);
    for (int i = 1; i < level.size(); i++) {
      result = summarizer.merge(result, level.get(i));
    }
    return result;
  }

  /** Folds every partition from zero, one accumulator per partition in partition order. */
  public <U> List<U> foldPartitions(Dataset dataset, Summarizer<U> summarizer) {
    List<Callable<U>> tasks = new ArrayList<>(dataset.partitionCount());
    for (Partition partition : dataset.partitions()) {
      tasks.add(() -> fold(summarizer, partition.rows()));
    }
    return run(tasks);
  }

  private <U> List<U> mergeNeighbours(List<U> level, Summarizer<U> summarizer) {
    List<Callable<U>> tasks = new ArrayList<>((level.size() + 1) / 2);
    int start = level.size() % 2;
    if (start == 1) {
      U carried = level.get(0);
      tasks.add(() -> carried);
    }
    for (int i = start; i < level.size(); i += 2) {
      U left = level.get(i);
      U right = level.get(i + 1);
      tasks.add(() -> summarizer.merge(left, right));
    }
    return run(tasks);
  }

  /** Folds rows into a fresh accumulator in iteration order. */
  public static <U> U fold(Summarizer<U> summarizer, Iterable<Row> rows) {
    U state = summarizer.zero();
    for (Row row : rows) {
      state = summarizer.add(state, row);
    }
    return state;
  }

  private <U> List<U> run(List<Callable<U>> tasks) {
    List<U> results = new ArrayList<>(tasks.size());
    if (executor == null) {
      for (Callable<U> task : tasks) {
        try {
          results.add(task.call());
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new RuntimeException("Reduction task failed", e);
        }
      }
      return results;
    }

    List<Future<U>> futures = new ArrayList<>(tasks.size());
    for (Callable<U> task : tasks) {
      futures.add(executor.submit(task));
    }
    try {
      for (Future<U> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new RuntimeException("Interrupted while waiting for reduction tasks", e);
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new RuntimeException("Reduction task failed", cause);
    }
    return results;
  }
}
