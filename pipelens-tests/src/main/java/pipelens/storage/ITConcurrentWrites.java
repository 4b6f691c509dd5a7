/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import pipelens.PipelineMeta;

import static org.assertj.core.api.Assertions.assertThat;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;

/**
 * Writes many runs of one pipeline at the same time, checking that no run summary or timeseries
 * entry is lost to a concurrent read-modify-write.
 */
public abstract class ITConcurrentWrites<T extends StorageComponent> extends ITStorage<T> {
  static final int RUN_COUNT = 20;

  @Test void concurrentRunsOfSamePipeline() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < RUN_COUNT; i++) {
        PipelineMeta run = run("etl", "r" + i, NOW - 1000 + i * 10, 1, 2);
        futures.add(executor.submit(() -> {
          accept(run);
          return null;
        }));
      }
      for (Future<?> future : futures) future.get();
    } finally {
      executor.shutdownNow();
    }

    assertThat(store().listRuns("etl", RunQuery.ALL).execute()).hasSize(RUN_COUNT);
    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - 2000, NOW + 2000)).execute()).hasSize(RUN_COUNT);
  }
}
