/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import pipelens.PipelineMeta;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.TimeMeta;

import static org.assertj.core.api.Assertions.assertThat;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;
import static pipelens.TestObjects.runningStep;
import static pipelens.TestObjects.startedRun;

/**
 * Base test for {@link StepConsumer}.
 *
 * <p>Subtypes should create a connection to a real backend, even if that backend is in-process.
 */
public abstract class ITStepConsumer<T extends StorageComponent> extends ITStorage<T> {

  @Test void initiateRun_recordsRunningRun() throws IOException {
    consumer().initiateRun(startedRun("etl", "r1", NOW)).execute();

    List<RunMeta> runs = store().listRuns("etl", RunQuery.ALL).execute();
    assertThat(runs).singleElement().satisfies(run -> {
      assertThat(run.runId()).isEqualTo("r1");
      assertThat(run.pipeline()).isEqualTo("etl");
      assertThat(run.startTime()).isEqualTo(NOW);
      assertThat(run.endTime()).isNull();
      assertThat(run.status()).isEqualTo(RunStatus.RUNNING);
    });
  }

  @Test void finishRun_replacesRunningRun() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    consumer().initiateRun(startedRun("etl", "r1", NOW)).execute();
    consumer().finishRun(run, RunStatus.COMPLETED).execute();

    assertThat(store().listRuns("etl", RunQuery.ALL).execute()).singleElement()
      .satisfies(meta -> {
        assertThat(meta.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(meta.endTime()).isEqualTo(run.time().endTs());
        assertThat(meta.duration()).isEqualTo(run.time().timeUsageMs());
      });
  }

  @Test void finishRun_withoutInitiate() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    consumer().finishRun(run, RunStatus.FAILED).execute();

    RunData data = store().getRunData("r1").execute();
    assertThat(data.meta().status()).isEqualTo(RunStatus.FAILED);
    assertThat(data.steps()).extracting(StepMeta::key)
      .containsExactlyInAnyOrder("etl", "etl.extract", "etl.load");
  }

  @Test void finishStep_upsertsByKey() throws IOException {
    consumer().initiateRun(startedRun("etl", "r1", NOW)).execute();
    StepMeta started = runningStep("etl", "extract", NOW + 1);
    consumer().initiateStep("r1", started).execute();
    StepMeta finished = started.toBuilder().time(TimeMeta.finished(NOW + 1, NOW + 11)).build();
    consumer().finishStep("r1", finished).execute();

    assertThat(store().listRunSteps("r1").execute())
      .filteredOn(step -> step.key().equals("etl.extract"))
      .containsExactly(finished);
  }

  @Test void finishRun_twice_doesNotDuplicateSteps() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    accept(run);
    consumer().finishRun(run, RunStatus.COMPLETED).execute();

    assertThat(store().listRunSteps("r1").execute()).hasSize(3);
    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - 1, NOW + 1000)).execute()).hasSize(1);
  }

  @Test void stepsArePersistedIntact() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    accept(run);

    assertThat(store().listRunSteps("r1").execute())
      .containsExactlyInAnyOrderElementsOf(run.steps());
  }
}
