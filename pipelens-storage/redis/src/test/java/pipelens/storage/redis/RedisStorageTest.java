/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StorageException;
import pipelens.internal.ClosedComponentException;
import pipelens.storage.StepTimeseriesEntry;
import pipelens.storage.TimeRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pipelens.TestObjects.DAY;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;

class RedisStorageTest {
  FakeRedisCommands commands = new FakeRedisCommands();
  RedisStorage storage = RedisStorage.newBuilder().commands(commands).build();

  @Test void timeseriesCreatedWithRetention() throws IOException {
    storage.stepConsumer().finishRun(run("etl", "r1", NOW, 10, 20), RunStatus.COMPLETED)
      .execute();

    assertThat(commands.retention)
      .containsEntry("ts:etl.load", RedisStorage.TIMESERIES_RETENTION)
      .containsEntry("ts:etl.extract", RedisStorage.TIMESERIES_RETENTION);
    assertThat(RedisStorage.TIMESERIES_RETENTION).isEqualTo(30 * DAY);
  }

  @Test void sampleMetadataNamesRunAndStep() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    storage.stepConsumer().finishRun(run, RunStatus.COMPLETED).execute();

    long loadStart = run.steps().get(2).time().startTs();
    assertThat(commands.hgetAll("ts:etl.load:meta:" + loadStart))
      .containsEntry("runId", "r1")
      .containsEntry("stepKey", "etl.load");
  }

  @Test void sameMillisecondInstancesShareOneSample() throws IOException {
    storage.stepConsumer().finishRun(run("etl", "r1", NOW, 10, 20), RunStatus.COMPLETED)
      .execute();
    storage.stepConsumer().finishRun(run("etl", "r2", NOW, 10, 30), RunStatus.COMPLETED)
      .execute();

    List<StepTimeseriesEntry> series = storage.stepStore()
      .getPipelineStepTimeseries("etl", "load", TimeRange.create(NOW - DAY, NOW + DAY)).execute();
    assertThat(series).singleElement().satisfies(entry -> {
      assertThat(entry.runId()).isEqualTo("r2");
      assertThat(entry.value()).isEqualTo(30L);
    });
  }

  @Test void purgeKeepsStepNamesOfRemainingRuns() throws IOException {
    storage.stepConsumer().finishRun(run("etl", "old", NOW - 20 * DAY, 10, 20),
      RunStatus.COMPLETED).execute();
    storage.stepConsumer().finishRun(run("etl", "new", NOW - DAY, 10, 20),
      RunStatus.COMPLETED).execute();

    assertThat(storage.purgeOldData("etl", 7).execute()).isEqualTo(1);
    assertThat(commands.exists("run:old:meta")).isFalse();
    assertThat(commands.exists("run:old:steps")).isFalse();
    assertThat(storage.stepStore().listPipelineSteps("etl").execute())
      .containsExactly("etl", "extract", "load");
  }

  @Test void purgeAllRunsRemovesPipelineAndStepNames() throws IOException {
    storage.stepConsumer().finishRun(run("etl", "old", NOW - 20 * DAY, 10, 20),
      RunStatus.COMPLETED).execute();

    assertThat(storage.purgeOldData("etl", 7).execute()).isEqualTo(1);
    assertThat(storage.stepStore().listPipelines().execute()).isEmpty();
    assertThat(storage.stepStore().listPipelineSteps("etl").execute()).isEmpty();
    assertThat(commands.exists("ts:etl.load")).isFalse();
  }

  @Test void failuresAreStorageExceptions() {
    commands.down = true;

    assertThat(storage.check().ok()).isFalse();
    assertThatThrownBy(() -> storage.stepStore().listPipelines().execute())
      .isInstanceOf(StorageException.class);
  }

  @Test void closed() throws IOException {
    storage.close();

    assertThatThrownBy(() -> storage.stepStore().listPipelines().execute())
      .isInstanceOf(ClosedComponentException.class);
  }

  @Test void defaultUrl() {
    assertThat(RedisStorage.newBuilder().build().url).isEqualTo("redis://localhost:6379");
  }
}
