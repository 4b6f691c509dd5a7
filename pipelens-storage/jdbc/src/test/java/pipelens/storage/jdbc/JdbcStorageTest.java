/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import pipelens.Callback;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.StorageException;
import pipelens.TimeMeta;
import pipelens.storage.RunQuery;
import pipelens.storage.StepTimeseriesEntry;
import pipelens.storage.TimeRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static pipelens.TestObjects.DAY;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;
import static pipelens.TestObjects.runningStep;

class JdbcStorageTest {
  JdbcStorage storage = JdbcStorage.newBuilder()
    .datasource(SQLiteStorageIntegrationTest.newDataSource())
    .build();

  @Test void connect_isIdempotent() throws IOException {
    storage.connect();
    storage.connected = false;
    storage.connect();

    assertThat(storage.check().ok()).isTrue();
  }

  @Test void stepBeforeRun_usesKeyPrefixUntilRunArrives() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    storage.stepConsumer().finishStep("r1", run.steps().get(1)).execute();

    assertThat(storage.stepStore().listPipelineSteps("etl").execute()).containsExactly("extract");

    storage.stepConsumer().finishRun(run, RunStatus.COMPLETED).execute();
    assertThat(storage.stepStore().listRunSteps("r1").execute()).hasSize(3);
  }

  @Test void stepPipelineComesFromRun() throws IOException {
    PipelineMeta run = run("nightly.etl", "r1", NOW, 10, 20);
    storage.stepConsumer().initiateRun(run).execute();
    storage.stepConsumer().finishStep("r1", run.steps().get(2)).execute();

    assertThat(storage.stepStore().getPipelineStepTimeseries("nightly.etl", "load",
      TimeRange.create(NOW - DAY, NOW + DAY)).execute())
      .extracting(StepTimeseriesEntry::stepKey)
      .containsExactly("nightly_etl.load");
  }

  @Test void runningStepsAreNotInTimeseries() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    storage.stepConsumer().initiateRun(run).execute();
    StepMeta running = runningStep("etl", "load", NOW + 1);
    storage.stepConsumer().initiateStep("r1", running).execute();

    assertThat(storage.stepStore().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - DAY, NOW + DAY)).execute()).isEmpty();
    assertThat(storage.stepStore().listPipelineSteps("etl").execute()).isEmpty();

    StepMeta finished = running.toBuilder().time(TimeMeta.finished(NOW + 1, NOW + 5)).build();
    storage.stepConsumer().finishStep("r1", finished).execute();

    assertThat(storage.stepStore().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - DAY, NOW + DAY)).execute())
      .extracting(StepTimeseriesEntry::value)
      .containsExactly(4L);
  }

  @Test void listRuns_offsetWithoutLimit() throws IOException {
    for (int i = 0; i < 3; i++) {
      storage.stepConsumer().finishRun(run("etl", "r" + i, NOW - i * DAY, 1, 1),
        RunStatus.COMPLETED).execute();
    }

    assertThat(storage.stepStore().listRuns("etl", RunQuery.newBuilder().offset(2).build())
      .execute()).extracting(RunMeta::runId).containsExactly("r2");
  }

  @Test void sqlErrorsAreStorageExceptions() throws SQLException {
    DataSource broken = mock(DataSource.class);
    when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
    JdbcStorage storage = JdbcStorage.newBuilder().datasource(broken).build();

    assertThat(storage.check().ok()).isFalse();
    assertThatThrownBy(() -> storage.stepStore().listPipelines().execute())
      .isInstanceOf(StorageException.class)
      .hasMessageContaining("connection refused");
  }

  @Test void enqueueReportsErrors() throws SQLException {
    DataSource broken = mock(DataSource.class);
    when(broken.getConnection()).thenThrow(new SQLException("gone"));
    JdbcStorage storage = JdbcStorage.newBuilder().datasource(broken).build();
    storage.connected = true; // skip table creation

    List<Throwable> errors = new ArrayList<>();
    storage.stepStore().listPipelines().enqueue(new Callback<List<String>>() {
      @Override public void onSuccess(List<String> value) {
      }

      @Override public void onError(Throwable t) {
        errors.add(t);
      }
    });

    assertThat(errors).singleElement().isInstanceOf(StorageException.class);
  }

  @Test void builder_requiresDataSource() {
    assertThatThrownBy(() -> JdbcStorage.newBuilder().build())
      .isInstanceOf(NullPointerException.class)
      .hasMessage("datasource == null");
  }
}
