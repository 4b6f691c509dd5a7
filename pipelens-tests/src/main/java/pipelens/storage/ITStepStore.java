/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import pipelens.NotFoundException;
import pipelens.PipelineMeta;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pipelens.TestObjects.DAY;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.failedRun;
import static pipelens.TestObjects.run;
import static pipelens.TestObjects.startedRun;

/**
 * Base test for {@link StepStore}.
 *
 * <p>Subtypes should create a connection to a real backend, even if that backend is in-process.
 */
public abstract class ITStepStore<T extends StorageComponent> extends ITStorage<T> {

  @Test void listPipelines_empty() throws IOException {
    assertThat(store().listPipelines().execute()).isEmpty();
  }

  @Test void listPipelines_latestRunFirst() throws IOException {
    accept(run("a", "r1", NOW - 3 * DAY, 1, 1));
    accept(run("b", "r2", NOW - DAY, 1, 1));
    accept(run("c", "r3", NOW - 2 * DAY, 1, 1));
    accept(run("a", "r4", NOW - 4 * DAY, 1, 1));

    assertThat(store().listPipelines().execute()).containsExactly("b", "c", "a");
  }

  @Test void listRuns_newestFirst() throws IOException {
    accept(run("etl", "r1", NOW - 2 * DAY, 1, 1));
    accept(run("etl", "r2", NOW, 1, 1));
    accept(run("etl", "r3", NOW - DAY, 1, 1));
    accept(run("other", "r4", NOW, 1, 1));

    assertThat(store().listRuns("etl", RunQuery.ALL).execute())
      .extracting(RunMeta::runId)
      .containsExactly("r2", "r3", "r1");
  }

  @Test void listRuns_unknownPipeline() throws IOException {
    assertThat(store().listRuns("missing", RunQuery.ALL).execute()).isEmpty();
  }

  @Test void listRuns_filtersByStatus() throws IOException {
    accept(run("etl", "r1", NOW - 2 * DAY, 1, 1));
    accept(failedRun("etl", "r2", NOW - DAY));
    consumer().initiateRun(startedRun("etl", "r3", NOW)).execute();

    assertThat(store().listRuns("etl", query().status(RunStatus.FAILED).build()).execute())
      .extracting(RunMeta::runId).containsExactly("r2");
    assertThat(store().listRuns("etl", query().status(RunStatus.RUNNING).build()).execute())
      .extracting(RunMeta::runId).containsExactly("r3");
    assertThat(store().listRuns("etl", query().status(RunStatus.COMPLETED).build()).execute())
      .extracting(RunMeta::runId).containsExactly("r1");
  }

  @Test void listRuns_filtersByDateRange() throws IOException {
    accept(run("etl", "r1", NOW - 3 * DAY, 1, 1));
    accept(run("etl", "r2", NOW - 2 * DAY, 1, 1));
    accept(run("etl", "r3", NOW - DAY, 1, 1));

    RunQuery query = query().startDate(NOW - 2 * DAY).endDate(NOW - DAY).build();
    assertThat(store().listRuns("etl", query).execute())
      .extracting(RunMeta::runId).containsExactly("r3", "r2");
  }

  @Test void listRuns_limitAndOffset() throws IOException {
    for (int i = 0; i < 5; i++) accept(run("etl", "r" + i, NOW - i * DAY, 1, 1));

    assertThat(store().listRuns("etl", query().limit(2).offset(1).build()).execute())
      .extracting(RunMeta::runId).containsExactly("r1", "r2");
    assertThat(store().listRuns("etl", query().offset(4).build()).execute())
      .extracting(RunMeta::runId).containsExactly("r4");
  }

  @Test void getRunData() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    accept(run);

    RunData data = store().getRunData("r1").execute();
    assertThat(data.meta()).isEqualTo(RunMeta.finished(run, RunStatus.COMPLETED));
    assertThat(data.steps()).containsExactlyInAnyOrderElementsOf(run.steps());
  }

  @Test void getRunData_notFound() {
    assertThatThrownBy(() -> store().getRunData("missing").execute())
      .isInstanceOf(NotFoundException.class)
      .hasMessageContaining("missing");
  }

  @Test void listRunSteps_unknownRun() throws IOException {
    assertThat(store().listRunSteps("missing").execute()).isEmpty();
  }

  @Test void listRunSteps_beforeRunFinishes() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    consumer().initiateRun(startedRun("etl", "r1", NOW)).execute();
    consumer().finishStep("r1", run.steps().get(1)).execute();

    assertThat(store().listRunSteps("r1").execute()).containsExactly(run.steps().get(1));
  }

  @Test void getPipelineStepTimeseries() throws IOException {
    PipelineMeta first = run("etl", "r1", NOW - 2 * DAY, 10, 20);
    PipelineMeta second = run("etl", "r2", NOW - DAY, 30, 40);
    accept(first);
    accept(second);
    accept(run("other", "r3", NOW - DAY, 50, 60));

    List<StepTimeseriesEntry> series = store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - 3 * DAY, NOW)).execute();

    assertThat(series).extracting(StepTimeseriesEntry::runId).containsExactly("r1", "r2");
    assertThat(series).extracting(StepTimeseriesEntry::value).containsExactly(20L, 40L);
    assertThat(series.get(0).timestamp()).isEqualTo(first.steps().get(2).time().startTs());
    assertThat(series.get(0).stepKey()).isEqualTo("etl.load");
    assertThat(series.get(1).stepMeta()).isEqualTo(second.steps().get(2));
  }

  @Test void getPipelineStepTimeseries_rangeIsHalfOpen() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    accept(run);
    long loadStart = run.steps().get(2).time().startTs();

    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(loadStart, loadStart + 1)).execute()).hasSize(1);
    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(loadStart - 1, loadStart)).execute()).isEmpty();
  }

  @Test void getPipelineStepTimeseries_flagsErrors() throws IOException {
    accept(failedRun("etl", "r1", NOW));

    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - DAY, NOW + DAY)).execute())
      .singleElement()
      .satisfies(entry -> assertThat(entry.isError()).isTrue());
  }

  @Test void getPipelineStepTimeseries_unknownStep() throws IOException {
    accept(run("etl", "r1", NOW, 10, 20));

    assertThat(store().getPipelineStepTimeseries("etl", "missing",
      TimeRange.create(NOW - DAY, NOW + DAY)).execute()).isEmpty();
  }

  @Test void listPipelineSteps() throws IOException {
    accept(run("etl", "r1", NOW, 10, 20));
    accept(run("other", "r2", NOW, 10, 20));

    assertThat(store().listPipelineSteps("etl").execute())
      .containsExactly("etl", "extract", "load");
  }

  @Test void listPipelineSteps_unknownPipeline() throws IOException {
    assertThat(store().listPipelineSteps("missing").execute()).isEmpty();
  }

  @Test void stepsKeepRecordsAndResults() throws IOException {
    PipelineMeta run = run("etl", "r1", NOW, 10, 20);
    accept(run);

    StepMeta load = store().listRunSteps("r1").execute().stream()
      .filter(step -> step.key().equals("etl.load"))
      .findFirst().orElseThrow();
    assertThat(load.records().get("rows").asInt()).isEqualTo(20);
    assertThat(load.result().asText()).isEqualTo("load-done");
  }

  static RunQuery.Builder query() {
    return RunQuery.newBuilder();
  }
}
