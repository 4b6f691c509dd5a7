/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunData;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.StorageException;
import pipelens.codec.JsonCodec;
import pipelens.storage.InMemoryStorage;
import pipelens.storage.StepConsumer;
import pipelens.storage.StorageComponent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;
import static pipelens.TestObjects.runningStep;
import static pipelens.TestObjects.startedRun;

class CollectorTest {
  InMemoryStorage storage = InMemoryStorage.newBuilder().build();
  Collector collector = Collector.newBuilder().storage(storage).build();
  PipelineMeta run = run("etl", "run-1", NOW, 10, 20);

  static byte[] utf8(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  static String json(PipelineMeta pipelineMeta) {
    return new String(JsonCodec.writePipelineMeta(pipelineMeta), StandardCharsets.UTF_8);
  }

  static String json(StepMeta step) {
    return new String(JsonCodec.writeStepMeta(step), StandardCharsets.UTF_8);
  }

  @Test void pipelineStart_storesRunningRun() throws IOException {
    IngestResult result =
      collector.accept("pipeline/start", utf8(json(startedRun("etl", "run-1", NOW))));

    assertThat(result).isEqualTo(IngestResult.CREATED);
    assertThat(storage.stepStore().getRunData("run-1").execute().meta().status())
      .isEqualTo(RunStatus.RUNNING);
  }

  @Test void fullLifecycle() throws IOException {
    collector.accept("pipeline/start", utf8(json(startedRun("etl", "run-1", NOW))));
    StepMeta extract = run.steps().get(1);
    collector.accept("step/start",
      utf8("{\"runId\":\"run-1\",\"step\":" + json(runningStep("etl", "extract", NOW + 1)) + "}"));
    collector.accept("step/finish", utf8("{\"runId\":\"run-1\",\"step\":" + json(extract) + "}"));
    IngestResult result = collector.accept("pipeline/finish",
      utf8("{\"pipelineMeta\":" + json(run) + ",\"status\":\"completed\"}"));

    assertThat(result).isEqualTo(IngestResult.OK);
    RunData data = storage.stepStore().getRunData("run-1").execute();
    assertThat(data.meta().status()).isEqualTo(RunStatus.COMPLETED);
    assertThat(data.steps()).containsExactlyInAnyOrderElementsOf(run.steps());
  }

  @Test void pipelineStart_requiresRunIdAndName() {
    IngestResult result = collector.accept("pipeline/start", utf8("{\"name\":\"etl\"}"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).isEqualTo("Invalid pipeline data. Required fields: runId, name");
    assertThat(storage.runCount()).isZero();
  }

  @Test void pipelineFinish_requiresStatus() {
    IngestResult result =
      collector.accept("pipeline/finish", utf8("{\"pipelineMeta\":" + json(run) + "}"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error())
      .isEqualTo("Invalid request. Required fields: pipelineMeta (with runId), status");
  }

  @Test void pipelineFinish_rejectsUnknownStatus() {
    IngestResult result = collector.accept("pipeline/finish",
      utf8("{\"pipelineMeta\":" + json(run) + ",\"status\":\"paused\"}"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).contains("paused");
  }

  @Test void step_requiresKey() {
    IngestResult result = collector.accept("step/finish",
      utf8("{\"runId\":\"run-1\",\"step\":{\"name\":\"load\"}}"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).isEqualTo("Invalid request. Required fields: runId, step (with key)");
  }

  @Test void malformedJson() {
    IngestResult result = collector.accept("step/finish", utf8("{\"runId\":"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).startsWith("Malformed JSON");
  }

  @Test void step_endBeforeStartIsInvalid() {
    String step = "{\"name\":\"a\",\"key\":\"a\",\"time\":{\"startTs\":10,\"endTs\":5}}";

    IngestResult single = collector.accept("step/start",
      utf8("{\"runId\":\"r\",\"step\":" + step + "}"));
    IngestResult batched = collector.accept("batch",
      utf8("{\"events\":[{\"type\":\"finish-step\",\"runId\":\"r\",\"step\":" + step + "}]}"));

    assertThat(single.code()).isEqualTo(400);
    assertThat(single.error()).contains("endTs < startTs");
    assertThat(batched.code()).isEqualTo(400);
    assertThat(batched.error()).startsWith("Invalid event 0: ").contains("endTs < startTs");
    assertThat(storage.runCount()).isZero();
  }

  @Test void unknownPath() {
    assertThat(collector.accept("spans", utf8("[]")).code()).isEqualTo(404);
  }

  @Test void batch_appliesEventsInOrder() throws IOException {
    String events = "{\"events\":["
      + "{\"type\":\"initiate-run\",\"pipelineMeta\":" + json(startedRun("etl", "run-1", NOW)) + "},"
      + "{\"type\":\"finish-step\",\"runId\":\"run-1\",\"step\":" + json(run.steps().get(2)) + "},"
      + "{\"type\":\"finish-run\",\"pipelineMeta\":" + json(run) + ",\"status\":\"failed\"}"
      + "]}";

    assertThat(collector.accept("batch", utf8(events))).isEqualTo(IngestResult.OK);

    assertThat(storage.stepStore().getRunData("run-1").execute().meta().status())
      .isEqualTo(RunStatus.FAILED);
  }

  @Test void batch_invalidEventStoresNothing() {
    String events = "{\"events\":["
      + "{\"type\":\"initiate-run\",\"pipelineMeta\":" + json(startedRun("etl", "run-1", NOW)) + "},"
      + "{\"type\":\"finish-step\",\"runId\":\"run-1\"}"
      + "]}";

    IngestResult result = collector.accept("batch", utf8(events));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).startsWith("Invalid event 1: ");
    assertThat(storage.runCount()).isZero();
  }

  @Test void batch_unknownEventType() {
    IngestResult result = collector.accept("batch", utf8("{\"events\":[{\"type\":\"log\"}]}"));

    assertThat(result.error()).isEqualTo("Invalid event 0: Unknown event type: log");
  }

  @Test void batch_requiresEvents() {
    IngestResult result = collector.accept("batch", utf8("{}"));

    assertThat(result.code()).isEqualTo(400);
    assertThat(result.error()).isEqualTo("Invalid batch request. Required fields: events (array)");
  }

  @Test void batch_acceptsOperationsForm() throws IOException {
    String body = "{\"pipeline\":{\"operation\":\"finish\",\"status\":\"completed\",\"meta\":"
      + json(run) + "},\"steps\":[{\"operation\":\"finish\",\"step\":" + json(run.steps().get(1))
      + "},{\"operation\":\"ignored\"}]}";

    assertThat(collector.accept("batch", utf8(body))).isEqualTo(IngestResult.OK);

    assertThat(storage.stepStore().listRunSteps("run-1").execute()).isEqualTo(run.steps());
  }

  @Test void storageFailureIs500() {
    StorageComponent failing = mock(StorageComponent.class);
    StepConsumer consumer = mock(StepConsumer.class);
    when(failing.stepConsumer()).thenReturn(consumer);
    when(consumer.finishStep(anyString(), any(StepMeta.class)))
      .thenReturn(new FailingCall());
    Collector collector = Collector.newBuilder().storage(failing).build();

    IngestResult result = collector.accept("step/finish",
      utf8("{\"runId\":\"run-1\",\"step\":" + json(run.steps().get(1)) + "}"));

    assertThat(result.code()).isEqualTo(500);
    assertThat(result.error()).isEqualTo("Failed to finish step");
  }

  @Test void build_requiresStorage() {
    assertThatThrownBy(() -> Collector.newBuilder().build())
      .isInstanceOf(NullPointerException.class)
      .hasMessage("storage == null");
  }

  static final class FailingCall extends Call.Base<Void> {
    @Override protected Void doExecute() throws IOException {
      throw new StorageException("disk full");
    }

    @Override public Call<Void> clone() {
      return new FailingCall();
    }
  }
}
