/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.exporter;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.TimeMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.ClosedComponentException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpExporterTest {
  static final StepMeta ROOT = StepMeta.newBuilder().name("etl").key("etl")
    .time(TimeMeta.finished(1000L, 1010L)).build();
  static final StepMeta LOAD = StepMeta.newBuilder().name("load").key("etl.load")
    .time(TimeMeta.finished(1001L, 1009L)).build();
  static final PipelineMeta RUN = PipelineMeta.create("run-1", ROOT, List.of(ROOT, LOAD));

  MockWebServer server = new MockWebServer();
  HttpExporter exporter;

  @AfterEach void close() throws IOException {
    if (exporter != null) exporter.close();
    server.shutdown();
  }

  HttpExporter.Builder builder() {
    return HttpExporter.newBuilder().baseUrl(server.url("/").toString());
  }

  static JsonNode body(RecordedRequest request) {
    return JsonCodec.readTree(request.getBody().readByteArray());
  }

  @Test void initiateRun_postsPipelineMeta() throws Exception {
    exporter = builder().build();
    server.enqueue(new MockResponse().setResponseCode(201));

    exporter.initiateRun(RUN).execute();

    RecordedRequest request = server.takeRequest();
    assertThat(request.getMethod()).isEqualTo("POST");
    assertThat(request.getPath()).isEqualTo("/api/ingestion/pipeline/start");
    assertThat(request.getHeader("Content-Type")).startsWith("application/json");
    assertThat(JsonCodec.decodePipelineMeta(body(request))).isEqualTo(RUN);
  }

  @Test void finishRun_postsPipelineMetaAndStatus() throws Exception {
    exporter = builder().build();
    server.enqueue(new MockResponse());

    exporter.finishRun(RUN, RunStatus.COMPLETED).execute();

    RecordedRequest request = server.takeRequest();
    assertThat(request.getPath()).isEqualTo("/api/ingestion/pipeline/finish");
    JsonNode body = body(request);
    assertThat(body.get("status").asText()).isEqualTo("completed");
    assertThat(JsonCodec.decodePipelineMeta(body.get("pipelineMeta"))).isEqualTo(RUN);
  }

  @Test void stepEvents_postRunIdAndStep() throws Exception {
    exporter = builder().build();
    server.enqueue(new MockResponse().setResponseCode(201));
    server.enqueue(new MockResponse());

    exporter.initiateStep("run-1", LOAD).execute();
    exporter.finishStep("run-1", LOAD).execute();

    RecordedRequest start = server.takeRequest();
    assertThat(start.getPath()).isEqualTo("/api/ingestion/step/start");
    assertThat(body(start).get("runId").asText()).isEqualTo("run-1");

    RecordedRequest finish = server.takeRequest();
    assertThat(finish.getPath()).isEqualTo("/api/ingestion/step/finish");
    assertThat(JsonCodec.decodeStepMeta(body(finish).get("step"))).isEqualTo(LOAD);
  }

  @Test void baseUrl_keepsPathPrefix() throws Exception {
    exporter = HttpExporter.newBuilder().baseUrl(server.url("/dashboard/").toString()).build();
    server.enqueue(new MockResponse());

    exporter.finishStep("run-1", LOAD).execute();

    assertThat(server.takeRequest().getPath()).isEqualTo("/dashboard/api/ingestion/step/finish");
  }

  @Test void immediate_doesNothingUntilExecuted() {
    exporter = builder().build();

    exporter.initiateRun(RUN);

    assertThat(server.getRequestCount()).isZero();
  }

  @Test void immediate_errorStatusIsTransportException() {
    exporter = builder().build();
    server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"Invalid\"}"));

    assertThatThrownBy(() -> exporter.finishStep("run-1", LOAD).execute())
      .isInstanceOf(TransportException.class)
      .hasMessageContaining("400")
      .hasMessageContaining("Invalid")
      .satisfies(e -> assertThat(((TransportException) e).code()).isEqualTo(400));
  }

  @Test void immediate_connectionFailureIsTransportException() throws IOException {
    exporter = builder().build();
    server.shutdown();

    assertThatThrownBy(() -> exporter.finishStep("run-1", LOAD).execute())
      .isInstanceOf(TransportException.class)
      .satisfies(e -> assertThat(((TransportException) e).code()).isEqualTo(-1));
  }

  @Test void batched_queuesUntilFlush() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1)).build();
    server.enqueue(new MockResponse());

    exporter.initiateRun(RUN).execute();
    exporter.initiateStep("run-1", LOAD).execute();
    exporter.finishStep("run-1", LOAD).execute();
    exporter.finishRun(RUN, RunStatus.FAILED).execute();

    assertThat(exporter.queuedEvents()).isEqualTo(4);
    assertThat(server.getRequestCount()).isZero();

    exporter.flush();

    assertThat(exporter.queuedEvents()).isZero();
    RecordedRequest request = server.takeRequest();
    assertThat(request.getPath()).isEqualTo("/api/ingestion/batch");
    JsonNode events = body(request).get("events");
    assertThat(events).extracting(e -> e.get("type").asText())
      .containsExactly("initiate-run", "initiate-step", "finish-step", "finish-run");
    assertThat(events.get(1).get("runId").asText()).isEqualTo("run-1");
    assertThat(events.get(3).get("status").asText()).isEqualTo("failed");
    assertThat(events.get(3).get("pipelineMeta").get("runId").asText()).isEqualTo("run-1");
  }

  @Test void batched_flushWithNothingQueuedSendsNothing() {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1)).build();

    exporter.flush();

    assertThat(server.getRequestCount()).isZero();
  }

  @Test void batched_flushesOnInterval() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofMillis(50)).build();
    server.enqueue(new MockResponse());

    exporter.finishStep("run-1", LOAD).execute();

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(body(request).get("events")).hasSize(1);
  }

  @Test void batched_flushesWhenFull() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1)).maxBatchSize(2).build();
    server.enqueue(new MockResponse());

    exporter.initiateStep("run-1", LOAD).execute();
    exporter.finishStep("run-1", LOAD).execute();

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(body(request).get("events")).hasSize(2);
  }

  @Test void batched_retriesWithBackoff() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1))
      .initialBackoff(Duration.ofMillis(1)).build();
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse());

    exporter.finishStep("run-1", LOAD).execute();
    exporter.flush();

    assertThat(server.getRequestCount()).isEqualTo(3);
    byte[] first = server.takeRequest().getBody().readByteArray();
    server.takeRequest();
    assertThat(server.takeRequest().getBody().readByteArray()).isEqualTo(first);
  }

  @Test void batched_dropsBatchAfterRetries() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1))
      .maxRetries(1).initialBackoff(Duration.ofMillis(1)).build();
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(new MockResponse());

    exporter.finishStep("run-1", LOAD).execute();
    exporter.flush();

    assertThat(server.getRequestCount()).isEqualTo(2);
    assertThat(exporter.queuedEvents()).isZero();

    // the next flush only carries new events
    exporter.initiateStep("run-2", LOAD).execute();
    exporter.flush();

    server.takeRequest();
    server.takeRequest();
    JsonNode events = body(server.takeRequest()).get("events");
    assertThat(events).hasSize(1);
    assertThat(events.get(0).get("runId").asText()).isEqualTo("run-2");
  }

  @Test void shutdown_sendsQueuedEvents() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofHours(1)).build();
    server.enqueue(new MockResponse());

    exporter.finishStep("run-1", LOAD).execute();
    exporter.shutdown();

    assertThat(exporter.queuedEvents()).isZero();
    assertThat(server.getRequestCount()).isEqualTo(1);
    assertThat(body(server.takeRequest()).get("events")).hasSize(1);
  }

  @Test void shutdown_stopsTimer() throws Exception {
    exporter = builder().batched(true).flushInterval(Duration.ofMillis(20)).build();
    for (int i = 0; i < 3; i++) server.enqueue(new MockResponse());

    exporter.initiateStep("run-1", LOAD).execute();
    exporter.finishStep("run-1", LOAD).execute();
    exporter.shutdown();
    int sent = server.getRequestCount();

    assertThat(exporter.queuedEvents()).isZero();
    assertThat(exporter.scheduler.isTerminated()).isTrue();

    Thread.sleep(200); // ten intervals
    assertThat(server.getRequestCount()).isEqualTo(sent);
    int events = 0;
    for (int i = 0; i < sent; i++) events += body(server.takeRequest()).get("events").size();
    assertThat(events).isEqualTo(2);
  }

  @Test void backoffDoublesUpToCap() {
    assertThat(HttpExporter.backoffMillis(1000, 0)).isEqualTo(1000);
    assertThat(HttpExporter.backoffMillis(1000, 2)).isEqualTo(4000);
    assertThat(HttpExporter.backoffMillis(1000, 30))
      .isEqualTo(HttpExporter.MAX_BACKOFF_MILLIS);
    assertThat(HttpExporter.backoffMillis(1000, 64))
      .isEqualTo(HttpExporter.MAX_BACKOFF_MILLIS);
    assertThat(HttpExporter.backoffMillis(1000, Integer.MAX_VALUE))
      .isEqualTo(HttpExporter.MAX_BACKOFF_MILLIS);
    assertThat(HttpExporter.backoffMillis(0, 100)).isZero();
  }

  @Test void shutdown_rejectsLaterEvents() {
    exporter = builder().batched(true).build();
    exporter.shutdown();

    assertThatThrownBy(() -> exporter.finishStep("run-1", LOAD))
      .isInstanceOf(ClosedComponentException.class);
    assertThat(exporter.check().ok()).isFalse();
  }

  @Test void close_rejectsImmediateEvents() {
    exporter = builder().build();
    exporter.close();

    assertThatThrownBy(() -> exporter.initiateRun(RUN))
      .isInstanceOf(ClosedComponentException.class);
  }

  @Test void check_okWhenCollectorAnswers() {
    exporter = builder().build();
    server.enqueue(new MockResponse().setResponseCode(404));

    assertThat(exporter.check().ok()).isTrue();
  }

  @Test void check_failsWhenCollectorIsDown() throws IOException {
    exporter = builder().build();
    server.shutdown();

    assertThat(exporter.check().ok()).isFalse();
    assertThat(exporter.check().error()).isInstanceOf(IOException.class);
  }

  @Test void build_requiresBaseUrl() {
    assertThatThrownBy(() -> HttpExporter.newBuilder().build())
      .isInstanceOf(NullPointerException.class)
      .hasMessage("baseUrl == null");
  }

  @Test void baseUrl_mustBeHttp() {
    assertThatThrownBy(() -> HttpExporter.newBuilder().baseUrl("localhost:3000"))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
