/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.exporter;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.CheckResult;
import pipelens.Component;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.ClosedComponentException;
import pipelens.internal.Nullable;
import pipelens.storage.StepConsumer;

/**
 * Forwards the lifecycle of pipeline runs to a collector over HTTP, for applications that don't
 * write to storage themselves.
 *
 * <p>By default each call performs one request when executed, failing with a {@link
 * TransportException}. In batched mode calls only queue an {@link ExportEvent}: the queue is posted
 * to {@code api/ingestion/batch} every {@linkplain Builder#flushInterval(Duration) flush interval},
 * or as soon as it reaches {@linkplain Builder#maxBatchSize(int) the maximum batch size}. A batch
 * that still fails after the configured retries is dropped and logged.
 *
 * <p>Ex.
 * <pre>{@code
 * exporter = HttpExporter.newBuilder().baseUrl("http://collector:3000").batched(true).build();
 * pipeline = Pipeline.newBuilder("nightly-etl").autoSave(REAL_TIME).consumer(exporter).build();
 * ...
 * exporter.close(); // sends what is still queued
 * }</pre>
 */
public final class HttpExporter extends Component implements StepConsumer {
  static final Logger LOG = LoggerFactory.getLogger(HttpExporter.class);
  static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  static final long SHUTDOWN_TIMEOUT_SECONDS = 60;
  static final long MAX_BACKOFF_MILLIS = TimeUnit.MINUTES.toMillis(5);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    HttpUrl baseUrl;
    boolean batched;
    Duration flushInterval = Duration.ofSeconds(3), initialBackoff = Duration.ofSeconds(1);
    int maxBatchSize = 100, maxRetries = 3;
    OkHttpClient client;

    Builder() {
    }

    /** Base URL of the collector, such as "http://localhost:3000". Required. */
    public Builder baseUrl(String baseUrl) {
      if (baseUrl == null) throw new NullPointerException("baseUrl == null");
      HttpUrl parsed = HttpUrl.parse(baseUrl);
      if (parsed == null) throw new IllegalArgumentException("invalid baseUrl: " + baseUrl);
      this.baseUrl = parsed;
      return this;
    }

    /** When true, events are queued and posted in batches. Defaults to false. */
    public Builder batched(boolean batched) {
      this.batched = batched;
      return this;
    }

    /** How often the batch queue is posted. Defaults to 3 seconds. */
    public Builder flushInterval(Duration flushInterval) {
      if (flushInterval == null) throw new NullPointerException("flushInterval == null");
      if (flushInterval.isNegative() || flushInterval.isZero()) {
        throw new IllegalArgumentException("flushInterval <= 0");
      }
      this.flushInterval = flushInterval;
      return this;
    }

    /** Queue size which triggers a flush before the interval elapses. Defaults to 100. */
    public Builder maxBatchSize(int maxBatchSize) {
      if (maxBatchSize < 1) throw new IllegalArgumentException("maxBatchSize < 1");
      this.maxBatchSize = maxBatchSize;
      return this;
    }

    /** Attempts after the first before a batch is dropped. Defaults to 3. */
    public Builder maxRetries(int maxRetries) {
      if (maxRetries < 0) throw new IllegalArgumentException("maxRetries < 0");
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Delay before the first retry, doubling for each one after up to 5 minutes. Defaults to 1
     * second.
     */
    public Builder initialBackoff(Duration initialBackoff) {
      if (initialBackoff == null) throw new NullPointerException("initialBackoff == null");
      if (initialBackoff.isNegative()) throw new IllegalArgumentException("initialBackoff < 0");
      this.initialBackoff = initialBackoff;
      return this;
    }

    /** Defaults to a client owned, and closed, by the exporter. */
    public Builder client(OkHttpClient client) {
      if (client == null) throw new NullPointerException("client == null");
      this.client = client;
      return this;
    }

    public HttpExporter build() {
      if (baseUrl == null) throw new NullPointerException("baseUrl == null");
      return new HttpExporter(this);
    }
  }

  final OkHttpClient client;
  final boolean ownsClient;
  final HttpUrl baseUrl, ingestionUrl;
  final boolean batched;
  final int maxBatchSize, maxRetries;
  final long initialBackoffMillis;
  @Nullable final ScheduledExecutorService scheduler;

  final Object queueLock = new Object();
  final ReentrantLock sendLock = new ReentrantLock();
  List<ExportEvent> queue = new ArrayList<>(); // guarded by queueLock
  boolean closed; // guarded by queueLock

  HttpExporter(Builder builder) {
    ownsClient = builder.client == null;
    client = ownsClient ? new OkHttpClient() : builder.client;
    baseUrl = builder.baseUrl;
    ingestionUrl = baseUrl.newBuilder().addPathSegments("api/ingestion").build();
    batched = builder.batched;
    maxBatchSize = builder.maxBatchSize;
    maxRetries = builder.maxRetries;
    initialBackoffMillis = builder.initialBackoff.toMillis();
    if (batched) {
      scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "pipelens-exporter");
        thread.setDaemon(true);
        return thread;
      });
      long interval = builder.flushInterval.toMillis();
      scheduler.scheduleWithFixedDelay(this::scheduledFlush, interval, interval,
        TimeUnit.MILLISECONDS);
    } else {
      scheduler = null;
    }
  }

  @Override public Call<Void> initiateRun(PipelineMeta pipelineMeta) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    return export(ExportEvent.initiateRun(pipelineMeta));
  }

  @Override public Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    if (status == null) throw new NullPointerException("status == null");
    return export(ExportEvent.finishRun(pipelineMeta, status));
  }

  @Override public Call<Void> initiateStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
    return export(ExportEvent.initiateStep(runId, step));
  }

  @Override public Call<Void> finishStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
    return export(ExportEvent.finishStep(runId, step));
  }

  Call<Void> export(ExportEvent event) {
    if (!batched) {
      synchronized (queueLock) {
        if (closed) throw new ClosedComponentException();
      }
      byte[] body = JsonCodec.write(ExportEvent::writeBody, event);
      return new HttpCall(client.newCall(post(event.type().path(), body)));
    }

    boolean full;
    synchronized (queueLock) {
      if (closed) throw new ClosedComponentException();
      queue.add(event);
      full = queue.size() >= maxBatchSize;
    }
    if (full) {
      try {
        scheduler.execute(this::scheduledFlush);
      } catch (RejectedExecutionException e) {
        LOG.debug("Exporter is shutting down; its final flush sends the full batch");
      }
    }
    return Call.create(null);
  }

  /** Count of events waiting for the next batch. Always zero when not batched. */
  public int queuedEvents() {
    synchronized (queueLock) {
      return queue.size();
    }
  }

  /**
   * Posts the queued events now, blocking until the batch is sent or dropped. Concurrent flushes
   * are sent one after another, in the order their events were queued.
   */
  public void flush() {
    sendLock.lock();
    try {
      List<ExportEvent> batch;
      synchronized (queueLock) {
        if (queue.isEmpty()) return;
        batch = queue;
        queue = new ArrayList<>();
      }
      send(batch);
    } finally {
      sendLock.unlock();
    }
  }

  void scheduledFlush() {
    try {
      flush();
    } catch (RuntimeException e) {
      // an exception would cancel the periodic task
      LOG.warn("Unexpected error flushing events", e);
    }
  }

  /** Returns false when the batch was dropped. */
  boolean send(List<ExportEvent> batch) {
    byte[] body = JsonCodec.write((generator, events) -> {
      generator.writeStartObject();
      generator.writeArrayFieldStart("events");
      for (ExportEvent event : events) ExportEvent.write(generator, event);
      generator.writeEndArray();
      generator.writeEndObject();
    }, batch);

    for (int attempt = 0; ; attempt++) {
      try {
        new HttpCall(client.newCall(post("batch", body))).execute();
        LOG.debug("Sent batch of {} events", batch.size());
        return true;
      } catch (IOException e) {
        if (attempt >= maxRetries) {
          LOG.warn("Dropping batch of {} events after {} attempts: {}", batch.size(), attempt + 1,
            e.getMessage());
          return false;
        }
        long backoff = backoffMillis(initialBackoffMillis, attempt);
        LOG.debug("Batch of {} events failed, retrying in {}ms: {}", batch.size(), backoff,
          e.getMessage());
        try {
          Thread.sleep(backoff);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          LOG.warn("Dropping batch of {} events: interrupted while retrying", batch.size());
          return false;
        }
      }
    }
  }

  /** Doubles {@code initial} for each attempt, capped at {@link #MAX_BACKOFF_MILLIS}. */
  static long backoffMillis(long initial, int attempt) {
    if (initial == 0) return 0;
    if (initial >= MAX_BACKOFF_MILLIS) return MAX_BACKOFF_MILLIS;
    if (attempt >= Long.numberOfLeadingZeros(MAX_BACKOFF_MILLIS)) return MAX_BACKOFF_MILLIS;
    return Math.min(initial << attempt, MAX_BACKOFF_MILLIS);
  }

  Request post(String path, byte[] body) {
    HttpUrl url = ingestionUrl.newBuilder().addPathSegments(path).build();
    return new Request.Builder().url(url).post(RequestBody.create(body, JSON)).build();
  }

  /** Succeeds when the collector answers any HTTP request at the base URL. */
  @Override public CheckResult check() {
    synchronized (queueLock) {
      if (closed) return CheckResult.failed(new ClosedComponentException());
    }
    try (Response response = client.newCall(new Request.Builder().url(baseUrl).build()).execute()) {
      return CheckResult.OK;
    } catch (IOException | RuntimeException e) {
      return CheckResult.failed(e);
    }
  }

  /**
   * Stops the flush timer, waits for sends in flight and then posts what is still queued. Later
   * calls are rejected with {@link ClosedComponentException}.
   */
  public void shutdown() {
    synchronized (queueLock) {
      if (closed) return;
      closed = true;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
          LOG.warn("Timed out waiting for in-flight batches to finish");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      flush();
    }
    if (ownsClient) {
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
    }
  }

  @Override public void close() {
    shutdown();
  }

  @Override public String toString() {
    return "HttpExporter{baseUrl=" + baseUrl + ", batched=" + batched + "}";
  }
}
