/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.CheckResult;
import pipelens.RunMeta;
import pipelens.StepMeta;
import pipelens.StorageException;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;
import pipelens.internal.ClosedComponentException;
import pipelens.internal.KeyedLock;
import pipelens.internal.Nullable;
import pipelens.internal.SupplierCall;
import pipelens.storage.SettingsStore;
import pipelens.storage.StepConsumer;
import pipelens.storage.StepStore;
import pipelens.storage.StorageComponent;
import redis.clients.jedis.JedisPooled;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stores runs in redis, with step durations in RedisTimeSeries. See {@link RedisKeys} for the key
 * layout.
 *
 * <p>Samples are keyed by step start time, so two instances of a step in the same pipeline which
 * start in the same millisecond share one sample: the last write wins.
 */
public final class RedisStorage extends StorageComponent {
  static final Logger LOG = LoggerFactory.getLogger(RedisStorage.class);
  static final long TIMESERIES_RETENTION = TimeUnit.DAYS.toMillis(30);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends StorageComponent.Builder {
    String url = "redis://localhost:6379";
    RedisCommands commands;

    /** Defaults to "redis://localhost:6379" */
    public Builder url(String url) {
      if (url == null) throw new NullPointerException("url == null");
      this.url = url;
      return this;
    }

    /** Visible for testing */
    Builder commands(RedisCommands commands) {
      if (commands == null) throw new NullPointerException("commands == null");
      this.commands = commands;
      return this;
    }

    @Override public RedisStorage build() {
      return new RedisStorage(this);
    }

    Builder() {
    }
  }

  final String url;
  final KeyedLock lock = new KeyedLock();
  final RedisStepConsumer stepConsumer;
  final RedisStepStore stepStore;
  final RedisSettingsStore settingsStore;
  @Nullable volatile RedisCommands commands;
  volatile boolean closeCalled;

  RedisStorage(Builder builder) {
    url = builder.url;
    commands = builder.commands;
    stepConsumer = new RedisStepConsumer(this);
    stepStore = new RedisStepStore(this);
    settingsStore = new RedisSettingsStore(this);
  }

  /** Lazy to avoid eager I/O */
  RedisCommands commands() {
    if (closeCalled) throw new ClosedComponentException();
    RedisCommands result = commands;
    if (result == null) {
      synchronized (this) {
        result = commands;
        if (result == null) {
          commands = result = new JedisCommands(new JedisPooled(URI.create(url)));
        }
      }
    }
    return result;
  }

  @Override public void connect() throws IOException {
    String pong = commands().ping();
    LOG.info("Connected to redis at {}: {}", url, pong);
  }

  @Override public StepConsumer stepConsumer() {
    return stepConsumer;
  }

  @Override public StepStore stepStore() {
    return stepStore;
  }

  @Override public SettingsStore settingsStore() {
    return settingsStore;
  }

  @Override public CheckResult check() {
    try {
      commands().ping();
    } catch (IOException | RuntimeException e) {
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override protected Call<Integer> deleteRunsStartedBefore(String pipeline, long cutoff) {
    return SupplierCall.of("deleteRunsStartedBefore", () -> doDelete(pipeline, cutoff));
  }

  int doDelete(String pipeline, long cutoff) throws IOException {
    RedisCommands commands = commands();
    String runsKey = RedisKeys.pipelineRuns(pipeline);
    List<RunMeta> expired = new ArrayList<>();
    for (RunMeta run : readRuns(commands.hgetAll(runsKey).values())) {
      if (run.startTime() < cutoff) expired.add(run);
    }
    if (expired.isEmpty()) return 0;

    Set<String> touchedSeries = new HashSet<>();
    for (RunMeta run : expired) {
      for (String json : commands.hgetAll(RedisKeys.runSteps(run.runId())).values()) {
        StepMeta step = decode(json, JsonCodec::readStepMeta);
        if (!step.time().isFinished()) continue;
        String series = RedisKeys.timeseries(pipeline, step.name());
        touchedSeries.add(step.name());
        lock.withLock(series, () -> {
          deleteSample(commands, series, run.runId(), step);
          return null;
        });
      }
      commands.del(RedisKeys.runMeta(run.runId()), RedisKeys.runSteps(run.runId()));
      commands.hdel(runsKey, run.runId());
    }

    for (String stepName : touchedSeries) {
      String series = RedisKeys.timeseries(pipeline, stepName);
      lock.withLock(series, () -> {
        if (!commands.exists(series) || commands.tsRange(series, 0L, Long.MAX_VALUE).isEmpty()) {
          commands.del(series);
          commands.srem(RedisKeys.pipelineSteps(pipeline), stepName);
        }
        return null;
      });
    }
    if (commands.hgetAll(runsKey).isEmpty()) commands.srem(RedisKeys.PIPELINES, pipeline);
    return expired.size();
  }

  /** Deletes the step's sample unless a later write at the same timestamp took it over. */
  static void deleteSample(RedisCommands commands, String series, String runId, StepMeta step)
    throws IOException {
    long timestamp = step.time().startTs();
    String metaKey = RedisKeys.sampleMeta(series, timestamp);
    Map<String, String> meta = commands.hgetAll(metaKey);
    if (!runId.equals(meta.get("runId"))) return;
    commands.tsDel(series, timestamp, timestamp);
    commands.del(metaKey);
  }

  static List<RunMeta> readRuns(Iterable<String> values) throws StorageException {
    List<RunMeta> result = new ArrayList<>();
    for (String json : values) result.add(decode(json, JsonCodec::readRunMeta));
    return result;
  }

  interface Decoder<T> {
    T decode(byte[] json);
  }

  static <T> T decode(String json, Decoder<T> decoder) throws StorageException {
    try {
      return decoder.decode(json.getBytes(UTF_8));
    } catch (ValidationException e) {
      throw new StorageException("Corrupt document in redis: " + e.getMessage(), e);
    }
  }

  static String encode(byte[] json) {
    return new String(json, UTF_8);
  }

  /** Deletes every key written by this component. Visible for testing */
  public void clear() throws IOException {
    RedisCommands commands = commands();
    for (String pattern : RedisKeys.ALL_PATTERNS) {
      Set<String> keys = commands.scan(pattern);
      commands.del(keys.toArray(new String[0]));
    }
  }

  @Override public synchronized void close() throws IOException {
    if (closeCalled) return;
    closeCalled = true;
    RedisCommands commands = this.commands;
    if (commands != null) commands.close();
  }

  @Override public String toString() {
    return "RedisStorage{url=" + url + "}";
  }
}
