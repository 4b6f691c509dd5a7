/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.SupplierCall;
import pipelens.storage.StepConsumer;
import pipelens.storage.StepTimeseriesEntry;

import static pipelens.storage.redis.RedisStorage.encode;

final class RedisStepConsumer implements StepConsumer {
  final RedisStorage storage;

  RedisStepConsumer(RedisStorage storage) {
    this.storage = storage;
  }

  @Override public Call<Void> initiateRun(PipelineMeta pipelineMeta) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    return SupplierCall.of("initiateRun", () -> {
      putRun(storage.commands(), RunMeta.running(pipelineMeta));
      return null;
    });
  }

  @Override public Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    if (status == null) throw new NullPointerException("status == null");
    return SupplierCall.of("finishRun", () -> {
      RedisCommands commands = storage.commands();
      RunMeta run = RunMeta.finished(pipelineMeta, status);
      putRun(commands, run);
      Map<String, String> steps = new LinkedHashMap<>();
      for (StepMeta step : pipelineMeta.steps()) {
        steps.put(step.key(), encode(JsonCodec.writeStepMeta(step)));
      }
      if (!steps.isEmpty()) commands.hset(RedisKeys.runSteps(run.runId()), steps);
      for (StepMeta step : pipelineMeta.steps()) {
        indexTimeseries(commands, run.pipeline(), run.runId(), step);
      }
      return null;
    });
  }

  @Override public Call<Void> initiateStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return SupplierCall.of("initiateStep", () -> {
      putStep(storage.commands(), runId, step);
      return null;
    });
  }

  @Override public Call<Void> finishStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return SupplierCall.of("finishStep", () -> {
      RedisCommands commands = storage.commands();
      putStep(commands, runId, step);
      indexTimeseries(commands, pipelineOf(commands, runId, step), runId, step);
      return null;
    });
  }

  static void putRun(RedisCommands commands, RunMeta run) throws IOException {
    String json = encode(JsonCodec.writeRunMeta(run));
    commands.set(RedisKeys.runMeta(run.runId()), json);
    commands.hset(RedisKeys.pipelineRuns(run.pipeline()), Map.of(run.runId(), json));
    commands.sadd(RedisKeys.PIPELINES, run.pipeline());
  }

  static void putStep(RedisCommands commands, String runId, StepMeta step) throws IOException {
    commands.hset(RedisKeys.runSteps(runId),
      Map.of(step.key(), encode(JsonCodec.writeStepMeta(step))));
  }

  /** Writes the step's duration at its start time. Unfinished steps are skipped. */
  void indexTimeseries(RedisCommands commands, String pipeline, String runId, StepMeta step)
    throws IOException {
    StepTimeseriesEntry entry = StepTimeseriesEntry.of(runId, step);
    if (entry == null) return;
    String series = RedisKeys.timeseries(pipeline, step.name());
    storage.lock.withLock(series, () -> {
      if (!commands.exists(series)) commands.tsCreate(series, RedisStorage.TIMESERIES_RETENTION);
      commands.tsAdd(series, entry.timestamp(), entry.value());
      Map<String, String> meta = new LinkedHashMap<>();
      meta.put("runId", runId);
      meta.put("stepKey", step.key());
      commands.hset(RedisKeys.sampleMeta(series, entry.timestamp()), meta);
      return null;
    });
    commands.sadd(RedisKeys.pipelineSteps(pipeline), step.name());
  }

  /** Steps written before their run fall back to the first segment of their key. */
  static String pipelineOf(RedisCommands commands, String runId, StepMeta step)
    throws IOException {
    String json = commands.get(RedisKeys.runMeta(runId));
    if (json != null) return RedisStorage.decode(json, JsonCodec::readRunMeta).pipeline();
    int dot = step.key().indexOf('.');
    return dot == -1 ? step.key() : step.key().substring(0, dot);
  }

  static void checkStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
  }
}
