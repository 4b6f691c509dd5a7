/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import pipelens.Call;
import pipelens.NotFoundException;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.SupplierCall;
import pipelens.storage.RunQuery;
import pipelens.storage.StepStore;
import pipelens.storage.StepTimeseriesEntry;
import pipelens.storage.TimeRange;

import static pipelens.storage.redis.RedisStorage.decode;

final class RedisStepStore implements StepStore {
  static final Comparator<StepMeta> BY_START =
    Comparator.comparingLong((StepMeta step) -> step.time().startTs())
      .thenComparing(StepMeta::key);

  final RedisStorage storage;

  RedisStepStore(RedisStorage storage) {
    this.storage = storage;
  }

  @Override public Call<List<String>> listPipelines() {
    return SupplierCall.of("listPipelines", () -> {
      RedisCommands commands = storage.commands();
      Map<String, Long> latestStart = new LinkedHashMap<>();
      for (String pipeline : commands.smembers(RedisKeys.PIPELINES)) {
        List<RunMeta> runs =
          RedisStorage.readRuns(commands.hgetAll(RedisKeys.pipelineRuns(pipeline)).values());
        if (runs.isEmpty()) continue;
        long latest = Long.MIN_VALUE;
        for (RunMeta run : runs) latest = Math.max(latest, run.startTime());
        latestStart.put(pipeline, latest);
      }
      List<String> result = new ArrayList<>(latestStart.keySet());
      result.sort(Comparator.comparing((String name) -> latestStart.get(name)).reversed()
        .thenComparing(Comparator.naturalOrder()));
      return result;
    });
  }

  @Override public Call<List<RunMeta>> listRuns(String pipeline, RunQuery request) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (request == null) throw new NullPointerException("request == null");
    return SupplierCall.of("listRuns", () -> request.apply(RedisStorage.readRuns(
      storage.commands().hgetAll(RedisKeys.pipelineRuns(pipeline)).values())));
  }

  @Override public Call<RunData> getRunData(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("getRunData", () -> {
      String json = storage.commands().get(RedisKeys.runMeta(runId));
      if (json == null) throw new NotFoundException("Run " + runId + " not found");
      return RunData.create(decode(json, JsonCodec::readRunMeta), doListRunSteps(runId));
    });
  }

  @Override public Call<List<StepMeta>> listRunSteps(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("listRunSteps", () -> doListRunSteps(runId));
  }

  List<StepMeta> doListRunSteps(String runId) throws IOException {
    List<StepMeta> result = new ArrayList<>();
    for (String json : storage.commands().hgetAll(RedisKeys.runSteps(runId)).values()) {
      result.add(decode(json, JsonCodec::readStepMeta));
    }
    result.sort(BY_START);
    return result;
  }

  @Override public Call<List<StepTimeseriesEntry>> getPipelineStepTimeseries(String pipeline,
    String stepName, TimeRange range) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (stepName == null) throw new NullPointerException("stepName == null");
    if (range == null) throw new NullPointerException("range == null");
    return SupplierCall.of("getPipelineStepTimeseries",
      () -> doGetTimeseries(pipeline, stepName, range));
  }

  List<StepTimeseriesEntry> doGetTimeseries(String pipeline, String stepName, TimeRange range)
    throws IOException {
    RedisCommands commands = storage.commands();
    String series = RedisKeys.timeseries(pipeline, stepName);
    List<StepTimeseriesEntry> result = new ArrayList<>();
    if (range.end() <= range.start() || !commands.exists(series)) return result;
    // TS.RANGE is inclusive of its end
    for (RedisCommands.Sample sample : commands.tsRange(series, range.start(), range.end() - 1)) {
      Map<String, String> meta = commands.hgetAll(RedisKeys.sampleMeta(series, sample.timestamp));
      String runId = meta.get("runId"), stepKey = meta.get("stepKey");
      if (runId == null || stepKey == null) continue; // sample written without metadata
      StepMeta step = null;
      String json = commands.hget(RedisKeys.runSteps(runId), stepKey);
      if (json != null) step = decode(json, JsonCodec::readStepMeta);
      result.add(StepTimeseriesEntry.create(sample.timestamp, runId, stepKey,
        (long) sample.value, step));
    }
    return result;
  }

  @Override public Call<List<String>> listPipelineSteps(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("listPipelineSteps", () -> new ArrayList<>(
      new TreeSet<>(storage.commands().smembers(RedisKeys.pipelineSteps(pipeline)))));
  }
}
