/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import pipelens.Call;
import pipelens.NotFoundException;
import pipelens.PipelineMeta;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.internal.SupplierCall;

/**
 * Storage component that keeps runs in memory, accepting writes on the calling thread. This is
 * used in tests and by applications that only inspect runs within the same process.
 *
 * <p>Here's an example of two runs in memory:
 *
 * <pre>{@code
 * runs:
 *    r1 --> RunMeta(pipeline: etl, startTime: July 4, status: completed)
 *    r2 --> RunMeta(pipeline: etl, startTime: July 5, status: running)
 *
 * stepsByRun:
 *    r1 --> ( etl, etl.extract, etl.load )
 *    r2 --> ( etl, etl.extract )
 * }</pre>
 *
 * <p>Timeseries are derived from finished steps at query time, so there is no separate index.
 */
public final class InMemoryStorage extends StorageComponent
  implements StepConsumer, StepStore, SettingsStore {

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends StorageComponent.Builder {
    int maxRunCount = 10000;

    /** Eldest runs are removed to ensure runs in memory don't exceed this value */
    public Builder maxRunCount(int maxRunCount) {
      if (maxRunCount <= 0) throw new IllegalArgumentException("maxRunCount <= 0");
      this.maxRunCount = maxRunCount;
      return this;
    }

    @Override public InMemoryStorage build() {
      return new InMemoryStorage(this);
    }
  }

  /** Primary source of run summaries, in insertion order. */
  final Map<String, RunMeta> runs = new LinkedHashMap<>();
  /** Steps by run ID, then by key. Upserts keep the position of the first write. */
  final Map<String, Map<String, StepMeta>> stepsByRun = new LinkedHashMap<>();
  final Map<String, PipelineSettings> settings = new LinkedHashMap<>();
  final int maxRunCount;

  InMemoryStorage(Builder builder) {
    maxRunCount = builder.maxRunCount;
  }

  @Override public StepConsumer stepConsumer() {
    return this;
  }

  @Override public StepStore stepStore() {
    return this;
  }

  @Override public SettingsStore settingsStore() {
    return this;
  }

  public synchronized void clear() {
    runs.clear();
    stepsByRun.clear();
    settings.clear();
  }

  public synchronized int runCount() {
    return runs.size();
  }

  // StepConsumer

  @Override public synchronized Call<Void> initiateRun(PipelineMeta pipelineMeta) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    putRun(RunMeta.running(pipelineMeta));
    return Call.create(null);
  }

  @Override public synchronized Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    if (status == null) throw new NullPointerException("status == null");
    putRun(RunMeta.finished(pipelineMeta, status));
    for (StepMeta step : pipelineMeta.steps()) putStep(pipelineMeta.runId(), step);
    return Call.create(null);
  }

  @Override public synchronized Call<Void> initiateStep(String runId, StepMeta step) {
    checkStep(runId, step);
    putStep(runId, step);
    return Call.create(null);
  }

  @Override public synchronized Call<Void> finishStep(String runId, StepMeta step) {
    checkStep(runId, step);
    putStep(runId, step);
    return Call.create(null);
  }

  void putRun(RunMeta run) {
    runs.put(run.runId(), run);
    evictEldestRuns();
  }

  void putStep(String runId, StepMeta step) {
    stepsByRun.computeIfAbsent(runId, id -> new LinkedHashMap<>()).put(step.key(), step);
  }

  void evictEldestRuns() {
    Iterator<String> runIds = runs.keySet().iterator();
    while (runs.size() > maxRunCount && runIds.hasNext()) {
      String runId = runIds.next();
      runIds.remove();
      stepsByRun.remove(runId);
    }
  }

  static void checkStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
  }

  // StepStore

  @Override public Call<List<String>> listPipelines() {
    return SupplierCall.of("listPipelines", this::doListPipelines);
  }

  synchronized List<String> doListPipelines() {
    Map<String, Long> latestStart = new LinkedHashMap<>();
    for (RunMeta run : runs.values()) {
      latestStart.merge(run.pipeline(), run.startTime(), Math::max);
    }
    List<String> result = new ArrayList<>(latestStart.keySet());
    result.sort(Comparator.comparing((String name) -> latestStart.get(name)).reversed()
      .thenComparing(Comparator.naturalOrder()));
    return result;
  }

  @Override public Call<List<RunMeta>> listRuns(String pipeline, RunQuery request) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (request == null) throw new NullPointerException("request == null");
    return SupplierCall.of("listRuns", () -> doListRuns(pipeline, request));
  }

  synchronized List<RunMeta> doListRuns(String pipeline, RunQuery request) {
    List<RunMeta> matching = new ArrayList<>();
    for (RunMeta run : runs.values()) {
      if (run.pipeline().equals(pipeline)) matching.add(run);
    }
    return request.apply(matching);
  }

  @Override public Call<RunData> getRunData(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("getRunData", () -> doGetRunData(runId));
  }

  synchronized RunData doGetRunData(String runId) {
    RunMeta run = runs.get(runId);
    if (run == null) throw new NotFoundException("Run " + runId + " not found");
    return RunData.create(run, doListRunSteps(runId));
  }

  @Override public Call<List<StepMeta>> listRunSteps(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("listRunSteps", () -> doListRunSteps(runId));
  }

  synchronized List<StepMeta> doListRunSteps(String runId) {
    Map<String, StepMeta> steps = stepsByRun.get(runId);
    return steps == null ? new ArrayList<>() : new ArrayList<>(steps.values());
  }

  @Override public Call<List<StepTimeseriesEntry>> getPipelineStepTimeseries(String pipeline,
    String stepName, TimeRange range) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (stepName == null) throw new NullPointerException("stepName == null");
    if (range == null) throw new NullPointerException("range == null");
    return SupplierCall.of("getPipelineStepTimeseries",
      () -> doGetPipelineStepTimeseries(pipeline, stepName, range));
  }

  synchronized List<StepTimeseriesEntry> doGetPipelineStepTimeseries(String pipeline,
    String stepName, TimeRange range) {
    List<StepTimeseriesEntry> result = new ArrayList<>();
    for (Map.Entry<String, Map<String, StepMeta>> run : stepsByRun.entrySet()) {
      for (StepMeta step : run.getValue().values()) {
        if (!step.name().equals(stepName) || !pipeline.equals(pipelineOf(run.getKey(), step))) {
          continue;
        }
        StepTimeseriesEntry entry = StepTimeseriesEntry.of(run.getKey(), step);
        if (entry != null && range.contains(entry.timestamp())) {
          result.add(entry.withStepMeta(step));
        }
      }
    }
    result.sort(Comparator.comparingLong(StepTimeseriesEntry::timestamp)
      .thenComparing(StepTimeseriesEntry::runId));
    return result;
  }

  @Override public Call<List<String>> listPipelineSteps(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("listPipelineSteps", () -> doListPipelineSteps(pipeline));
  }

  synchronized List<String> doListPipelineSteps(String pipeline) {
    TreeSet<String> names = new TreeSet<>();
    for (Map.Entry<String, Map<String, StepMeta>> run : stepsByRun.entrySet()) {
      for (StepMeta step : run.getValue().values()) {
        if (step.time().isFinished() && pipeline.equals(pipelineOf(run.getKey(), step))) {
          names.add(step.name());
        }
      }
    }
    return new ArrayList<>(names);
  }

  /** Steps written before their run fall back to the first segment of their key. */
  String pipelineOf(String runId, StepMeta step) {
    RunMeta run = runs.get(runId);
    if (run != null) return run.pipeline();
    int dot = step.key().indexOf('.');
    return dot == -1 ? step.key() : step.key().substring(0, dot);
  }

  // SettingsStore

  @Override public Call<PipelineSettings> getSettings(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("getSettings", () -> doGetSettings(pipeline));
  }

  synchronized PipelineSettings doGetSettings(String pipeline) {
    return settings.getOrDefault(pipeline, PipelineSettings.EMPTY);
  }

  @Override public synchronized Call<Void> saveSettings(String pipeline,
    PipelineSettings settings) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (settings == null) throw new NullPointerException("settings == null");
    this.settings.put(pipeline, settings);
    return Call.create(null);
  }

  // Retention

  @Override protected Call<Integer> deleteRunsStartedBefore(String pipeline, long cutoff) {
    return SupplierCall.of("deleteRunsStartedBefore", () -> doDelete(pipeline, cutoff));
  }

  synchronized int doDelete(String pipeline, long cutoff) {
    int deleted = 0;
    for (Iterator<RunMeta> i = runs.values().iterator(); i.hasNext(); ) {
      RunMeta run = i.next();
      if (run.pipeline().equals(pipeline) && run.startTime() < cutoff) {
        i.remove();
        stepsByRun.remove(run.runId());
        deleted++;
      }
    }
    return deleted;
  }

  @Override public String toString() {
    return "InMemoryStorage{}";
  }
}
