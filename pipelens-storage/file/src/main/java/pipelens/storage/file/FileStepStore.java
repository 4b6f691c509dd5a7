/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.file;

import java.io.IOException;
import java.nio.file.Path;
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

final class FileStepStore implements StepStore {
  static final Comparator<StepMeta> BY_START =
    Comparator.comparingLong((StepMeta step) -> step.time().startTs())
      .thenComparing(StepMeta::key);

  final FileLayout layout;

  FileStepStore(FileStorage storage) {
    this.layout = storage.layout;
  }

  @Override public Call<List<String>> listPipelines() {
    return SupplierCall.of("listPipelines", this::doListPipelines);
  }

  List<String> doListPipelines() throws IOException {
    Map<String, Long> latestStart = new LinkedHashMap<>();
    for (Path index : FileLayout.listJson(layout.pipelinesDir())) {
      List<RunMeta> runs = readRuns(index);
      if (runs.isEmpty()) continue;
      long latest = Long.MIN_VALUE;
      for (RunMeta run : runs) latest = Math.max(latest, run.startTime());
      latestStart.put(FileLayout.nameOf(index), latest);
    }
    List<String> result = new ArrayList<>(latestStart.keySet());
    result.sort(Comparator.comparing((String name) -> latestStart.get(name)).reversed()
      .thenComparing(Comparator.naturalOrder()));
    return result;
  }

  @Override public Call<List<RunMeta>> listRuns(String pipeline, RunQuery request) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (request == null) throw new NullPointerException("request == null");
    return SupplierCall.of("listRuns",
      () -> request.apply(readRuns(layout.pipelineRuns(pipeline))));
  }

  @Override public Call<RunData> getRunData(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("getRunData", () -> {
      Path meta = layout.runMeta(runId);
      byte[] content = FileLayout.read(meta);
      if (content == null) throw new NotFoundException("Run " + runId + " not found");
      RunMeta run = FileLayout.decode(meta, content, JsonCodec::readRunMeta);
      return RunData.create(run, doListRunSteps(runId));
    });
  }

  @Override public Call<List<StepMeta>> listRunSteps(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return SupplierCall.of("listRunSteps", () -> doListRunSteps(runId));
  }

  /** The run's step list once finished, else the step documents written so far. */
  List<StepMeta> doListRunSteps(String runId) throws IOException {
    Path stepList = layout.runSteps(runId);
    byte[] content = FileLayout.read(stepList);
    if (content != null) {
      return new ArrayList<>(FileLayout.decode(stepList, content, JsonCodec::readStepMetaList));
    }
    List<StepMeta> result = new ArrayList<>();
    for (Path file : FileLayout.listJson(layout.stepsDir(runId))) {
      byte[] step = FileLayout.read(file);
      if (step != null) result.add(FileLayout.decode(file, step, JsonCodec::readStepMeta));
    }
    result.sort(BY_START);
    return result;
  }

  @Override public Call<List<StepTimeseriesEntry>> getPipelineStepTimeseries(String pipeline,
    String stepName, TimeRange range) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (stepName == null) throw new NullPointerException("stepName == null");
    if (range == null) throw new NullPointerException("range == null");
    return SupplierCall.of("getPipelineStepTimeseries", () -> {
      List<StepTimeseriesEntry> result = new ArrayList<>();
      for (StepTimeseriesEntry entry : readTimeseries(layout.timeseries(pipeline, stepName))) {
        if (range.contains(entry.timestamp())) result.add(entry);
      }
      result.sort(Comparator.comparingLong(StepTimeseriesEntry::timestamp)
        .thenComparing(StepTimeseriesEntry::runId));
      return result;
    });
  }

  @Override public Call<List<String>> listPipelineSteps(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("listPipelineSteps", () -> {
      TreeSet<String> names = new TreeSet<>();
      for (Path series : FileLayout.listJson(layout.timeseriesDir(pipeline))) {
        names.add(FileLayout.nameOf(series));
      }
      return new ArrayList<>(names);
    });
  }

  static List<RunMeta> readRuns(Path index) throws IOException {
    byte[] content = FileLayout.read(index);
    if (content == null) return new ArrayList<>();
    return new ArrayList<>(FileLayout.decode(index, content, JsonCodec::readRunMetaList));
  }

  static List<StepTimeseriesEntry> readTimeseries(Path series) throws IOException {
    byte[] content = FileLayout.read(series);
    if (content == null) return new ArrayList<>();
    return new ArrayList<>(FileLayout.decode(series, content, JsonCodec::readTimeseries));
  }
}
