/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.file;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.SupplierCall;
import pipelens.storage.StepConsumer;
import pipelens.storage.StepTimeseriesEntry;

final class FileStepConsumer implements StepConsumer {
  final FileStorage storage;
  final FileLayout layout;

  FileStepConsumer(FileStorage storage) {
    this.storage = storage;
    this.layout = storage.layout;
  }

  @Override public Call<Void> initiateRun(PipelineMeta pipelineMeta) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    return SupplierCall.of("initiateRun", () -> {
      storage.connect();
      putRun(RunMeta.running(pipelineMeta));
      return null;
    });
  }

  @Override public Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    if (status == null) throw new NullPointerException("status == null");
    return SupplierCall.of("finishRun", () -> {
      storage.connect();
      String runId = pipelineMeta.runId();
      putRun(RunMeta.finished(pipelineMeta, status));
      Path runDir = layout.runDir(runId);
      storage.lock.withLock(runDir.toString(), () -> {
        for (StepMeta step : pipelineMeta.steps()) {
          FileLayout.write(layout.step(runId, step.key()), JsonCodec.writeStepMeta(step));
        }
        FileLayout.write(layout.runSteps(runId),
          JsonCodec.writeList(JsonCodec::writeStepMeta, pipelineMeta.steps()));
        return null;
      });
      for (StepMeta step : pipelineMeta.steps()) {
        indexTimeseries(pipelineMeta.name(), runId, step);
      }
      return null;
    });
  }

  @Override public Call<Void> initiateStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return SupplierCall.of("initiateStep", () -> {
      storage.connect();
      putStep(runId, step);
      return null;
    });
  }

  @Override public Call<Void> finishStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return SupplierCall.of("finishStep", () -> {
      storage.connect();
      putStep(runId, step);
      indexTimeseries(pipelineOf(runId, step), runId, step);
      return null;
    });
  }

  void putRun(RunMeta run) throws IOException {
    Path index = layout.pipelineRuns(run.pipeline());
    storage.lock.withLock(index.toString(), () -> {
      List<RunMeta> runs = FileStepStore.readRuns(index);
      List<RunMeta> updated = new ArrayList<>(runs.size() + 1);
      for (RunMeta existing : runs) {
        if (!existing.runId().equals(run.runId())) updated.add(existing);
      }
      updated.add(run);
      FileLayout.write(index, JsonCodec.writeRunMetaList(updated));
      FileLayout.write(layout.runMeta(run.runId()), JsonCodec.writeRunMeta(run));
      return null;
    });
  }

  /** Writes the step's own document, and replaces it in the run's step list if already written. */
  void putStep(String runId, StepMeta step) throws IOException {
    Path runDir = layout.runDir(runId);
    storage.lock.withLock(runDir.toString(), () -> {
      FileLayout.write(layout.step(runId, step.key()), JsonCodec.writeStepMeta(step));
      Path stepList = layout.runSteps(runId);
      byte[] content = FileLayout.read(stepList);
      if (content == null) return null;
      List<StepMeta> steps = new ArrayList<>(
        FileLayout.decode(stepList, content, JsonCodec::readStepMetaList));
      boolean replaced = false;
      for (int i = 0; i < steps.size(); i++) {
        if (steps.get(i).key().equals(step.key())) {
          steps.set(i, step);
          replaced = true;
        }
      }
      if (!replaced) steps.add(step);
      FileLayout.write(stepList, JsonCodec.writeList(JsonCodec::writeStepMeta, steps));
      return null;
    });
  }

  /** Adds or replaces the entry for this run and step key. Unfinished steps are skipped. */
  void indexTimeseries(String pipeline, String runId, StepMeta step) throws IOException {
    StepTimeseriesEntry entry = StepTimeseriesEntry.of(runId, step);
    if (entry == null) return;
    Path series = layout.timeseries(pipeline, step.name());
    storage.lock.withLock(series.toString(), () -> {
      List<StepTimeseriesEntry> entries = FileStepStore.readTimeseries(series);
      entries.removeIf(e -> e.runId().equals(runId) && e.stepKey().equals(step.key()));
      entries.add(entry.withStepMeta(step));
      FileLayout.write(series, JsonCodec.writeTimeseries(entries));
      return null;
    });
  }

  /** Steps written before their run fall back to the first segment of their key. */
  String pipelineOf(String runId, StepMeta step) throws IOException {
    Path meta = layout.runMeta(runId);
    byte[] content = FileLayout.read(meta);
    if (content != null) return FileLayout.decode(meta, content, JsonCodec::readRunMeta).pipeline();
    int dot = step.key().indexOf('.');
    return dot == -1 ? step.key() : step.key().substring(0, dot);
  }

  static void checkStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
  }
}
