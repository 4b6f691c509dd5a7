/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.internal.Nullable;
import pipelens.storage.StepConsumer;

/**
 * One execution of a pipeline: a root {@link Step} plus a run ID, and optionally persistence of
 * the run as it progresses.
 *
 * <p>Ex.
 * <pre>{@code
 * Pipeline pipeline = Pipeline.newBuilder("nightly-etl")
 *   .autoSave(Pipeline.AutoSave.REAL_TIME)
 *   .consumer(storage.stepConsumer())
 *   .build();
 *
 * pipeline.run(root -> {
 *   root.step("extract", step -> extract());
 *   return root.step("load", step -> load());
 * });
 * }</pre>
 *
 * <p>Persistence failures are logged and never interrupt the tracked code.
 */
public final class Pipeline {
  static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

  /** When the run is written to the configured {@link StepConsumer}. */
  public enum AutoSave {
    /** Never. Callers persist {@link #outputPipelineMeta()} themselves. */
    OFF,
    /** Once, when the root step completes. */
    ON_FINISH,
    /** At run start, at each step start and completion, and at run completion. */
    REAL_TIME
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    final String name;
    String runId;
    AutoSave autoSave = AutoSave.OFF;
    StepConsumer consumer;

    Builder(String name) {
      if (name == null) throw new NullPointerException("name == null");
      this.name = name;
    }

    /** Defaults to a random UUID. */
    public Builder runId(String runId) {
      if (runId == null) throw new NullPointerException("runId == null");
      this.runId = runId;
      return this;
    }

    /** Defaults to {@link AutoSave#OFF}. */
    public Builder autoSave(AutoSave autoSave) {
      if (autoSave == null) throw new NullPointerException("autoSave == null");
      this.autoSave = autoSave;
      return this;
    }

    /** Storage or exporter receiving the run. Required unless auto save is off. */
    public Builder consumer(@Nullable StepConsumer consumer) {
      this.consumer = consumer;
      return this;
    }

    /**
     * @throws ConfigurationException if auto save is enabled without a consumer
     */
    public Pipeline build() {
      if (autoSave != AutoSave.OFF && consumer == null) {
        throw new ConfigurationException(
          "autoSave " + autoSave + " requires a consumer, such as a storage component or exporter");
      }
      return new Pipeline(this);
    }
  }

  final Step root;
  final String runId;
  final AutoSave autoSave;
  @Nullable final StepConsumer consumer;

  Pipeline(Builder builder) {
    root = Step.newRoot(builder.name);
    runId = builder.runId != null ? builder.runId : UUID.randomUUID().toString();
    autoSave = builder.autoSave;
    consumer = builder.consumer;
    if (autoSave == AutoSave.REAL_TIME) {
      root.on(StepEvent.Kind.STEP_START, this::onStepStart);
    }
    if (autoSave != AutoSave.OFF) {
      root.on(StepEvent.Kind.STEP_COMPLETE, this::onStepComplete);
    }
  }

  public String name() {
    return root.name();
  }

  public String runId() {
    return runId;
  }

  public AutoSave autoSave() {
    return autoSave;
  }

  public Step root() {
    return root;
  }

  /** Runs the root step's body. A pipeline runs once. */
  public <T> T run(StepFunction<T> fn) throws Exception {
    if (fn == null) throw new NullPointerException("fn == null");
    return root.run(fn);
  }

  /** Runs {@code fn} as a child of the root step. */
  public <T> T step(String name, StepFunction<T> fn) throws Exception {
    return root.step(name, fn);
  }

  public void record(String key, @Nullable Object value) {
    root.record(key, value);
  }

  public void on(StepEvent.Kind kind, StepListener listener) {
    root.on(kind, listener);
  }

  public List<StepMeta> flatten() {
    return root.flatten();
  }

  public StepNode toTree() {
    return root.toTree();
  }

  /** Failed when the root step ended with an error, else completed. */
  public RunStatus status() {
    String error = root.error();
    return error != null && !error.isEmpty() ? RunStatus.FAILED : RunStatus.COMPLETED;
  }

  /** Snapshot of the whole run, as written to storage. */
  public PipelineMeta outputPipelineMeta() {
    List<StepMeta> steps = root.flatten();
    return PipelineMeta.create(runId, steps.get(0), steps);
  }

  void onStepStart(StepEvent event) {
    Step step = event.step();
    if (step == root) persist("initiateRun", () -> consumer.initiateRun(outputPipelineMeta()));
    persist("initiateStep", () -> consumer.initiateStep(runId, step.meta()));
  }

  void onStepComplete(StepEvent event) {
    Step step = event.step();
    if (autoSave == AutoSave.REAL_TIME) {
      persist("finishStep", () -> consumer.finishStep(runId, step.meta()));
    }
    if (step != root) return;
    persist("finishRun", () -> consumer.finishRun(outputPipelineMeta(), status()));
  }

  void persist(String operation, Supplier<Call<Void>> call) {
    try {
      call.get().execute();
    } catch (IOException | RuntimeException e) {
      LOG.warn("{} failed for run {} of pipeline {}", operation, runId, name(), e);
    }
  }

  @Override public String toString() {
    return "Pipeline{name=" + name() + ", runId=" + runId + ", autoSave=" + autoSave + "}";
  }
}
