/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;

/**
 * Receives the lifecycle of pipeline runs. Storage backends implement this to persist runs, and
 * the exporter implements it to forward them to a collector.
 *
 * <p>Writes for the same (run ID, step key) are upserts: {@link #initiateStep} followed by {@link
 * #finishStep} leaves one record, holding the finished state.
 */
public interface StepConsumer {

  /** Records that a run started, with status {@link RunStatus#RUNNING}. */
  Call<Void> initiateRun(PipelineMeta pipelineMeta);

  /** Records the final state of a run and all of its steps. */
  Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status);

  /** Records that a step started. */
  Call<Void> initiateStep(String runId, StepMeta step);

  /** Records the final state of a step and indexes its duration for timeseries queries. */
  Call<Void> finishStep(String runId, StepMeta step);
}
