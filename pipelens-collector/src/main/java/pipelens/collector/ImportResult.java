/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import pipelens.PipelineMeta;
import pipelens.internal.Nullable;

/** Outcome of importing one file. Run fields are only present on success. */
// @Immutable
public final class ImportResult {

  static ImportResult imported(String filename, PipelineMeta pipelineMeta) {
    String message = "Successfully imported data from file " + filename + " (Run ID: "
      + pipelineMeta.runId() + ", total steps: " + pipelineMeta.steps().size() + ")";
    return new ImportResult(filename, true, message, pipelineMeta.runId(),
      pipelineMeta.time().startTs(), pipelineMeta.time().endTs(), pipelineMeta.steps().size());
  }

  static ImportResult failed(String filename, String message) {
    return new ImportResult(filename, false, message, null, null, null, 0);
  }

  final String filename, message;
  final boolean success;
  @Nullable final String runId;
  @Nullable final Long startTime, endTime;
  final int stepCount;

  ImportResult(String filename, boolean success, String message, @Nullable String runId,
    @Nullable Long startTime, @Nullable Long endTime, int stepCount) {
    this.filename = filename;
    this.success = success;
    this.message = message;
    this.runId = runId;
    this.startTime = startTime;
    this.endTime = endTime;
    this.stepCount = stepCount;
  }

  public String filename() {
    return filename;
  }

  public boolean success() {
    return success;
  }

  /** Summary of the import on success, or why the file was rejected. */
  public String message() {
    return message;
  }

  @Nullable public String runId() {
    return runId;
  }

  @Nullable public Long startTime() {
    return startTime;
  }

  /** Null when the imported run hadn't finished. */
  @Nullable public Long endTime() {
    return endTime;
  }

  public int stepCount() {
    return stepCount;
  }

  @Override public String toString() {
    return "ImportResult{filename=" + filename + ", success=" + success + ", message=" + message
      + "}";
  }
}
