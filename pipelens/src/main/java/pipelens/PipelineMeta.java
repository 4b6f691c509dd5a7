/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import pipelens.internal.Nullable;

/**
 * The document describing one pipeline run: the root step's fields, the run ID and every step of
 * the run flattened in pre-order. This is what storage receives at run start and finish, what the
 * exporter sends and what the importer reads.
 */
// @Immutable
public final class PipelineMeta {
  /** Version written by this library. Version 0 marks documents converted from the legacy array. */
  public static final int LOG_VERSION = 1;

  public static PipelineMeta create(String runId, StepMeta root, List<StepMeta> steps) {
    return create(runId, LOG_VERSION, root, steps);
  }

  public static PipelineMeta create(String runId, int logVersion, StepMeta root,
    List<StepMeta> steps) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (root == null) throw new NullPointerException("root == null");
    if (steps == null) throw new NullPointerException("steps == null");
    return new PipelineMeta(runId, logVersion, root, steps);
  }

  final String runId;
  final int logVersion;
  final StepMeta root;
  final List<StepMeta> steps;

  PipelineMeta(String runId, int logVersion, StepMeta root, List<StepMeta> steps) {
    this.runId = runId;
    this.logVersion = logVersion;
    this.root = root;
    this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
  }

  public String runId() {
    return runId;
  }

  public int logVersion() {
    return logVersion;
  }

  /** The root step, whose name is the pipeline name. */
  public StepMeta root() {
    return root;
  }

  public String name() {
    return root.name();
  }

  public String key() {
    return root.key();
  }

  public TimeMeta time() {
    return root.time();
  }

  public Map<String, JsonNode> records() {
    return root.records();
  }

  @Nullable public JsonNode result() {
    return root.result();
  }

  @Nullable public String error() {
    return root.error();
  }

  /** All steps including the root, in pre-order. */
  public List<StepMeta> steps() {
    return steps;
  }

  /** Status implied by the root step: running until it ends, then failed or completed. */
  public RunStatus status() {
    if (!root.time().isFinished()) return RunStatus.RUNNING;
    return root.hasError() ? RunStatus.FAILED : RunStatus.COMPLETED;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof PipelineMeta)) return false;
    PipelineMeta that = (PipelineMeta) o;
    return runId.equals(that.runId)
      && logVersion == that.logVersion
      && root.equals(that.root)
      && steps.equals(that.steps);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= runId.hashCode();
    h *= 1000003;
    h ^= logVersion;
    h *= 1000003;
    h ^= root.hashCode();
    h *= 1000003;
    h ^= steps.hashCode();
    return h;
  }

  @Override public String toString() {
    return "PipelineMeta{runId=" + runId + ", logVersion=" + logVersion + ", root=" + root
      + ", steps=" + steps.size() + "}";
  }
}
