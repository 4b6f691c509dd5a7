/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Runs shared by storage tests. Times are relative to the start of the current minute. */
public final class TestObjects {
  public static final long DAY = TimeUnit.DAYS.toMillis(1);
  public static final long NOW = System.currentTimeMillis() / 60_000L * 60_000L;

  /** A finished root step named after the pipeline. */
  public static StepMeta rootStep(String pipeline, long startTs, long duration) {
    return StepMeta.newBuilder()
      .name(pipeline)
      .key(pipeline.replace('.', '_'))
      .time(TimeMeta.finished(startTs, startTs + duration))
      .putRecord("env", TextNode.valueOf("test"))
      .build();
  }

  public static StepMeta step(String parentKey, String name, long startTs, long duration) {
    return StepMeta.newBuilder()
      .name(name)
      .key(parentKey + "." + name)
      .time(TimeMeta.finished(startTs, startTs + duration))
      .putRecord("rows", IntNode.valueOf((int) duration))
      .result(TextNode.valueOf(name + "-done"))
      .build();
  }

  public static StepMeta runningStep(String parentKey, String name, long startTs) {
    return StepMeta.newBuilder()
      .name(name)
      .key(parentKey + "." + name)
      .time(TimeMeta.started(startTs))
      .build();
  }

  /**
   * A finished run of {@code pipeline} with children "extract" then "load", each lasting the given
   * durations, the second starting after the first.
   */
  public static PipelineMeta run(String pipeline, String runId, long startTs, long extractMs,
    long loadMs) {
    StepMeta root = rootStep(pipeline, startTs, extractMs + loadMs + 2);
    List<StepMeta> steps = new ArrayList<>();
    steps.add(root);
    steps.add(step(root.key(), "extract", startTs + 1, extractMs));
    steps.add(step(root.key(), "load", startTs + 1 + extractMs, loadMs));
    return PipelineMeta.create(runId, root, steps);
  }

  /** Like {@link #run} but the load step and the root failed. */
  public static PipelineMeta failedRun(String pipeline, String runId, long startTs) {
    PipelineMeta ok = run(pipeline, runId, startTs, 10, 20);
    StepMeta root = ok.root().toBuilder().error("load failed").build();
    StepMeta load = ok.steps().get(2).toBuilder().result(null).error("load failed").build();
    return PipelineMeta.create(runId, root, List.of(root, ok.steps().get(1), load));
  }

  /** The run's root, while it is still running. */
  public static PipelineMeta startedRun(String pipeline, String runId, long startTs) {
    StepMeta root = StepMeta.newBuilder()
      .name(pipeline)
      .key(pipeline.replace('.', '_'))
      .time(TimeMeta.started(startTs))
      .build();
    return PipelineMeta.create(runId, root, List.of(root));
  }

  TestObjects() {
  }
}
