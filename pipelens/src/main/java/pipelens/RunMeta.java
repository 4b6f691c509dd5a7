/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import pipelens.internal.Nullable;

/** Summary of one pipeline run, as listed by {@link pipelens.storage.StepStore#listRuns}. */
// @Immutable
public final class RunMeta {

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /** Summary of a run which just started. */
  public static RunMeta running(PipelineMeta pipelineMeta) {
    return newBuilder()
      .runId(pipelineMeta.runId())
      .pipeline(pipelineMeta.name())
      .startTime(pipelineMeta.time().startTs())
      .status(RunStatus.RUNNING)
      .build();
  }

  /**
   * Summary of a run which finished with the given status. The end time falls back to the start
   * time when the root step has not recorded one.
   */
  public static RunMeta finished(PipelineMeta pipelineMeta, RunStatus status) {
    TimeMeta time = pipelineMeta.time();
    long endTime = time.endTs() != null ? time.endTs() : time.startTs();
    return newBuilder()
      .runId(pipelineMeta.runId())
      .pipeline(pipelineMeta.name())
      .startTime(time.startTs())
      .endTime(endTime)
      .duration(time.timeUsageMs() != null ? time.timeUsageMs() : endTime - time.startTs())
      .status(status)
      .build();
  }

  final String runId, pipeline;
  final long startTime;
  @Nullable final Long endTime, duration;
  final RunStatus status;

  RunMeta(Builder builder) {
    runId = builder.runId;
    pipeline = builder.pipeline;
    startTime = builder.startTime;
    endTime = builder.endTime;
    duration = builder.duration;
    status = builder.status;
  }

  public String runId() {
    return runId;
  }

  /** Name of the pipeline, which is the root step's name. */
  public String pipeline() {
    return pipeline;
  }

  public long startTime() {
    return startTime;
  }

  @Nullable public Long endTime() {
    return endTime;
  }

  @Nullable public Long duration() {
    return duration;
  }

  public RunStatus status() {
    return status;
  }

  public static final class Builder {
    String runId, pipeline;
    long startTime;
    Long endTime, duration;
    RunStatus status = RunStatus.RUNNING;

    Builder() {
    }

    Builder(RunMeta source) {
      runId = source.runId;
      pipeline = source.pipeline;
      startTime = source.startTime;
      endTime = source.endTime;
      duration = source.duration;
      status = source.status;
    }

    public Builder runId(String runId) {
      if (runId == null) throw new NullPointerException("runId == null");
      this.runId = runId;
      return this;
    }

    public Builder pipeline(String pipeline) {
      if (pipeline == null) throw new NullPointerException("pipeline == null");
      this.pipeline = pipeline;
      return this;
    }

    public Builder startTime(long startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(@Nullable Long endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder duration(@Nullable Long duration) {
      this.duration = duration;
      return this;
    }

    public Builder status(RunStatus status) {
      if (status == null) throw new NullPointerException("status == null");
      this.status = status;
      return this;
    }

    public RunMeta build() {
      String missing = "";
      if (runId == null) missing += " runId";
      if (pipeline == null) missing += " pipeline";
      if (!missing.isEmpty()) throw new IllegalStateException("Missing :" + missing);
      return new RunMeta(this);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RunMeta)) return false;
    RunMeta that = (RunMeta) o;
    return runId.equals(that.runId)
      && pipeline.equals(that.pipeline)
      && startTime == that.startTime
      && (endTime == null ? that.endTime == null : endTime.equals(that.endTime))
      && (duration == null ? that.duration == null : duration.equals(that.duration))
      && status == that.status;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= runId.hashCode();
    h *= 1000003;
    h ^= pipeline.hashCode();
    h *= 1000003;
    h ^= (int) ((startTime >>> 32) ^ startTime);
    h *= 1000003;
    h ^= (endTime == null) ? 0 : endTime.hashCode();
    h *= 1000003;
    h ^= (duration == null) ? 0 : duration.hashCode();
    h *= 1000003;
    h ^= status.hashCode();
    return h;
  }

  @Override public String toString() {
    return "RunMeta{runId=" + runId + ", pipeline=" + pipeline + ", startTime=" + startTime
      + ", endTime=" + endTime + ", duration=" + duration + ", status=" + status.value + "}";
  }
}
