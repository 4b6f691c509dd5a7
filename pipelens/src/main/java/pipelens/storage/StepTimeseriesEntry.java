/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import pipelens.StepMeta;
import pipelens.internal.Nullable;

/**
 * One finished instance of a logical step. The timestamp is the step's start time and the value is
 * its duration in milliseconds.
 */
// @Immutable
public final class StepTimeseriesEntry {

  public static StepTimeseriesEntry create(long timestamp, String runId, String stepKey,
    long value) {
    return create(timestamp, runId, stepKey, value, null);
  }

  public static StepTimeseriesEntry create(long timestamp, String runId, String stepKey,
    long value, @Nullable StepMeta stepMeta) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (stepKey == null) throw new NullPointerException("stepKey == null");
    return new StepTimeseriesEntry(timestamp, runId, stepKey, value, stepMeta);
  }

  /** Entry indexed when a step finishes, or null if the step has no duration yet. */
  @Nullable public static StepTimeseriesEntry of(String runId, StepMeta step) {
    Long timeUsageMs = step.time().timeUsageMs();
    if (timeUsageMs == null) return null;
    return new StepTimeseriesEntry(step.time().startTs(), runId, step.key(), timeUsageMs, null);
  }

  final long timestamp, value;
  final String runId, stepKey;
  @Nullable final StepMeta stepMeta;

  StepTimeseriesEntry(long timestamp, String runId, String stepKey, long value,
    @Nullable StepMeta stepMeta) {
    this.timestamp = timestamp;
    this.runId = runId;
    this.stepKey = stepKey;
    this.value = value;
    this.stepMeta = stepMeta;
  }

  public long timestamp() {
    return timestamp;
  }

  public String runId() {
    return runId;
  }

  public String stepKey() {
    return stepKey;
  }

  /** Duration in milliseconds */
  public long value() {
    return value;
  }

  /** The step's stored record, absent when it was purged or not yet loaded. */
  @Nullable public StepMeta stepMeta() {
    return stepMeta;
  }

  public StepTimeseriesEntry withStepMeta(@Nullable StepMeta stepMeta) {
    return new StepTimeseriesEntry(timestamp, runId, stepKey, value, stepMeta);
  }

  /** True when the attached record has a non-empty error. */
  public boolean isError() {
    return stepMeta != null && stepMeta.hasError();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof StepTimeseriesEntry)) return false;
    StepTimeseriesEntry that = (StepTimeseriesEntry) o;
    return timestamp == that.timestamp
      && runId.equals(that.runId)
      && stepKey.equals(that.stepKey)
      && value == that.value
      && (stepMeta == null ? that.stepMeta == null : stepMeta.equals(that.stepMeta));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= Long.hashCode(timestamp);
    h *= 1000003;
    h ^= runId.hashCode();
    h *= 1000003;
    h ^= stepKey.hashCode();
    h *= 1000003;
    h ^= Long.hashCode(value);
    h *= 1000003;
    h ^= (stepMeta == null) ? 0 : stepMeta.hashCode();
    return h;
  }

  @Override public String toString() {
    return "StepTimeseriesEntry{timestamp=" + timestamp + ", runId=" + runId + ", stepKey="
      + stepKey + ", value=" + value + ", stepMeta=" + (stepMeta != null) + "}";
  }
}
