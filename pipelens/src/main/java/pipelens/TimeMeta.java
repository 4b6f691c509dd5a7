/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import pipelens.internal.Nullable;

/**
 * Timing of one step in epoch milliseconds. {@link #endTs()} and {@link #timeUsageMs()} are null
 * while the step is running.
 */
// @Immutable
public final class TimeMeta {

  public static TimeMeta started(long startTs) {
    return new TimeMeta(startTs, null, null);
  }

  public static TimeMeta finished(long startTs, long endTs) {
    if (endTs < startTs) {
      throw new IllegalArgumentException("endTs < startTs: " + endTs + " < " + startTs);
    }
    return new TimeMeta(startTs, endTs, endTs - startTs);
  }

  /** Used by decoders which read each field separately. */
  public static TimeMeta create(long startTs, @Nullable Long endTs, @Nullable Long timeUsageMs) {
    if (endTs != null && endTs < startTs) {
      throw new IllegalArgumentException("endTs < startTs: " + endTs + " < " + startTs);
    }
    if (endTs != null && timeUsageMs == null) timeUsageMs = endTs - startTs;
    return new TimeMeta(startTs, endTs, timeUsageMs);
  }

  final long startTs;
  @Nullable final Long endTs, timeUsageMs;

  TimeMeta(long startTs, @Nullable Long endTs, @Nullable Long timeUsageMs) {
    this.startTs = startTs;
    this.endTs = endTs;
    this.timeUsageMs = timeUsageMs;
  }

  public long startTs() {
    return startTs;
  }

  @Nullable public Long endTs() {
    return endTs;
  }

  @Nullable public Long timeUsageMs() {
    return timeUsageMs;
  }

  public boolean isFinished() {
    return endTs != null;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TimeMeta)) return false;
    TimeMeta that = (TimeMeta) o;
    return startTs == that.startTs
      && (endTs == null ? that.endTs == null : endTs.equals(that.endTs))
      && (timeUsageMs == null ? that.timeUsageMs == null : timeUsageMs.equals(that.timeUsageMs));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((startTs >>> 32) ^ startTs);
    h *= 1000003;
    h ^= (endTs == null) ? 0 : endTs.hashCode();
    h *= 1000003;
    h ^= (timeUsageMs == null) ? 0 : timeUsageMs.hashCode();
    return h;
  }

  @Override public String toString() {
    return "TimeMeta{startTs=" + startTs + ", endTs=" + endTs + ", timeUsageMs=" + timeUsageMs + "}";
  }
}
