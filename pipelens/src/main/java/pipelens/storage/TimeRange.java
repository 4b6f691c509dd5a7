/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.concurrent.TimeUnit;

/** Half-open interval {@code [start, end)} of epoch milliseconds. */
// @Immutable
public final class TimeRange {
  public static final long DEFAULT_LOOKBACK = TimeUnit.DAYS.toMillis(30);

  public static TimeRange create(long start, long end) {
    if (end < start) throw new IllegalArgumentException("end < start: " + end + " < " + start);
    return new TimeRange(start, end);
  }

  /** The range ending at {@code now} which starts {@link #DEFAULT_LOOKBACK} before. */
  public static TimeRange lastThirtyDays(long now) {
    return new TimeRange(now - DEFAULT_LOOKBACK, now);
  }

  final long start, end;

  TimeRange(long start, long end) {
    this.start = start;
    this.end = end;
  }

  public long start() {
    return start;
  }

  public long end() {
    return end;
  }

  public boolean contains(long timestamp) {
    return timestamp >= start && timestamp < end;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TimeRange)) return false;
    TimeRange that = (TimeRange) o;
    return start == that.start && end == that.end;
  }

  @Override public int hashCode() {
    return Long.hashCode(start) * 1000003 ^ Long.hashCode(end);
  }

  @Override public String toString() {
    return "TimeRange{start=" + start + ", end=" + end + "}";
  }
}
