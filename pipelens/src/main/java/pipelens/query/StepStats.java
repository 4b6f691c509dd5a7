/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import java.util.List;
import pipelens.storage.StepTimeseriesEntry;

/**
 * Aggregates over every execution of a step in a time range. Durations only consider entries with
 * a positive value, and are zero when there are none. An execution is an error when its attached
 * record has a non-empty error.
 */
// @Immutable
public final class StepStats {
  public static final StepStats EMPTY = new StepStats(0, 0, 0, 0, 0, 0);

  public static StepStats compute(List<StepTimeseriesEntry> entries) {
    if (entries == null) throw new NullPointerException("entries == null");
    int errorCount = 0, durationCount = 0;
    long min = Long.MAX_VALUE, max = Long.MIN_VALUE, sum = 0;
    for (StepTimeseriesEntry entry : entries) {
      if (entry.isError()) errorCount++;
      long value = entry.value();
      if (value <= 0) continue;
      durationCount++;
      sum += value;
      if (value < min) min = value;
      if (value > max) max = value;
    }
    if (durationCount == 0) min = max = 0;
    double avg = durationCount == 0 ? 0 : (double) sum / durationCount;
    return new StepStats(entries.size(), entries.size() - errorCount, errorCount, min, max, avg);
  }

  final int totalExecutions, successCount, errorCount;
  final long minDuration, maxDuration;
  final double avgDuration;

  StepStats(int totalExecutions, int successCount, int errorCount, long minDuration,
    long maxDuration, double avgDuration) {
    this.totalExecutions = totalExecutions;
    this.successCount = successCount;
    this.errorCount = errorCount;
    this.minDuration = minDuration;
    this.maxDuration = maxDuration;
    this.avgDuration = avgDuration;
  }

  public int totalExecutions() {
    return totalExecutions;
  }

  public int successCount() {
    return successCount;
  }

  public int errorCount() {
    return errorCount;
  }

  public long minDuration() {
    return minDuration;
  }

  public long maxDuration() {
    return maxDuration;
  }

  public double avgDuration() {
    return avgDuration;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof StepStats)) return false;
    StepStats that = (StepStats) o;
    return totalExecutions == that.totalExecutions
      && successCount == that.successCount
      && errorCount == that.errorCount
      && minDuration == that.minDuration
      && maxDuration == that.maxDuration
      && Double.compare(avgDuration, that.avgDuration) == 0;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= totalExecutions;
    h *= 1000003;
    h ^= successCount;
    h *= 1000003;
    h ^= errorCount;
    h *= 1000003;
    h ^= Long.hashCode(minDuration);
    h *= 1000003;
    h ^= Long.hashCode(maxDuration);
    h *= 1000003;
    h ^= Double.hashCode(avgDuration);
    return h;
  }

  @Override public String toString() {
    return "StepStats{totalExecutions=" + totalExecutions + ", successCount=" + successCount
      + ", errorCount=" + errorCount + ", minDuration=" + minDuration + ", maxDuration="
      + maxDuration + ", avgDuration=" + avgDuration + "}";
  }
}
