/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import pipelens.storage.StepTimeseriesEntry;

/** One page of a step's executions, with statistics over all executions in the range. */
// @Immutable
public final class TimeseriesPage {
  public static TimeseriesPage create(List<StepTimeseriesEntry> entries, StepStats stats,
    Pagination pagination) {
    if (entries == null) throw new NullPointerException("entries == null");
    if (stats == null) throw new NullPointerException("stats == null");
    if (pagination == null) throw new NullPointerException("pagination == null");
    return new TimeseriesPage(entries, stats, pagination);
  }

  final List<StepTimeseriesEntry> entries;
  final StepStats stats;
  final Pagination pagination;

  TimeseriesPage(List<StepTimeseriesEntry> entries, StepStats stats, Pagination pagination) {
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    this.stats = stats;
    this.pagination = pagination;
  }

  public List<StepTimeseriesEntry> entries() {
    return entries;
  }

  /** Computed over the whole range, not only this page. */
  public StepStats stats() {
    return stats;
  }

  public Pagination pagination() {
    return pagination;
  }

  @Override public String toString() {
    return "TimeseriesPage{entries=" + entries.size() + ", stats=" + stats + ", pagination="
      + pagination + "}";
  }
}
