/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import pipelens.Call;
import pipelens.internal.Nullable;
import pipelens.storage.RunQuery;
import pipelens.storage.StepStore;
import pipelens.storage.TimeRange;

/**
 * Shapes raw storage results into pages with statistics. Statistics are always computed from the
 * full filtered result before it is sliced into a page.
 */
public final class QueryEngine {
  public static QueryEngine create(StepStore stepStore) {
    if (stepStore == null) throw new NullPointerException("stepStore == null");
    return new QueryEngine(stepStore);
  }

  final StepStore stepStore;

  QueryEngine(StepStore stepStore) {
    this.stepStore = stepStore;
  }

  /**
   * Executions of a logical step in a pipeline.
   *
   * @param range defaults to the thirty days before now when null
   */
  public Call<TimeseriesPage> stepTimeseries(String pipeline, String stepName,
    @Nullable TimeRange range, PageRequest page) {
    if (page == null) throw new NullPointerException("page == null");
    TimeRange resolved =
      range != null ? range : TimeRange.lastThirtyDays(System.currentTimeMillis());
    return stepStore.getPipelineStepTimeseries(pipeline, stepName, resolved).map(entries ->
      TimeseriesPage.create(Pagination.slice(entries, page), StepStats.compute(entries),
        Pagination.of(page, entries.size())));
  }

  /** Runs matching the filters of {@code request}, paged by {@code page}. */
  public Call<RunsPage> runs(String pipeline, RunQuery request, PageRequest page) {
    if (request == null) throw new NullPointerException("request == null");
    if (page == null) throw new NullPointerException("page == null");
    RunQuery unpaged = request.toBuilder().limit(null).offset(0).build();
    return stepStore.listRuns(pipeline, unpaged).map(runs ->
      RunsPage.create(Pagination.slice(runs, page), Pagination.of(page, runs.size())));
  }
}
