/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import java.util.List;
import pipelens.Call;
import pipelens.RunData;
import pipelens.StepMeta;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;
import pipelens.internal.Nullable;
import pipelens.query.PageRequest;
import pipelens.query.QueryEngine;
import pipelens.query.RunsPage;
import pipelens.query.TimeseriesPage;
import pipelens.storage.PipelineSettings;
import pipelens.storage.RunQuery;
import pipelens.storage.StorageComponent;
import pipelens.storage.TimeRange;

/**
 * Read side of a collector: what a dashboard asks of storage, with parameters parsed from query
 * strings. Paged results use {@link PageRequest#DEFAULT} when no page is given.
 */
public final class QueryService {

  public static QueryService create(StorageComponent storage) {
    if (storage == null) throw new NullPointerException("storage == null");
    return new QueryService(storage);
  }

  final StorageComponent storage;
  final QueryEngine engine;

  QueryService(StorageComponent storage) {
    this.storage = storage;
    this.engine = QueryEngine.create(storage.stepStore());
  }

  public Call<List<String>> pipelines() {
    return storage.stepStore().listPipelines();
  }

  public Call<RunsPage> runs(String pipeline, RunQuery query, PageRequest page) {
    return engine.runs(pipeline, query, page);
  }

  public Call<RunData> run(String runId) {
    return storage.stepStore().getRunData(runId);
  }

  public Call<List<StepMeta>> runSteps(String runId) {
    return storage.stepStore().listRunSteps(runId);
  }

  public Call<List<String>> pipelineSteps(String pipeline) {
    return storage.stepStore().listPipelineSteps(pipeline);
  }

  /** @param range defaults to the thirty days before now when null */
  public Call<TimeseriesPage> stepTimeseries(String pipeline, String stepName,
    @Nullable TimeRange range, PageRequest page) {
    return engine.stepTimeseries(pipeline, stepName, range, page);
  }

  public Call<PipelineSettings> settings(String pipeline) {
    return storage.settingsStore().getSettings(pipeline);
  }

  public Call<Void> saveSettings(String pipeline, PipelineSettings settings) {
    return storage.settingsStore().saveSettings(pipeline, settings);
  }

  /** Saves settings posted as JSON, such as {@code {"retentionDays": 7}}. */
  public Call<Void> saveSettings(String pipeline, byte[] json) {
    return saveSettings(pipeline, JsonCodec.readSettings(json));
  }

  /** Deletes runs older than the retention window, returning how many were deleted. */
  public Call<Integer> purge(String pipeline, @Nullable Integer overrideRetentionDays) {
    return storage.purgeOldData(pipeline, overrideRetentionDays);
  }

  /** Parses "page" and "pageSize" query parameters, either of which may be absent. */
  public static PageRequest pageRequest(@Nullable String page, @Nullable String pageSize) {
    return PageRequest.create(
      parseInt("page", page, 1), parseInt("pageSize", pageSize, PageRequest.DEFAULT_PAGE_SIZE));
  }

  /**
   * Builds a time range from epoch millis parameters. A missing end is now and a missing start is
   * thirty days before the end.
   */
  public static TimeRange timeRange(@Nullable Long startDate, @Nullable Long endDate, long now) {
    long end = endDate != null ? endDate : now;
    long start = startDate != null ? startDate : end - TimeRange.DEFAULT_LOOKBACK;
    if (end < start) throw new ValidationException("endDate < startDate");
    return TimeRange.create(start, end);
  }

  static int parseInt(String name, @Nullable String value, int defaultValue) {
    if (value == null || value.isEmpty()) return defaultValue;
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new ValidationException(name + " must be a number: " + value, e);
    }
  }

  @Override public String toString() {
    return "QueryService{storage=" + storage + "}";
  }
}
