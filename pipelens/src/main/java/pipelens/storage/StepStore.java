/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.List;
import pipelens.Call;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.StepMeta;

/** Queries over stored runs. */
public interface StepStore {

  /** Pipeline names, the one with the most recent run first. */
  Call<List<String>> listPipelines();

  /**
   * Runs of a pipeline, newest start time first. Filters in the request apply before its limit and
   * offset. Returns an empty list for an unknown pipeline.
   */
  Call<List<RunMeta>> listRuns(String pipeline, RunQuery request);

  /**
   * The run's summary and steps.
   *
   * <p>The call fails with {@link pipelens.NotFoundException} when the run was never stored.
   */
  Call<RunData> getRunData(String runId);

  /** Steps of the run, or an empty list when there are none. */
  Call<List<StepMeta>> listRunSteps(String runId);

  /**
   * Finished instances of the logical step across runs of the pipeline, oldest first, whose
   * timestamp is within the range. Entries carry the step's record when it is still stored.
   */
  Call<List<StepTimeseriesEntry>> getPipelineStepTimeseries(String pipeline, String stepName,
    TimeRange range);

  /** Sorted, distinct names of steps with at least one finished instance in the pipeline. */
  Call<List<String>> listPipelineSteps(String pipeline);
}
