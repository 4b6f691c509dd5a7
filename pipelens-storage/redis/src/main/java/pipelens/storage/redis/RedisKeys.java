/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

/**
 * Keys written by {@link RedisStorage}.
 *
 * <pre>{@code
 * pipelines                          set of pipeline names
 * pipeline:{name}:runs               hash of run ID to run summary
 * pipeline:{name}:steps              set of step names with a finished instance
 * run:{runId}:meta                   run summary
 * run:{runId}:steps                  hash of step key to step
 * ts:{pipeline}.{stepName}           step durations, by step start time
 * ts:{pipeline}.{stepName}:meta:{ts} hash naming the run ID and step key of a sample
 * settings:{pipeline}                pipeline settings
 * }</pre>
 */
final class RedisKeys {
  static final String PIPELINES = "pipelines";

  static String pipelineRuns(String pipeline) {
    return "pipeline:" + pipeline + ":runs";
  }

  static String pipelineSteps(String pipeline) {
    return "pipeline:" + pipeline + ":steps";
  }

  static String runMeta(String runId) {
    return "run:" + runId + ":meta";
  }

  static String runSteps(String runId) {
    return "run:" + runId + ":steps";
  }

  static String timeseries(String pipeline, String stepName) {
    return "ts:" + pipeline + "." + stepName;
  }

  static String sampleMeta(String timeseriesKey, long timestamp) {
    return timeseriesKey + ":meta:" + timestamp;
  }

  static String settings(String pipeline) {
    return "settings:" + pipeline;
  }

  /** Patterns covering every key above. */
  static final String[] ALL_PATTERNS = {PIPELINES, "pipeline:*", "run:*", "ts:*", "settings:*"};

  RedisKeys() {
  }
}
