/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import pipelens.Call;

public interface SettingsStore {

  /** Returns {@link PipelineSettings#EMPTY} when nothing was saved for the pipeline. */
  Call<PipelineSettings> getSettings(String pipeline);

  /** Replaces the settings of the pipeline. */
  Call<Void> saveSettings(String pipeline, PipelineSettings settings);
}
