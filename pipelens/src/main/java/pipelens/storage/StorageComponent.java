/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.Component;
import pipelens.ValidationException;
import pipelens.internal.Nullable;

/**
 * A component that persists pipeline runs and answers queries about them. Every backend exposes the
 * same behavior: writes through {@link #stepConsumer()}, queries through {@link #stepStore()},
 * per-pipeline settings through {@link #settingsStore()} and age-based deletion through {@link
 * #purgeOldData}.
 *
 * @see InMemoryStorage
 */
public abstract class StorageComponent extends Component {
  static final Logger LOG = LoggerFactory.getLogger(StorageComponent.class);

  /**
   * Prepares the backend, for example creating directories or schema. This is idempotent, and
   * other operations call it implicitly when needed.
   */
  public void connect() throws IOException {
  }

  public abstract StepConsumer stepConsumer();

  public abstract StepStore stepStore();

  public abstract SettingsStore settingsStore();

  /**
   * Deletes runs of the pipeline, with their steps and timeseries entries, which started before
   * {@code now - retentionDays}. See {@link Retention} for how retention days resolve.
   *
   * @param overrideRetentionDays when present, used instead of the pipeline's settings
   * @return a call producing the count of runs deleted
   */
  public Call<Integer> purgeOldData(String pipeline, @Nullable Integer overrideRetentionDays) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (overrideRetentionDays != null && overrideRetentionDays <= 0) {
      throw new ValidationException("retentionDays must be positive: " + overrideRetentionDays);
    }
    Call<Integer> purge;
    if (overrideRetentionDays != null) {
      purge = deleteRunsStartedBefore(pipeline,
        Retention.cutoff(System.currentTimeMillis(), overrideRetentionDays));
    } else {
      purge = settingsStore().getSettings(pipeline).flatMap(settings ->
        deleteRunsStartedBefore(pipeline, Retention.cutoff(System.currentTimeMillis(),
          Retention.resolveDays(null, settings))));
    }
    return purge.map(deleted -> {
      LOG.info("Purged {} runs of pipeline {}", deleted, pipeline);
      return deleted;
    });
  }

  /** Deletes runs of the pipeline with a start time before {@code cutoff}, returning the count. */
  protected abstract Call<Integer> deleteRunsStartedBefore(String pipeline, long cutoff);

  public static abstract class Builder {
    public abstract StorageComponent build();
  }
}
