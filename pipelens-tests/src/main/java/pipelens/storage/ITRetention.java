/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import pipelens.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static pipelens.TestObjects.DAY;
import static pipelens.TestObjects.NOW;
import static pipelens.TestObjects.run;

/**
 * Base test for {@link StorageComponent#purgeOldData}.
 *
 * <p>Subtypes should create a connection to a real backend, even if that backend is in-process.
 */
public abstract class ITRetention<T extends StorageComponent> extends ITStorage<T> {

  @Test void purge_withOverride() throws IOException {
    accept(run("etl", "old", NOW - 10 * DAY, 1, 1));
    accept(run("etl", "new", NOW - DAY, 1, 1));

    assertThat(storage.purgeOldData("etl", 5).execute()).isEqualTo(1);

    assertThat(store().listRuns("etl", RunQuery.ALL).execute())
      .extracting(pipelens.RunMeta::runId).containsExactly("new");
    assertThat(store().listRunSteps("old").execute()).isEmpty();
    assertThat(store().getPipelineStepTimeseries("etl", "load",
      TimeRange.create(NOW - 30 * DAY, NOW)).execute())
      .extracting(StepTimeseriesEntry::runId).containsExactly("new");
  }

  @Test void purge_usesSavedSetting() throws IOException {
    settings().saveSettings("etl", PipelineSettings.newBuilder().retentionDays(3).build())
      .execute();
    accept(run("etl", "old", NOW - 4 * DAY, 1, 1));
    accept(run("etl", "new", NOW - 2 * DAY, 1, 1));

    assertThat(storage.purgeOldData("etl", null).execute()).isEqualTo(1);
    assertThat(store().listRuns("etl", RunQuery.ALL).execute())
      .extracting(pipelens.RunMeta::runId).containsExactly("new");
  }

  @Test void purge_defaultsToFourteenDays() throws IOException {
    accept(run("etl", "old", NOW - 15 * DAY, 1, 1));
    accept(run("etl", "new", NOW - 13 * DAY, 1, 1));

    assertThat(storage.purgeOldData("etl", null).execute()).isEqualTo(1);
    assertThat(store().listRuns("etl", RunQuery.ALL).execute())
      .extracting(pipelens.RunMeta::runId).containsExactly("new");
  }

  @Test void purge_onlyTouchesNamedPipeline() throws IOException {
    accept(run("etl", "r1", NOW - 20 * DAY, 1, 1));
    accept(run("other", "r2", NOW - 20 * DAY, 1, 1));

    assertThat(storage.purgeOldData("etl", 1).execute()).isEqualTo(1);
    assertThat(store().listRuns("other", RunQuery.ALL).execute()).hasSize(1);
  }

  @Test void purge_nothingToDelete() throws IOException {
    assertThat(storage.purgeOldData("etl", 1).execute()).isZero();
  }

  @Test void purge_rejectsNonPositiveDays() {
    assertThatThrownBy(() -> storage.purgeOldData("etl", 0))
      .isInstanceOf(ValidationException.class);
  }
}
