/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base test for {@link SettingsStore}.
 *
 * <p>Subtypes should create a connection to a real backend, even if that backend is in-process.
 */
public abstract class ITSettingsStore<T extends StorageComponent> extends ITStorage<T> {

  @Test void getSettings_defaultsToEmpty() throws IOException {
    assertThat(settings().getSettings("etl").execute()).isEqualTo(PipelineSettings.EMPTY);
  }

  @Test void saveSettings_roundTrips() throws IOException {
    PipelineSettings saved = PipelineSettings.newBuilder()
      .retentionDays(7)
      .addPresetColumn(PipelineSettings.PresetColumn.create("rows", "records.rows", "etl"))
      .putExtra("owner", TextNode.valueOf("data-team"))
      .build();
    settings().saveSettings("etl", saved).execute();

    assertThat(settings().getSettings("etl").execute()).isEqualTo(saved);
    assertThat(settings().getSettings("other").execute()).isEqualTo(PipelineSettings.EMPTY);
  }

  @Test void saveSettings_replaces() throws IOException {
    settings().saveSettings("etl", PipelineSettings.newBuilder().retentionDays(7).build())
      .execute();
    PipelineSettings replacement = PipelineSettings.newBuilder().retentionDays(30).build();
    settings().saveSettings("etl", replacement).execute();

    assertThat(settings().getSettings("etl").execute()).isEqualTo(replacement);
  }
}
