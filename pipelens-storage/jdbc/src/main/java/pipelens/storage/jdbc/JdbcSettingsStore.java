/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import java.nio.charset.StandardCharsets;
import pipelens.Call;
import pipelens.codec.JsonCodec;
import pipelens.storage.PipelineSettings;
import pipelens.storage.SettingsStore;

import static pipelens.storage.jdbc.Schema.SETTINGS;

final class JdbcSettingsStore implements SettingsStore {
  final JdbcStorage storage;

  JdbcSettingsStore(JdbcStorage storage) {
    this.storage = storage;
  }

  @Override public Call<PipelineSettings> getSettings(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return storage.call(context -> {
      String json = context.select(SETTINGS.SETTINGS).from(SETTINGS)
        .where(SETTINGS.PIPELINE_NAME.eq(pipeline))
        .fetchOne(SETTINGS.SETTINGS);
      if (json == null) return PipelineSettings.EMPTY;
      return JsonCodec.readSettings(json.getBytes(StandardCharsets.UTF_8));
    });
  }

  @Override public Call<Void> saveSettings(String pipeline, PipelineSettings settings) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (settings == null) throw new NullPointerException("settings == null");
    String json = new String(JsonCodec.writeSettings(settings), StandardCharsets.UTF_8);
    return storage.call(context -> {
      context.insertInto(SETTINGS)
        .set(SETTINGS.PIPELINE_NAME, pipeline)
        .set(SETTINGS.SETTINGS, json)
        .onConflict(SETTINGS.PIPELINE_NAME)
        .doUpdate()
        .set(SETTINGS.SETTINGS, json)
        .execute();
      return null;
    });
  }
}
