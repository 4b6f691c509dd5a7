/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import pipelens.Call;
import pipelens.codec.JsonCodec;
import pipelens.internal.SupplierCall;
import pipelens.storage.PipelineSettings;
import pipelens.storage.SettingsStore;

final class RedisSettingsStore implements SettingsStore {
  final RedisStorage storage;

  RedisSettingsStore(RedisStorage storage) {
    this.storage = storage;
  }

  @Override public Call<PipelineSettings> getSettings(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("getSettings", () -> {
      String json = storage.commands().get(RedisKeys.settings(pipeline));
      if (json == null) return PipelineSettings.EMPTY;
      return RedisStorage.decode(json, JsonCodec::readSettings);
    });
  }

  @Override public Call<Void> saveSettings(String pipeline, PipelineSettings settings) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (settings == null) throw new NullPointerException("settings == null");
    return SupplierCall.of("saveSettings", () -> {
      storage.commands().set(RedisKeys.settings(pipeline),
        RedisStorage.encode(JsonCodec.writeSettings(settings)));
      return null;
    });
  }
}
