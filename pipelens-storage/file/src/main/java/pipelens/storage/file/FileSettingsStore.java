/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.file;

import java.nio.file.Path;
import pipelens.Call;
import pipelens.codec.JsonCodec;
import pipelens.internal.SupplierCall;
import pipelens.storage.PipelineSettings;
import pipelens.storage.SettingsStore;

final class FileSettingsStore implements SettingsStore {
  final FileStorage storage;
  final FileLayout layout;

  FileSettingsStore(FileStorage storage) {
    this.storage = storage;
    this.layout = storage.layout;
  }

  @Override public Call<PipelineSettings> getSettings(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return SupplierCall.of("getSettings", () -> {
      Path file = layout.settings(pipeline);
      byte[] content = FileLayout.read(file);
      if (content == null) return PipelineSettings.EMPTY;
      return FileLayout.decode(file, content, JsonCodec::readSettings);
    });
  }

  @Override public Call<Void> saveSettings(String pipeline, PipelineSettings settings) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (settings == null) throw new NullPointerException("settings == null");
    return SupplierCall.of("saveSettings", () -> {
      storage.connect();
      FileLayout.write(layout.settings(pipeline), JsonCodec.writeSettings(settings));
      return null;
    });
  }
}
