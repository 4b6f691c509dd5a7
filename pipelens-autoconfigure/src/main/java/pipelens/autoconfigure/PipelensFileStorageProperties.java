/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import pipelens.storage.file.FileStorage;

@ConfigurationProperties("pipelens.storage.file")
public class PipelensFileStorageProperties {
  /** Directory holding pipelines, runs and timeseries. Created on first write. */
  private String path = "pipelens-data";

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public FileStorage.Builder toBuilder() {
    return FileStorage.newBuilder().basePath(path);
  }
}
