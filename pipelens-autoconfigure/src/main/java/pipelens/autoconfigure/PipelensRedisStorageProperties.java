/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import pipelens.storage.redis.RedisStorage;

@ConfigurationProperties("pipelens.storage.redis")
public class PipelensRedisStorageProperties {
  private String url = "redis://localhost:6379";

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public RedisStorage.Builder toBuilder() {
    return RedisStorage.newBuilder().url(url);
  }
}
