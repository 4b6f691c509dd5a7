/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import pipelens.storage.StorageComponent;

/** Connects lazily, so the context starts even when Redis is down. */
@Configuration
@EnableConfigurationProperties(PipelensRedisStorageProperties.class)
@ConditionalOnProperty(name = "pipelens.storage.type", havingValue = "redis")
@ConditionalOnClass(name = "pipelens.storage.redis.RedisStorage")
@ConditionalOnMissingBean(StorageComponent.class)
public class PipelensRedisStorageAutoConfiguration {

  @Bean StorageComponent storage(PipelensRedisStorageProperties redis) {
    return redis.toBuilder().build();
  }
}
