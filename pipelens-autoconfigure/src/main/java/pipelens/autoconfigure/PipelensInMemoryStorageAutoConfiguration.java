/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import pipelens.storage.InMemoryStorage;
import pipelens.storage.StorageComponent;

/** Used when "pipelens.storage.type" is "mem" or unset. */
@Configuration
@ConditionalOnProperty(name = "pipelens.storage.type", havingValue = "mem", matchIfMissing = true)
@ConditionalOnMissingBean(StorageComponent.class)
public class PipelensInMemoryStorageAutoConfiguration {

  @Bean StorageComponent storage(
    @Value("${pipelens.storage.mem.max-run-count:10000}") int maxRunCount) {
    return InMemoryStorage.newBuilder().maxRunCount(maxRunCount).build();
  }
}
