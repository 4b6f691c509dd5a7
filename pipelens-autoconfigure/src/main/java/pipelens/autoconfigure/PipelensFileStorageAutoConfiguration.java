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
import pipelens.storage.file.FileStorage;

@Configuration
@EnableConfigurationProperties(PipelensFileStorageProperties.class)
@ConditionalOnProperty(name = "pipelens.storage.type", havingValue = "file")
@ConditionalOnClass(name = "pipelens.storage.file.FileStorage")
@ConditionalOnMissingBean(StorageComponent.class)
public class PipelensFileStorageAutoConfiguration {

  @Bean StorageComponent storage(PipelensFileStorageProperties file) {
    return file.toBuilder().build();
  }
}
