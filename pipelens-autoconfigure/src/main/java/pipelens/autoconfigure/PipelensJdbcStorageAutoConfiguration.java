/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import pipelens.storage.StorageComponent;
import pipelens.storage.jdbc.JdbcStorage;

/**
 * Pools connections with HikariCP unless a {@link DataSource} is already defined. Tables are
 * created on first use.
 */
@Configuration
@EnableConfigurationProperties(PipelensJdbcStorageProperties.class)
@ConditionalOnProperty(name = "pipelens.storage.type", havingValue = "jdbc")
@ConditionalOnClass(name = "pipelens.storage.jdbc.JdbcStorage")
@ConditionalOnMissingBean(StorageComponent.class)
public class PipelensJdbcStorageAutoConfiguration {

  @Bean @ConditionalOnMissingBean(DataSource.class)
  DataSource pipelensDataSource(PipelensJdbcStorageProperties jdbc) {
    return jdbc.toDataSource();
  }

  @Bean StorageComponent storage(PipelensJdbcStorageProperties jdbc, DataSource dataSource) {
    return JdbcStorage.newBuilder()
      .datasource(dataSource)
      .dialect(jdbc.dialect())
      .build();
  }
}
