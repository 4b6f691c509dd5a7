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
import pipelens.exporter.HttpExporter;

/**
 * Defines an {@link HttpExporter} when "pipelens.exporter.base-url" is set. Queued events are sent
 * when the context closes.
 */
@Configuration
@EnableConfigurationProperties(PipelensExporterProperties.class)
@ConditionalOnProperty(name = "pipelens.exporter.base-url")
@ConditionalOnClass(name = "pipelens.exporter.HttpExporter")
@ConditionalOnMissingBean(HttpExporter.class)
public class PipelensExporterAutoConfiguration {

  @Bean(destroyMethod = "close") HttpExporter httpExporter(PipelensExporterProperties exporter) {
    return exporter.toBuilder().build();
  }
}
