/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.context.PropertyPlaceholderAutoConfiguration;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import pipelens.exporter.HttpExporter;

import static org.assertj.core.api.Assertions.assertThat;

class PipelensExporterAutoConfigurationTest {
  AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();

  @AfterEach void close() {
    context.close();
  }

  void refresh(String... pairs) {
    TestPropertyValues.of(pairs).applyTo(context);
    context.register(PropertyPlaceholderAutoConfiguration.class,
      PipelensExporterAutoConfiguration.class);
    context.refresh();
  }

  @Test void offWithoutBaseUrl() {
    refresh();

    assertThat(context.getBeanNamesForType(HttpExporter.class)).isEmpty();
  }

  @Test void bindsSettings() {
    refresh("pipelens.exporter.base-url:http://127.0.0.1:3000",
      "pipelens.exporter.batched:true",
      "pipelens.exporter.flush-interval:10s",
      "pipelens.exporter.max-batch-size:5",
      "pipelens.exporter.max-retries:0");

    PipelensExporterProperties exporter = context.getBean(PipelensExporterProperties.class);
    assertThat(exporter.isBatched()).isTrue();
    assertThat(exporter.getFlushInterval()).isEqualTo(Duration.ofSeconds(10));
    assertThat(exporter.getMaxBatchSize()).isEqualTo(5);
    assertThat(exporter.getMaxRetries()).isZero();
    assertThat(exporter.getInitialBackoff()).isEqualTo(Duration.ofSeconds(1));
    assertThat(context.getBean(HttpExporter.class).queuedEvents()).isZero();
  }

  @Test void closedWithContext() {
    refresh("pipelens.exporter.base-url:http://127.0.0.1:3000");
    HttpExporter exporter = context.getBean(HttpExporter.class);

    context.close();

    assertThat(exporter.check().ok()).isFalse();
  }
}
