/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.autoconfigure;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import pipelens.exporter.HttpExporter;

/** Settings of the exporter posting step events to a remote collector. */
@ConfigurationProperties("pipelens.exporter")
public class PipelensExporterProperties {
  /** Collector base URL, such as "http://localhost:3000". The exporter is off when unset. */
  private String baseUrl;
  private boolean batched;
  private Duration flushInterval = Duration.ofSeconds(3);
  private int maxBatchSize = 100;
  private int maxRetries = 3;
  private Duration initialBackoff = Duration.ofSeconds(1);

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = "".equals(baseUrl) ? null : baseUrl;
  }

  public boolean isBatched() {
    return batched;
  }

  public void setBatched(boolean batched) {
    this.batched = batched;
  }

  public Duration getFlushInterval() {
    return flushInterval;
  }

  public void setFlushInterval(Duration flushInterval) {
    this.flushInterval = flushInterval;
  }

  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public void setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public HttpExporter.Builder toBuilder() {
    return HttpExporter.newBuilder()
      .baseUrl(baseUrl)
      .batched(batched)
      .flushInterval(flushInterval)
      .maxBatchSize(maxBatchSize)
      .maxRetries(maxRetries)
      .initialBackoff(initialBackoff);
  }
}
