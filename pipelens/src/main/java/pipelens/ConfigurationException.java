/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

/**
 * Thrown at construction when a component is configured inconsistently, such as a {@link
 * Pipeline} which saves automatically but has no {@link pipelens.storage.StepConsumer}.
 */
public class ConfigurationException extends IllegalStateException {
  static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }
}
