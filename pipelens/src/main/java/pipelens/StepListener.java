/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

/**
 * Receives lifecycle events of a step tree. Listeners are invoked on the thread running the step,
 * so they should not block for long. Exceptions thrown here are logged and never reach the step.
 */
@FunctionalInterface
public interface StepListener {
  void onEvent(StepEvent event);
}
