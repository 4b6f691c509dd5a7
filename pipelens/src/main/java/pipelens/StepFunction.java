/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

/**
 * Body of a tracked step. The step passed in is the current context: use it to record values or
 * to track nested steps.
 */
@FunctionalInterface
public interface StepFunction<T> {
  T apply(Step step) throws Exception;
}
