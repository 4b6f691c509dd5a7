/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.io.Closeable;
import java.io.IOException;

/**
 * Components are object graphs used to compose a pipelens deployment: storage backends, the
 * exporter and the collector.
 *
 * <p>Components are lazy with regards to I/O. They can be injected directly to other components
 * without crashing the application graph if a database or collector is unavailable.
 */
public abstract class Component implements Closeable {

  /**
   * Answers the question: Are operations on this component likely to succeed?
   *
   * <p>Implementations should initialize the component if necessary, then test the connection or
   * directory they depend on. This is safe to call many times, even concurrently.
   *
   * @see CheckResult#OK
   */
  public CheckResult check() {
    return CheckResult.OK;
  }

  /** Releases resources created implicitly by the component, such as connection pools. */
  @Override public void close() throws IOException {
  }
}
