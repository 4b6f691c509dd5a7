/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.internal;

/** Thrown when a storage component or exporter is used after it was closed. */
public final class ClosedComponentException extends IllegalStateException {
  static final long serialVersionUID = -4636520624634625689L;

  public ClosedComponentException() {
    this(null);
  }

  public ClosedComponentException(String message) {
    super(message != null ? message : "closed");
  }
}
