/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.exporter;

import java.io.IOException;

/** Raised when the collector cannot be reached or answers with a non-2xx status. */
public final class TransportException extends IOException {
  static final long serialVersionUID = 1L;

  final int code;

  TransportException(String message, int code) {
    super(message);
    this.code = code;
  }

  TransportException(String message, Throwable cause) {
    super(message, cause);
    this.code = -1;
  }

  /** The HTTP status code, or -1 when no response was received. */
  public int code() {
    return code;
  }
}
