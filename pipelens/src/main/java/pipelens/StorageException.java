/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.io.IOException;

/** Raised when a storage backend fails to read or write, for example on a SQL or I/O error. */
public class StorageException extends IOException {
  static final long serialVersionUID = 1L;

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
