/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

/** Thrown when a run is requested that was never stored. */
public class NotFoundException extends RuntimeException {
  static final long serialVersionUID = 1L;

  public NotFoundException(String message) {
    super(message);
  }
}
