/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.util.Locale;

/** Status of a pipeline run, serialized in lower case. */
public enum RunStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  final String value = name().toLowerCase(Locale.ROOT);

  /** The serialized form, such as "running". */
  public String value() {
    return value;
  }

  /** Parses the serialized form case-insensitively. */
  public static RunStatus fromValue(String value) {
    if (value == null) throw new NullPointerException("value == null");
    for (RunStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) return status;
    }
    throw new ValidationException("Unknown run status: " + value);
  }
}
