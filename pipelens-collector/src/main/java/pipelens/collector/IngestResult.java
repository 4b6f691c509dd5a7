/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import pipelens.internal.Nullable;

/**
 * Outcome of one ingestion request. The {@link #code()} is the HTTP status a server should answer
 * with: 201 when a run or step was started, 200 for other successes, 400 for invalid documents and
 * 500 when storage failed.
 */
// @Immutable
public final class IngestResult {
  static final IngestResult OK = new IngestResult(200, null);
  static final IngestResult CREATED = new IngestResult(201, null);

  static IngestResult invalid(String error) {
    return new IngestResult(400, error);
  }

  static IngestResult failed(String error) {
    return new IngestResult(500, error);
  }

  final int code;
  @Nullable final String error;

  IngestResult(int code, @Nullable String error) {
    this.code = code;
    this.error = error;
  }

  public boolean success() {
    return error == null;
  }

  public int code() {
    return code;
  }

  /** Why the request failed, or null on success. */
  @Nullable public String error() {
    return error;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof IngestResult)) return false;
    IngestResult that = (IngestResult) o;
    return code == that.code && (error == null ? that.error == null : error.equals(that.error));
  }

  @Override public int hashCode() {
    return 31 * code + (error == null ? 0 : error.hashCode());
  }

  @Override public String toString() {
    return success() ? "IngestResult{code=" + code + "}"
      : "IngestResult{code=" + code + ", error=" + error + "}";
  }
}
