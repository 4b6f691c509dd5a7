/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import pipelens.internal.Nullable;

/**
 * A callback of a single result or error.
 *
 * <p>Implementations will call either {@link #onSuccess} or {@link #onError}, but not both.
 */
public interface Callback<V> {

  /** Invoked when computation produces its potentially null value successfully. */
  void onSuccess(@Nullable V value);

  /** Invoked when computation fails. When this is called, {@link #onSuccess} won't be. */
  void onError(Throwable t);
}
