/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import java.io.IOException;
import pipelens.Call;
import pipelens.Callback;

/** Ensures tables exist before the delegate runs. */
final class ConnectingCall<V> extends Call.Base<V> {
  final JdbcStorage storage;
  final Call<V> delegate;

  ConnectingCall(JdbcStorage storage, Call<V> delegate) {
    this.storage = storage;
    this.delegate = delegate;
  }

  @Override protected V doExecute() throws IOException {
    storage.connect();
    return delegate.execute();
  }

  @Override protected void doEnqueue(Callback<V> callback) {
    try {
      storage.connect();
    } catch (IOException | RuntimeException e) {
      callback.onError(e);
      return;
    }
    delegate.enqueue(callback);
  }

  @Override public Call<V> clone() {
    return new ConnectingCall<>(storage, delegate.clone());
  }

  @Override public String toString() {
    return delegate.toString();
  }
}
