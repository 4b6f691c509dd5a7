/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.internal;

import java.io.IOException;
import pipelens.Call;

/**
 * Defers blocking work, such as reading a file or a redis key, until {@link #execute()}. {@link
 * #enqueue} runs the work on the calling thread.
 */
public final class SupplierCall<V> extends Call.Base<V> {
  public interface Supplier<V> {
    V get() throws IOException;
  }

  public static <V> Call<V> of(String name, Supplier<V> supplier) {
    if (name == null) throw new NullPointerException("name == null");
    if (supplier == null) throw new NullPointerException("supplier == null");
    return new SupplierCall<>(name, supplier);
  }

  final String name;
  final Supplier<V> supplier;

  SupplierCall(String name, Supplier<V> supplier) {
    this.name = name;
    this.supplier = supplier;
  }

  @Override protected V doExecute() throws IOException {
    return supplier.get();
  }

  @Override public Call<V> clone() {
    return new SupplierCall<>(name, supplier);
  }

  @Override public String toString() {
    return "SupplierCall{" + name + "}";
  }
}
