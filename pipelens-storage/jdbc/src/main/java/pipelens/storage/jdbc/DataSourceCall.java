/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import javax.sql.DataSource;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import pipelens.Call;
import pipelens.Callback;
import pipelens.StorageException;

/** Uncancelable call built with an executor */
final class DataSourceCall<V> extends Call.Base<V> {

  static final class Factory {
    final DataSource datasource;
    final DSLContexts context;
    final Executor executor;

    Factory(DataSource datasource, DSLContexts context, Executor executor) {
      this.datasource = datasource;
      this.context = context;
      this.executor = executor;
    }

    <V> DataSourceCall<V> create(Function<DSLContext, V> queryFunction) {
      return new DataSourceCall<>(this, queryFunction);
    }
  }

  final Factory factory;
  final Function<DSLContext, V> queryFunction;

  DataSourceCall(Factory factory, Function<DSLContext, V> queryFunction) {
    this.factory = factory;
    this.queryFunction = queryFunction;
  }

  @Override protected V doExecute() throws IOException {
    try (Connection conn = factory.datasource.getConnection()) {
      return queryFunction.apply(factory.context.get(conn));
    } catch (SQLException | DataAccessException e) {
      throw new StorageException(queryFunction + " failed: " + e.getMessage(), e);
    }
  }

  @Override protected void doEnqueue(Callback<V> callback) {
    factory.executor.execute(() -> {
      try {
        callback.onSuccess(doExecute());
      } catch (Throwable t) {
        propagateIfFatal(t);
        callback.onError(t);
      }
    });
  }

  @Override public String toString() {
    return queryFunction.toString();
  }

  @Override public Call<V> clone() {
    return new DataSourceCall<>(factory, queryFunction);
  }
}
