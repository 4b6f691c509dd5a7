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
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.ExecuteListenerProvider;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.CheckResult;
import pipelens.StorageException;
import pipelens.internal.Nullable;
import pipelens.storage.SettingsStore;
import pipelens.storage.StepConsumer;
import pipelens.storage.StepStore;
import pipelens.storage.StorageComponent;

import static pipelens.storage.jdbc.Schema.RUNS;
import static pipelens.storage.jdbc.Schema.STEPS;

/**
 * Stores runs in a relational database through jOOQ. Tables are created on {@link #connect()} when
 * missing.
 *
 * <p>Ex.
 * <pre>{@code
 * JdbcStorage storage = JdbcStorage.newBuilder()
 *   .datasource(dataSource)
 *   .dialect(SQLDialect.POSTGRES)
 *   .build();
 * }</pre>
 */
public final class JdbcStorage extends StorageComponent {
  static final Logger LOG = LoggerFactory.getLogger(JdbcStorage.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends StorageComponent.Builder {
    DataSource datasource;
    SQLDialect dialect = SQLDialect.SQLITE;
    Settings settings = new Settings().withRenderSchema(false);
    ExecuteListenerProvider listenerProvider;
    Executor executor = Runnable::run;

    public Builder datasource(DataSource datasource) {
      if (datasource == null) throw new NullPointerException("datasource == null");
      this.datasource = datasource;
      return this;
    }

    /** Defaults to {@link SQLDialect#SQLITE}. */
    public Builder dialect(SQLDialect dialect) {
      if (dialect == null) throw new NullPointerException("dialect == null");
      this.dialect = dialect;
      return this;
    }

    public Builder settings(Settings settings) {
      if (settings == null) throw new NullPointerException("settings == null");
      this.settings = settings;
      return this;
    }

    public Builder listenerProvider(@Nullable ExecuteListenerProvider listenerProvider) {
      this.listenerProvider = listenerProvider;
      return this;
    }

    /** Runs enqueued calls. Defaults to the calling thread. */
    public Builder executor(Executor executor) {
      if (executor == null) throw new NullPointerException("executor == null");
      this.executor = executor;
      return this;
    }

    @Override public JdbcStorage build() {
      return new JdbcStorage(this);
    }

    Builder() {
    }
  }

  static {
    System.setProperty("org.jooq.no-logo", "true");
    System.setProperty("org.jooq.no-tips", "true");
  }

  final DataSource datasource;
  final DSLContexts context;
  final DataSourceCall.Factory dataSourceCallFactory;
  final JdbcStepConsumer stepConsumer;
  final JdbcStepStore stepStore;
  final JdbcSettingsStore settingsStore;
  volatile boolean connected;

  JdbcStorage(Builder builder) {
    datasource = builder.datasource;
    if (datasource == null) throw new NullPointerException("datasource == null");
    context = new DSLContexts(builder.dialect, builder.settings, builder.listenerProvider);
    dataSourceCallFactory = new DataSourceCall.Factory(datasource, context, builder.executor);
    stepConsumer = new JdbcStepConsumer(this);
    stepStore = new JdbcStepStore(this);
    settingsStore = new JdbcSettingsStore(this);
  }

  /** Returns the data source in use by this storage component. */
  public DataSource datasource() {
    return datasource;
  }

  @Override public void connect() throws IOException {
    if (connected) return;
    synchronized (this) {
      if (connected) return;
      try (Connection conn = datasource.getConnection()) {
        Schema.create(context.get(conn));
      } catch (SQLException | DataAccessException e) {
        throw new StorageException("Could not create tables: " + e.getMessage(), e);
      }
      connected = true;
    }
    LOG.info("Connected to {} database", context.dialect);
  }

  /** Creates tables if needed, then returns a call for the query. */
  <V> Call<V> call(Function<DSLContext, V> queryFunction) {
    return new ConnectingCall<>(this, dataSourceCallFactory.create(queryFunction));
  }

  @Override public StepConsumer stepConsumer() {
    return stepConsumer;
  }

  @Override public StepStore stepStore() {
    return stepStore;
  }

  @Override public SettingsStore settingsStore() {
    return settingsStore;
  }

  @Override public CheckResult check() {
    try (Connection conn = datasource.getConnection()) {
      context.get(conn).selectOne().execute();
    } catch (SQLException | RuntimeException e) {
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override protected Call<Integer> deleteRunsStartedBefore(String pipeline, long cutoff) {
    return call(new DeleteRuns(pipeline, cutoff));
  }

  static final class DeleteRuns implements Function<DSLContext, Integer> {
    final String pipeline;
    final long cutoff;

    DeleteRuns(String pipeline, long cutoff) {
      this.pipeline = pipeline;
      this.cutoff = cutoff;
    }

    @Override public Integer apply(DSLContext context) {
      Condition expired = RUNS.PIPELINE_NAME.eq(pipeline).and(RUNS.START_TIME.lt(cutoff));
      return context.transactionResult(configuration -> {
        DSLContext tx = DSL.using(configuration);
        tx.deleteFrom(STEPS)
          .where(STEPS.RUN_ID.in(DSL.select(RUNS.RUN_ID).from(RUNS).where(expired)))
          .execute();
        return tx.deleteFrom(RUNS).where(expired).execute();
      });
    }

    @Override public String toString() {
      return "DeleteRuns{pipeline=" + pipeline + ", cutoff=" + cutoff + "}";
    }
  }

  /** Deletes all rows. Visible for testing */
  public void clear() throws IOException {
    connect();
    try (Connection conn = datasource.getConnection()) {
      Schema.clear(context.get(conn));
    } catch (SQLException | DataAccessException e) {
      throw new StorageException("Could not clear tables", e);
    }
  }

  @Override public void close() {
    // didn't open the DataSource or executor
  }

  @Override public String toString() {
    return "JdbcStorage{dialect=" + context.dialect + "}";
  }
}
