/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import java.sql.Connection;
import org.jooq.DSLContext;
import org.jooq.ExecuteListenerProvider;
import org.jooq.SQLDialect;
import org.jooq.conf.Settings;
import org.jooq.impl.DSL;
import org.jooq.impl.DefaultConfiguration;
import pipelens.internal.Nullable;

final class DSLContexts {
  final SQLDialect dialect;
  final Settings settings;
  @Nullable final ExecuteListenerProvider listenerProvider;

  DSLContexts(SQLDialect dialect, Settings settings,
    @Nullable ExecuteListenerProvider listenerProvider) {
    this.dialect = dialect;
    this.settings = settings;
    this.listenerProvider = listenerProvider;
  }

  DSLContext get(Connection conn) {
    DefaultConfiguration configuration = new DefaultConfiguration();
    configuration.set(conn).set(dialect).set(settings);
    if (listenerProvider != null) configuration.set(listenerProvider);
    return DSL.using(configuration);
  }
}
