/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import org.jooq.DSLContext;

import static org.jooq.impl.DSL.constraint;

/**
 * Tables used by {@link JdbcStorage}. {@link #create} is idempotent.
 *
 * <p>Steps have no foreign key to runs: a step may be written before its run, for example when
 * importing. Purging deletes steps explicitly.
 */
final class Schema {
  static final RunsTable RUNS = new RunsTable();
  static final StepsTable STEPS = new StepsTable();
  static final SettingsTable SETTINGS = new SettingsTable();

  static void create(DSLContext context) {
    context.createTableIfNotExists(RUNS)
      .columns(RUNS.fields())
      .constraints(constraint("pk_runs").primaryKey(RUNS.RUN_ID))
      .execute();
    context.createIndexIfNotExists("idx_runs_pipeline_start")
      .on(RUNS, RUNS.PIPELINE_NAME, RUNS.START_TIME)
      .execute();

    context.createTableIfNotExists(STEPS)
      .columns(STEPS.fields())
      .constraints(constraint("pk_steps").primaryKey(STEPS.RUN_ID, STEPS.KEY))
      .execute();
    context.createIndexIfNotExists("idx_steps_pipeline_name")
      .on(STEPS, STEPS.PIPELINE_NAME, STEPS.NAME)
      .execute();
    context.createIndexIfNotExists("idx_steps_end_time")
      .on(STEPS, STEPS.END_TIME)
      .execute();

    context.createTableIfNotExists(SETTINGS)
      .columns(SETTINGS.fields())
      .constraints(constraint("pk_pipeline_settings").primaryKey(SETTINGS.PIPELINE_NAME))
      .execute();
  }

  static void clear(DSLContext context) {
    context.deleteFrom(STEPS).execute();
    context.deleteFrom(RUNS).execute();
    context.deleteFrom(SETTINGS).execute();
  }

  Schema() {
  }
}
