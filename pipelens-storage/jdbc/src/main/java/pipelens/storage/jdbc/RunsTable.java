/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import org.jooq.Record;
import org.jooq.TableField;
import org.jooq.impl.TableImpl;

import static org.jooq.impl.DSL.name;
import static org.jooq.impl.SQLDataType.BIGINT;
import static org.jooq.impl.SQLDataType.VARCHAR;

/** One row per run, keyed by run ID. */
final class RunsTable extends TableImpl<Record> {
  static final long serialVersionUID = 1L;

  final TableField<Record, String> RUN_ID = createField(name("run_id"), VARCHAR(255).notNull());
  final TableField<Record, String> PIPELINE_NAME =
    createField(name("pipeline_name"), VARCHAR(255).notNull());
  final TableField<Record, Long> START_TIME = createField(name("start_time"), BIGINT.notNull());
  final TableField<Record, Long> END_TIME = createField(name("end_time"), BIGINT.null_());
  final TableField<Record, Long> DURATION = createField(name("duration"), BIGINT.null_());
  final TableField<Record, String> STATUS = createField(name("status"), VARCHAR(16).notNull());

  RunsTable() {
    super(name("runs"));
  }
}
