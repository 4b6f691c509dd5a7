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
import static org.jooq.impl.SQLDataType.CLOB;
import static org.jooq.impl.SQLDataType.VARCHAR;

/**
 * One row per step, keyed by run ID and step key. The pipeline name is denormalized so timeseries
 * queries don't need a join, and so steps written before their run can still be found.
 */
final class StepsTable extends TableImpl<Record> {
  static final long serialVersionUID = 1L;

  final TableField<Record, String> RUN_ID = createField(name("run_id"), VARCHAR(255).notNull());
  final TableField<Record, String> KEY = createField(name("key"), VARCHAR(1024).notNull());
  final TableField<Record, String> PIPELINE_NAME =
    createField(name("pipeline_name"), VARCHAR(255).notNull());
  final TableField<Record, String> NAME = createField(name("name"), VARCHAR(255).notNull());
  final TableField<Record, Long> START_TIME = createField(name("start_time"), BIGINT.notNull());
  final TableField<Record, Long> END_TIME = createField(name("end_time"), BIGINT.null_());
  final TableField<Record, Long> TIME_USAGE_MS =
    createField(name("time_usage_ms"), BIGINT.null_());
  final TableField<Record, String> RECORDS = createField(name("records"), CLOB.null_());
  final TableField<Record, String> RESULT = createField(name("result"), CLOB.null_());
  final TableField<Record, String> ERROR = createField(name("error"), CLOB.null_());

  StepsTable() {
    super(name("steps"));
  }
}
