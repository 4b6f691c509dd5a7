/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import org.jooq.Record;
import org.jooq.TableField;
import org.jooq.impl.TableImpl;

import static org.jooq.impl.DSL.name;
import static org.jooq.impl.SQLDataType.CLOB;
import static org.jooq.impl.SQLDataType.VARCHAR;

/** Settings of a pipeline as a JSON document. */
final class SettingsTable extends TableImpl<Record> {
  static final long serialVersionUID = 1L;

  final TableField<Record, String> PIPELINE_NAME =
    createField(name("pipeline_name"), VARCHAR(255).notNull());
  final TableField<Record, String> SETTINGS = createField(name("settings"), CLOB.notNull());

  SettingsTable() {
    super(name("pipeline_settings"));
  }
}
