/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jooq.DSLContext;
import org.jooq.Query;
import org.jooq.Record;
import org.jooq.TableField;
import org.jooq.impl.DSL;
import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.storage.StepConsumer;

import static pipelens.storage.jdbc.Schema.RUNS;
import static pipelens.storage.jdbc.Schema.STEPS;

final class JdbcStepConsumer implements StepConsumer {
  final JdbcStorage storage;

  JdbcStepConsumer(JdbcStorage storage) {
    this.storage = storage;
  }

  @Override public Call<Void> initiateRun(PipelineMeta pipelineMeta) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    return storage.call(new UpsertRun(RunMeta.running(pipelineMeta), List.of()));
  }

  /** Replaces the run's row and upserts every step, in one transaction. */
  @Override public Call<Void> finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    if (pipelineMeta == null) throw new NullPointerException("pipelineMeta == null");
    if (status == null) throw new NullPointerException("status == null");
    return storage.call(new UpsertRun(RunMeta.finished(pipelineMeta, status),
      pipelineMeta.steps()));
  }

  @Override public Call<Void> initiateStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return storage.call(new UpsertStep(runId, step));
  }

  @Override public Call<Void> finishStep(String runId, StepMeta step) {
    checkStep(runId, step);
    return storage.call(new UpsertStep(runId, step));
  }

  static void checkStep(String runId, StepMeta step) {
    if (runId == null) throw new NullPointerException("runId == null");
    if (step == null) throw new NullPointerException("step == null");
  }

  static final class UpsertRun implements Function<DSLContext, Void> {
    final RunMeta run;
    final List<StepMeta> steps;

    UpsertRun(RunMeta run, List<StepMeta> steps) {
      this.run = run;
      this.steps = steps;
    }

    @Override public Void apply(DSLContext context) {
      Map<TableField<Record, ?>, Object> values = new LinkedHashMap<>();
      values.put(RUNS.RUN_ID, run.runId());
      values.put(RUNS.PIPELINE_NAME, run.pipeline());
      values.put(RUNS.START_TIME, run.startTime());
      values.put(RUNS.END_TIME, run.endTime());
      values.put(RUNS.DURATION, run.duration());
      values.put(RUNS.STATUS, run.status().value());

      context.transaction(configuration -> {
        DSLContext tx = DSL.using(configuration);
        tx.insertInto(RUNS).set(values)
          .onConflict(RUNS.RUN_ID).doUpdate().set(values)
          .execute();
        for (StepMeta step : steps) {
          upsertStep(tx, run.runId(), run.pipeline(), step).execute();
        }
      });
      return null;
    }

    @Override public String toString() {
      return "UpsertRun{runId=" + run.runId() + ", steps=" + steps.size() + "}";
    }
  }

  static final class UpsertStep implements Function<DSLContext, Void> {
    final String runId;
    final StepMeta step;

    UpsertStep(String runId, StepMeta step) {
      this.runId = runId;
      this.step = step;
    }

    @Override public Void apply(DSLContext context) {
      String pipeline = context.select(RUNS.PIPELINE_NAME).from(RUNS)
        .where(RUNS.RUN_ID.eq(runId))
        .fetchOne(RUNS.PIPELINE_NAME);
      if (pipeline == null) pipeline = keyPrefix(step);
      upsertStep(context, runId, pipeline, step).execute();
      return null;
    }

    @Override public String toString() {
      return "UpsertStep{runId=" + runId + ", key=" + step.key() + "}";
    }
  }

  static Query upsertStep(DSLContext context, String runId, String pipeline, StepMeta step) {
    Map<TableField<Record, ?>, Object> values = new LinkedHashMap<>();
    values.put(STEPS.RUN_ID, runId);
    values.put(STEPS.KEY, step.key());
    values.put(STEPS.PIPELINE_NAME, pipeline);
    values.put(STEPS.NAME, step.name());
    values.put(STEPS.START_TIME, step.time().startTs());
    values.put(STEPS.END_TIME, step.time().endTs());
    values.put(STEPS.TIME_USAGE_MS, step.time().timeUsageMs());
    ObjectNode records = JsonCodec.MAPPER.createObjectNode();
    records.setAll(step.records());
    values.put(STEPS.RECORDS, records.toString());
    values.put(STEPS.RESULT, step.result() != null ? step.result().toString() : null);
    values.put(STEPS.ERROR, step.error());
    return context.insertInto(STEPS).set(values)
      .onConflict(STEPS.RUN_ID, STEPS.KEY).doUpdate().set(values);
  }

  /** Steps written before their run fall back to the first segment of their key. */
  static String keyPrefix(StepMeta step) {
    int dot = step.key().indexOf('.');
    return dot == -1 ? step.key() : step.key().substring(0, dot);
  }
}
