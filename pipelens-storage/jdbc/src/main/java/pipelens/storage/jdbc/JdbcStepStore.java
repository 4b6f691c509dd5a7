/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.SelectSeekStep2;
import pipelens.Call;
import pipelens.NotFoundException;
import pipelens.RunData;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.TimeMeta;
import pipelens.codec.JsonCodec;
import pipelens.storage.RunQuery;
import pipelens.storage.StepStore;
import pipelens.storage.StepTimeseriesEntry;
import pipelens.storage.TimeRange;

import static org.jooq.impl.DSL.max;
import static pipelens.storage.jdbc.Schema.RUNS;
import static pipelens.storage.jdbc.Schema.STEPS;

final class JdbcStepStore implements StepStore {
  final JdbcStorage storage;

  JdbcStepStore(JdbcStorage storage) {
    this.storage = storage;
  }

  @Override public Call<List<String>> listPipelines() {
    return storage.call(new SelectPipelines());
  }

  @Override public Call<List<RunMeta>> listRuns(String pipeline, RunQuery request) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (request == null) throw new NullPointerException("request == null");
    return storage.call(new SelectRuns(pipeline, request));
  }

  @Override public Call<RunData> getRunData(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return storage.call(new SelectRunData(runId));
  }

  @Override public Call<List<StepMeta>> listRunSteps(String runId) {
    if (runId == null) throw new NullPointerException("runId == null");
    return storage.call(new SelectRunSteps(runId));
  }

  @Override public Call<List<StepTimeseriesEntry>> getPipelineStepTimeseries(String pipeline,
    String stepName, TimeRange range) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    if (stepName == null) throw new NullPointerException("stepName == null");
    if (range == null) throw new NullPointerException("range == null");
    return storage.call(new SelectTimeseries(pipeline, stepName, range));
  }

  @Override public Call<List<String>> listPipelineSteps(String pipeline) {
    if (pipeline == null) throw new NullPointerException("pipeline == null");
    return storage.call(new SelectStepNames(pipeline));
  }

  static final class SelectPipelines implements Function<DSLContext, List<String>> {
    @Override public List<String> apply(DSLContext context) {
      return context.select(RUNS.PIPELINE_NAME)
        .from(RUNS)
        .groupBy(RUNS.PIPELINE_NAME)
        .orderBy(max(RUNS.START_TIME).desc(), RUNS.PIPELINE_NAME.asc())
        .fetch(RUNS.PIPELINE_NAME);
    }

    @Override public String toString() {
      return "SelectPipelines{}";
    }
  }

  static final class SelectRuns implements Function<DSLContext, List<RunMeta>> {
    final String pipeline;
    final RunQuery request;

    SelectRuns(String pipeline, RunQuery request) {
      this.pipeline = pipeline;
      this.request = request;
    }

    @Override public List<RunMeta> apply(DSLContext context) {
      List<Condition> conditions = new ArrayList<>();
      conditions.add(RUNS.PIPELINE_NAME.eq(pipeline));
      if (request.status() != null) conditions.add(RUNS.STATUS.eq(request.status().value()));
      if (request.startDate() != null) conditions.add(RUNS.START_TIME.ge(request.startDate()));
      if (request.endDate() != null) conditions.add(RUNS.START_TIME.le(request.endDate()));

      SelectSeekStep2<Record, Long, String> ordered = context.selectFrom(RUNS)
        .where(conditions)
        .orderBy(RUNS.START_TIME.desc(), RUNS.RUN_ID.asc());
      List<Record> rows;
      if (request.limit() != null) {
        rows = ordered.limit(request.limit()).offset(request.offset()).fetch();
      } else if (request.offset() > 0) {
        rows = ordered.limit(Integer.MAX_VALUE).offset(request.offset()).fetch();
      } else {
        rows = ordered.fetch();
      }
      List<RunMeta> result = new ArrayList<>(rows.size());
      for (Record row : rows) result.add(toRunMeta(row));
      return result;
    }

    @Override public String toString() {
      return "SelectRuns{pipeline=" + pipeline + ", request=" + request + "}";
    }
  }

  static final class SelectRunData implements Function<DSLContext, RunData> {
    final String runId;

    SelectRunData(String runId) {
      this.runId = runId;
    }

    @Override public RunData apply(DSLContext context) {
      Record run = context.selectFrom(RUNS).where(RUNS.RUN_ID.eq(runId)).fetchOne();
      if (run == null) throw new NotFoundException("Run " + runId + " not found");
      return RunData.create(toRunMeta(run), new SelectRunSteps(runId).apply(context));
    }

    @Override public String toString() {
      return "SelectRunData{runId=" + runId + "}";
    }
  }

  static final class SelectRunSteps implements Function<DSLContext, List<StepMeta>> {
    final String runId;

    SelectRunSteps(String runId) {
      this.runId = runId;
    }

    @Override public List<StepMeta> apply(DSLContext context) {
      List<StepMeta> result = new ArrayList<>();
      for (Record row : context.selectFrom(STEPS)
        .where(STEPS.RUN_ID.eq(runId))
        .orderBy(STEPS.START_TIME.asc(), STEPS.KEY.asc())
        .fetch()) {
        result.add(toStepMeta(row));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectRunSteps{runId=" + runId + "}";
    }
  }

  static final class SelectTimeseries implements Function<DSLContext, List<StepTimeseriesEntry>> {
    final String pipeline, stepName;
    final TimeRange range;

    SelectTimeseries(String pipeline, String stepName, TimeRange range) {
      this.pipeline = pipeline;
      this.stepName = stepName;
      this.range = range;
    }

    @Override public List<StepTimeseriesEntry> apply(DSLContext context) {
      List<StepTimeseriesEntry> result = new ArrayList<>();
      for (Record row : context.selectFrom(STEPS)
        .where(STEPS.PIPELINE_NAME.eq(pipeline))
        .and(STEPS.NAME.eq(stepName))
        .and(STEPS.TIME_USAGE_MS.isNotNull())
        .and(STEPS.START_TIME.ge(range.start()))
        .and(STEPS.START_TIME.lt(range.end()))
        .orderBy(STEPS.START_TIME.asc(), STEPS.RUN_ID.asc())
        .fetch()) {
        StepMeta step = toStepMeta(row);
        result.add(StepTimeseriesEntry.of(row.get(STEPS.RUN_ID), step).withStepMeta(step));
      }
      return result;
    }

    @Override public String toString() {
      return "SelectTimeseries{pipeline=" + pipeline + ", stepName=" + stepName
        + ", range=" + range + "}";
    }
  }

  static final class SelectStepNames implements Function<DSLContext, List<String>> {
    final String pipeline;

    SelectStepNames(String pipeline) {
      this.pipeline = pipeline;
    }

    @Override public List<String> apply(DSLContext context) {
      return context.selectDistinct(STEPS.NAME)
        .from(STEPS)
        .where(STEPS.PIPELINE_NAME.eq(pipeline))
        .and(STEPS.TIME_USAGE_MS.isNotNull())
        .orderBy(STEPS.NAME.asc())
        .fetch(STEPS.NAME);
    }

    @Override public String toString() {
      return "SelectStepNames{pipeline=" + pipeline + "}";
    }
  }

  static RunMeta toRunMeta(Record row) {
    return RunMeta.newBuilder()
      .runId(row.get(RUNS.RUN_ID))
      .pipeline(row.get(RUNS.PIPELINE_NAME))
      .startTime(row.get(RUNS.START_TIME))
      .endTime(row.get(RUNS.END_TIME))
      .duration(row.get(RUNS.DURATION))
      .status(RunStatus.fromValue(row.get(RUNS.STATUS)))
      .build();
  }

  static StepMeta toStepMeta(Record row) {
    StepMeta.Builder result = StepMeta.newBuilder()
      .name(row.get(STEPS.NAME))
      .key(row.get(STEPS.KEY))
      .time(TimeMeta.create(row.get(STEPS.START_TIME), row.get(STEPS.END_TIME),
        row.get(STEPS.TIME_USAGE_MS)))
      .error(row.get(STEPS.ERROR));
    String records = row.get(STEPS.RECORDS);
    if (records != null) {
      Iterator<Map.Entry<String, JsonNode>> fields = readJson(records).fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        result.putRecord(field.getKey(), field.getValue());
      }
    }
    String value = row.get(STEPS.RESULT);
    if (value != null) result.result(readJson(value));
    return result.build();
  }

  static JsonNode readJson(String json) {
    return JsonCodec.readTree(json.getBytes(StandardCharsets.UTF_8));
  }
}
