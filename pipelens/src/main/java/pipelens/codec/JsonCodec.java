/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.codec;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.TimeMeta;
import pipelens.ValidationException;
import pipelens.internal.Nullable;
import pipelens.storage.PipelineSettings;
import pipelens.storage.StepTimeseriesEntry;

/**
 * Reads and writes the JSON forms of the model. Writes use the streaming generator, reads go
 * through a {@link JsonNode} tree so that optional and aliased fields can be checked by name.
 *
 * <p>Field names match what collectors and dashboards exchange, for example {@code
 * {"name":"load","key":"ingest.load","time":{"startTs":1,"endTs":3,"timeUsageMs":2}}}.
 */
public final class JsonCodec {
  public static final ObjectMapper MAPPER = new ObjectMapper();
  static final JsonFactory FACTORY = MAPPER.getFactory();

  public interface Writer<T> {
    void write(JsonGenerator generator, T value) throws IOException;
  }

  /** Converts an application value into its opaque JSON form. Null becomes JSON null. */
  public static JsonNode toJsonNode(@Nullable Object value) {
    if (value == null) return NullNode.getInstance();
    if (value instanceof JsonNode) return (JsonNode) value;
    try {
      return MAPPER.valueToTree(value);
    } catch (IllegalArgumentException e) {
      // not a bean jackson understands: keep something readable instead of failing the step
      return TextNode.valueOf(value.toString());
    }
  }

  public static <T> byte[] write(Writer<T> writer, T value) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      writer.write(generator, value);
    } catch (IOException e) {
      throw new UncheckedIOException(e); // in-memory writes only fail on programming errors
    }
    return out.toByteArray();
  }

  public static <T> byte[] writeList(Writer<T> writer, List<T> values) {
    return write((generator, list) -> {
      generator.writeStartArray();
      for (T value : list) writer.write(generator, value);
      generator.writeEndArray();
    }, values);
  }

  /** Parses JSON text, failing with a {@link ValidationException} when it is malformed. */
  public static JsonNode readTree(byte[] json) {
    if (json == null) throw new NullPointerException("json == null");
    try {
      JsonNode result = MAPPER.readTree(json);
      if (result == null || result.isMissingNode()) throw new ValidationException("Empty input");
      return result;
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e); // reading a byte array doesn't do I/O
    }
  }

  // StepMeta

  public static void writeTime(JsonGenerator generator, TimeMeta time) throws IOException {
    generator.writeStartObject();
    generator.writeNumberField("startTs", time.startTs());
    if (time.endTs() != null) generator.writeNumberField("endTs", time.endTs());
    if (time.timeUsageMs() != null) {
      generator.writeNumberField("timeUsageMs", time.timeUsageMs());
    }
    generator.writeEndObject();
  }

  public static void writeStepMeta(JsonGenerator generator, StepMeta step) throws IOException {
    generator.writeStartObject();
    writeStepFields(generator, step);
    generator.writeEndObject();
  }

  static void writeStepFields(JsonGenerator generator, StepMeta step) throws IOException {
    generator.writeStringField("name", step.name());
    generator.writeStringField("key", step.key());
    generator.writeFieldName("time");
    writeTime(generator, step.time());
    generator.writeObjectFieldStart("records");
    for (Map.Entry<String, JsonNode> record : step.records().entrySet()) {
      generator.writeFieldName(record.getKey());
      generator.writeTree(record.getValue());
    }
    generator.writeEndObject();
    if (step.result() != null) {
      generator.writeFieldName("result");
      generator.writeTree(step.result());
    }
    if (step.error() != null) generator.writeStringField("error", step.error());
  }

  public static byte[] writeStepMeta(StepMeta step) {
    return write(JsonCodec::writeStepMeta, step);
  }

  public static StepMeta readStepMeta(byte[] json) {
    return decodeStepMeta(readTree(json));
  }

  public static List<StepMeta> readStepMetaList(byte[] json) {
    JsonNode array = readTree(json);
    if (!array.isArray()) throw new ValidationException("Expected an array of steps");
    List<StepMeta> result = new ArrayList<>(array.size());
    for (JsonNode step : array) result.add(decodeStepMeta(step));
    return result;
  }

  public static TimeMeta decodeTime(JsonNode time) {
    if (time == null || !time.isObject()) throw missing("time");
    JsonNode startTs = time.get("startTs");
    if (startTs == null || !startTs.isNumber()) throw missing("startTs");
    Long endTs = optionalLong(time, "endTs");
    if (endTs != null && endTs < startTs.asLong()) {
      throw new ValidationException("endTs < startTs: " + endTs + " < " + startTs.asLong());
    }
    return TimeMeta.create(startTs.asLong(), endTs, optionalLong(time, "timeUsageMs"));
  }

  /** Decodes a step, accepting the legacy {@code record} field in place of {@code records}. */
  public static StepMeta decodeStepMeta(JsonNode step) {
    if (step == null || !step.isObject()) throw new ValidationException("Expected a step object");
    StepMeta.Builder result = StepMeta.newBuilder()
      .name(requiredText(step, "name"))
      .key(requiredText(step, "key"))
      .time(decodeTime(step.get("time")));
    JsonNode records = step.get("records");
    if (records == null || records.isNull()) records = step.get("record");
    if (records != null && records.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = records.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        result.putRecord(field.getKey(), field.getValue());
      }
    }
    JsonNode value = step.get("result");
    if (value != null && !value.isNull()) result.result(value);
    JsonNode error = step.get("error");
    if (error != null && !error.isNull()) {
      result.error(error.isTextual() ? error.asText() : error.toString());
    }
    return result.build();
  }

  // PipelineMeta

  public static void writePipelineMeta(JsonGenerator generator, PipelineMeta pipelineMeta)
    throws IOException {
    generator.writeStartObject();
    writeStepFields(generator, pipelineMeta.root());
    generator.writeStringField("runId", pipelineMeta.runId());
    generator.writeNumberField("logVersion", pipelineMeta.logVersion());
    generator.writeArrayFieldStart("steps");
    for (StepMeta step : pipelineMeta.steps()) writeStepMeta(generator, step);
    generator.writeEndArray();
    generator.writeEndObject();
  }

  public static byte[] writePipelineMeta(PipelineMeta pipelineMeta) {
    return write(JsonCodec::writePipelineMeta, pipelineMeta);
  }

  public static PipelineMeta readPipelineMeta(byte[] json) {
    return decodePipelineMeta(readTree(json));
  }

  /**
   * Decodes a versioned pipeline document. The root step's key defaults to its sanitized name, as
   * documents produced before keys were written omit it.
   */
  public static PipelineMeta decodePipelineMeta(JsonNode pipeline) {
    if (pipeline == null || !pipeline.isObject()) throw new ValidationException("Invalid input");
    JsonNode runId = pipeline.get("runId");
    if (runId == null || !runId.isTextual() || runId.asText().isEmpty()) throw missing("runId");
    JsonNode time = pipeline.get("time");
    if (time == null || !time.isObject() || !time.path("startTs").isNumber()) {
      throw missing("startTs");
    }
    JsonNode steps = pipeline.get("steps");
    if (steps == null || !steps.isArray()) throw missing("steps");

    List<StepMeta> decodedSteps = new ArrayList<>(steps.size());
    for (JsonNode step : steps) decodedSteps.add(decodeStepMeta(step));

    String name = requiredText(pipeline, "name");
    JsonNode key = pipeline.get("key");
    StepMeta.Builder root = StepMeta.newBuilder()
      .name(name)
      .key(key != null && key.isTextual() ? key.asText() : name.replace('.', '_'))
      .time(decodeTime(time));
    JsonNode records = pipeline.get("records");
    if (records != null && records.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = records.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        root.putRecord(field.getKey(), field.getValue());
      }
    }
    JsonNode value = pipeline.get("result");
    if (value != null && !value.isNull()) root.result(value);
    JsonNode error = pipeline.get("error");
    if (error != null && !error.isNull()) root.error(error.asText());

    int logVersion = pipeline.path("logVersion").asInt(PipelineMeta.LOG_VERSION);
    return PipelineMeta.create(runId.asText(), logVersion, root.build(), decodedSteps);
  }

  // RunMeta

  public static void writeRunMeta(JsonGenerator generator, RunMeta run) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("runId", run.runId());
    generator.writeStringField("pipeline", run.pipeline());
    generator.writeNumberField("startTime", run.startTime());
    if (run.endTime() != null) generator.writeNumberField("endTime", run.endTime());
    if (run.duration() != null) generator.writeNumberField("duration", run.duration());
    generator.writeStringField("status", run.status().value());
    generator.writeEndObject();
  }

  public static byte[] writeRunMeta(RunMeta run) {
    return write(JsonCodec::writeRunMeta, run);
  }

  public static byte[] writeRunMetaList(List<RunMeta> runs) {
    return writeList(JsonCodec::writeRunMeta, runs);
  }

  public static RunMeta readRunMeta(byte[] json) {
    return decodeRunMeta(readTree(json));
  }

  public static List<RunMeta> readRunMetaList(byte[] json) {
    JsonNode array = readTree(json);
    if (!array.isArray()) throw new ValidationException("Expected an array of runs");
    List<RunMeta> result = new ArrayList<>(array.size());
    for (JsonNode run : array) result.add(decodeRunMeta(run));
    return result;
  }

  public static RunMeta decodeRunMeta(JsonNode run) {
    if (run == null || !run.isObject()) throw new ValidationException("Expected a run object");
    JsonNode startTime = run.get("startTime");
    if (startTime == null || !startTime.isNumber()) throw missing("startTime");
    return RunMeta.newBuilder()
      .runId(requiredText(run, "runId"))
      .pipeline(requiredText(run, "pipeline"))
      .startTime(startTime.asLong())
      .endTime(optionalLong(run, "endTime"))
      .duration(optionalLong(run, "duration"))
      .status(RunStatus.fromValue(requiredText(run, "status")))
      .build();
  }

  // StepTimeseriesEntry

  public static void writeTimeseriesEntry(JsonGenerator generator, StepTimeseriesEntry entry)
    throws IOException {
    generator.writeStartObject();
    generator.writeNumberField("timestamp", entry.timestamp());
    generator.writeStringField("runId", entry.runId());
    generator.writeNumberField("value", entry.value());
    generator.writeStringField("stepKey", entry.stepKey());
    if (entry.stepMeta() != null) {
      generator.writeFieldName("stepMeta");
      writeStepMeta(generator, entry.stepMeta());
    }
    generator.writeEndObject();
  }

  public static byte[] writeTimeseries(List<StepTimeseriesEntry> entries) {
    return writeList(JsonCodec::writeTimeseriesEntry, entries);
  }

  public static List<StepTimeseriesEntry> readTimeseries(byte[] json) {
    JsonNode array = readTree(json);
    if (!array.isArray()) throw new ValidationException("Expected an array of entries");
    List<StepTimeseriesEntry> result = new ArrayList<>(array.size());
    for (JsonNode entry : array) {
      JsonNode timestamp = entry.get("timestamp"), value = entry.get("value");
      if (timestamp == null || !timestamp.isNumber()) throw missing("timestamp");
      if (value == null || !value.isNumber()) throw missing("value");
      JsonNode stepMeta = entry.get("stepMeta");
      result.add(StepTimeseriesEntry.create(timestamp.asLong(), requiredText(entry, "runId"),
        requiredText(entry, "stepKey"), value.asLong(),
        stepMeta != null && stepMeta.isObject() ? decodeStepMeta(stepMeta) : null));
    }
    return result;
  }

  // PipelineSettings

  public static void writeSettings(JsonGenerator generator, PipelineSettings settings)
    throws IOException {
    generator.writeStartObject();
    for (Map.Entry<String, JsonNode> extra : settings.extra().entrySet()) {
      generator.writeFieldName(extra.getKey());
      generator.writeTree(extra.getValue());
    }
    if (settings.retentionDays() != null) {
      generator.writeNumberField("retentionDays", settings.retentionDays());
    }
    if (!settings.presetColumns().isEmpty()) {
      generator.writeArrayFieldStart("presetColumns");
      for (PipelineSettings.PresetColumn column : settings.presetColumns()) {
        generator.writeStartObject();
        generator.writeStringField("name", column.name());
        generator.writeStringField("path", column.path());
        if (column.pipeline() != null) generator.writeStringField("pipeline", column.pipeline());
        generator.writeEndObject();
      }
      generator.writeEndArray();
    }
    generator.writeEndObject();
  }

  public static byte[] writeSettings(PipelineSettings settings) {
    return write(JsonCodec::writeSettings, settings);
  }

  public static PipelineSettings readSettings(byte[] json) {
    return decodeSettings(readTree(json));
  }

  /** Decodes settings, accepting {@code dataRetentionDays} as an alias of retention days. */
  public static PipelineSettings decodeSettings(JsonNode settings) {
    if (settings == null || !settings.isObject()) {
      throw new ValidationException("Expected a settings object");
    }
    PipelineSettings.Builder result = PipelineSettings.newBuilder();
    Iterator<Map.Entry<String, JsonNode>> fields = settings.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      switch (field.getKey()) {
        case "retentionDays":
        case "dataRetentionDays":
          if (value.isNull()) break;
          if (!value.canConvertToInt() || value.asInt() <= 0) {
            throw new ValidationException("retentionDays must be a positive integer");
          }
          result.retentionDays(value.asInt());
          break;
        case "presetColumns":
          if (!value.isArray()) throw new ValidationException("presetColumns must be an array");
          for (JsonNode column : value) {
            JsonNode pipeline = column.get("pipeline");
            result.addPresetColumn(PipelineSettings.PresetColumn.create(
              requiredText(column, "name"), requiredText(column, "path"),
              pipeline != null && pipeline.isTextual() ? pipeline.asText() : null));
          }
          break;
        default:
          result.putExtra(field.getKey(), value);
      }
    }
    return result.build();
  }

  static String requiredText(JsonNode object, String field) {
    JsonNode value = object.get(field);
    if (value == null || !value.isTextual()) throw missing(field);
    return value.asText();
  }

  @Nullable static Long optionalLong(JsonNode object, String field) {
    JsonNode value = object.get(field);
    if (value == null || value.isNull()) return null;
    if (!value.isNumber()) throw new ValidationException(field + " must be a number");
    return value.asLong();
  }

  static ValidationException missing(String field) {
    return new ValidationException(field + " is missing from input");
  }

  JsonCodec() {
  }
}
