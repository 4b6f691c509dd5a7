/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.exporter;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.codec.JsonCodec;
import pipelens.internal.Nullable;

/** A lifecycle call waiting in the exporter's batch. */
// @Immutable
public final class ExportEvent {
  public enum Type {
    INITIATE_RUN("initiate-run", "pipeline/start"),
    FINISH_RUN("finish-run", "pipeline/finish"),
    INITIATE_STEP("initiate-step", "step/start"),
    FINISH_STEP("finish-step", "step/finish");

    final String value, path;

    Type(String value, String path) {
      this.value = value;
      this.path = path;
    }

    /** The serialized form, such as "finish-step". */
    public String value() {
      return value;
    }

    /** Ingestion path of the single-event request, relative to "api/ingestion/". */
    public String path() {
      return path;
    }
  }

  static ExportEvent initiateRun(PipelineMeta pipelineMeta) {
    return new ExportEvent(Type.INITIATE_RUN, null, pipelineMeta, null, null);
  }

  static ExportEvent finishRun(PipelineMeta pipelineMeta, RunStatus status) {
    return new ExportEvent(Type.FINISH_RUN, null, pipelineMeta, null, status);
  }

  static ExportEvent initiateStep(String runId, StepMeta step) {
    return new ExportEvent(Type.INITIATE_STEP, runId, null, step, null);
  }

  static ExportEvent finishStep(String runId, StepMeta step) {
    return new ExportEvent(Type.FINISH_STEP, runId, null, step, null);
  }

  final Type type;
  @Nullable final String runId;
  @Nullable final PipelineMeta pipelineMeta;
  @Nullable final StepMeta step;
  @Nullable final RunStatus status;

  ExportEvent(Type type, @Nullable String runId, @Nullable PipelineMeta pipelineMeta,
    @Nullable StepMeta step, @Nullable RunStatus status) {
    this.type = type;
    this.runId = runId;
    this.pipelineMeta = pipelineMeta;
    this.step = step;
    this.status = status;
  }

  public Type type() {
    return type;
  }

  /** Present on step events. */
  @Nullable public String runId() {
    return runId;
  }

  /** Present on run events. */
  @Nullable public PipelineMeta pipelineMeta() {
    return pipelineMeta;
  }

  /** Present on step events. */
  @Nullable public StepMeta step() {
    return step;
  }

  /** Present on {@link Type#FINISH_RUN}. */
  @Nullable public RunStatus status() {
    return status;
  }

  /** Writes the event as an element of a batch request. */
  static void write(JsonGenerator generator, ExportEvent event) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("type", event.type.value);
    writeFields(generator, event);
    generator.writeEndObject();
  }

  /** Writes the body of the single-event request for this type. */
  static void writeBody(JsonGenerator generator, ExportEvent event) throws IOException {
    if (event.type == Type.INITIATE_RUN) {
      JsonCodec.writePipelineMeta(generator, event.pipelineMeta);
      return;
    }
    generator.writeStartObject();
    writeFields(generator, event);
    generator.writeEndObject();
  }

  static void writeFields(JsonGenerator generator, ExportEvent event) throws IOException {
    if (event.runId != null) generator.writeStringField("runId", event.runId);
    if (event.pipelineMeta != null) {
      generator.writeFieldName("pipelineMeta");
      JsonCodec.writePipelineMeta(generator, event.pipelineMeta);
    }
    if (event.step != null) {
      generator.writeFieldName("step");
      JsonCodec.writeStepMeta(generator, event.step);
    }
    if (event.status != null) generator.writeStringField("status", event.status.value());
  }

  @Override public String toString() {
    return "ExportEvent{type=" + type.value + ", runId="
      + (runId != null ? runId : pipelineMeta != null ? pipelineMeta.runId() : null) + "}";
  }
}
