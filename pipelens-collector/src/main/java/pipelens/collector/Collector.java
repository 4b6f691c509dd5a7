/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;
import pipelens.storage.StepConsumer;
import pipelens.storage.StorageComponent;

/**
 * Applies requests of the ingestion protocol to storage. Servers route each POST below {@code
 * api/ingestion/} to {@link #accept(String, byte[])} and answer with the {@link IngestResult}.
 *
 * <p>A batch is validated as a whole before any of its events is stored, then its events are
 * stored in order, stopping at the first storage failure.
 */
public final class Collector {
  static final Logger LOG = LoggerFactory.getLogger(Collector.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    StorageComponent storage;

    Builder() {
    }

    public Builder storage(StorageComponent storage) {
      if (storage == null) throw new NullPointerException("storage == null");
      this.storage = storage;
      return this;
    }

    public Collector build() {
      if (storage == null) throw new NullPointerException("storage == null");
      return new Collector(this);
    }
  }

  interface Write {
    Call<Void> to(StepConsumer consumer);
  }

  /** A decoded request, ready to be stored. */
  static final class Ingestion {
    final Write write;
    final int successCode;
    final String failure;

    Ingestion(Write write, int successCode, String failure) {
      this.write = write;
      this.successCode = successCode;
      this.failure = failure;
    }
  }

  final StorageComponent storage;

  Collector(Builder builder) {
    storage = builder.storage;
  }

  /**
   * Dispatches a request by its path relative to {@code api/ingestion/}, such as "step/finish".
   * Unknown paths result in a 404.
   */
  public IngestResult accept(String path, byte[] body) {
    if (path == null) throw new NullPointerException("path == null");
    if (body == null) throw new NullPointerException("body == null");
    switch (path) {
      case "pipeline/start":
        return pipelineStart(body);
      case "pipeline/finish":
        return pipelineFinish(body);
      case "step/start":
        return stepStart(body);
      case "step/finish":
        return stepFinish(body);
      case "batch":
        return batch(body);
      default:
        return new IngestResult(404, "Unknown ingestion path: " + path);
    }
  }

  /** Body is the {@link PipelineMeta} of the started run. */
  public IngestResult pipelineStart(byte[] body) {
    try {
      return store(decodeStart(JsonCodec.readTree(body)));
    } catch (ValidationException e) {
      return handleDecodeError(e);
    }
  }

  /** Body is {@code {"pipelineMeta": {...}, "status": "completed"}}. */
  public IngestResult pipelineFinish(byte[] body) {
    try {
      return store(decodeFinish(JsonCodec.readTree(body)));
    } catch (ValidationException e) {
      return handleDecodeError(e);
    }
  }

  /** Body is {@code {"runId": "...", "step": {...}}}. */
  public IngestResult stepStart(byte[] body) {
    try {
      return store(decodeStep(JsonCodec.readTree(body), false));
    } catch (ValidationException e) {
      return handleDecodeError(e);
    }
  }

  /** Body is {@code {"runId": "...", "step": {...}}}. */
  public IngestResult stepFinish(byte[] body) {
    try {
      return store(decodeStep(JsonCodec.readTree(body), true));
    } catch (ValidationException e) {
      return handleDecodeError(e);
    }
  }

  /**
   * Body is {@code {"events": [{"type": "initiate-run", "pipelineMeta": {...}}, ...]}}, the format
   * the batched exporter sends. The older {@code {"pipeline": {"operation", "meta", "status"},
   * "steps": [{"operation", "step"}]}} form is also accepted.
   */
  public IngestResult batch(byte[] body) {
    List<Ingestion> ingestions;
    try {
      ingestions = decodeBatch(JsonCodec.readTree(body));
    } catch (ValidationException e) {
      return handleDecodeError(e);
    }
    for (Ingestion ingestion : ingestions) {
      IngestResult result = store(ingestion);
      if (!result.success()) return IngestResult.failed("Failed to process batch log");
    }
    return IngestResult.OK;
  }

  static Ingestion decodeStart(JsonNode pipelineMeta) {
    if (!hasText(pipelineMeta, "runId") || !hasText(pipelineMeta, "name")) {
      throw new ValidationException("Invalid pipeline data. Required fields: runId, name");
    }
    PipelineMeta decoded = JsonCodec.decodePipelineMeta(pipelineMeta);
    return new Ingestion(c -> c.initiateRun(decoded), 201, "Failed to initiate pipeline run");
  }

  static Ingestion decodeFinish(JsonNode body) {
    JsonNode pipelineMeta = body.get("pipelineMeta");
    if (pipelineMeta == null || !hasText(pipelineMeta, "runId") || !hasText(body, "status")) {
      throw new ValidationException(
        "Invalid request. Required fields: pipelineMeta (with runId), status");
    }
    RunStatus status = RunStatus.fromValue(body.get("status").asText());
    PipelineMeta decoded = JsonCodec.decodePipelineMeta(pipelineMeta);
    return new Ingestion(c -> c.finishRun(decoded, status), 200, "Failed to finish pipeline run");
  }

  static Ingestion decodeStep(JsonNode body, boolean finish) {
    JsonNode step = body.get("step");
    if (!hasText(body, "runId") || step == null || !hasText(step, "key")) {
      throw new ValidationException("Invalid request. Required fields: runId, step (with key)");
    }
    String runId = body.get("runId").asText();
    StepMeta decoded = JsonCodec.decodeStepMeta(step);
    return finish
      ? new Ingestion(c -> c.finishStep(runId, decoded), 200, "Failed to finish step")
      : new Ingestion(c -> c.initiateStep(runId, decoded), 201, "Failed to initiate step");
  }

  static List<Ingestion> decodeBatch(JsonNode body) {
    JsonNode events = body.get("events");
    if (events != null && events.isArray()) return decodeEvents(events);
    JsonNode pipeline = body.get("pipeline"), steps = body.get("steps");
    if (pipeline != null && pipeline.isObject() && steps != null && steps.isArray()) {
      return decodeOperations(pipeline, steps);
    }
    throw new ValidationException("Invalid batch request. Required fields: events (array)");
  }

  static List<Ingestion> decodeEvents(JsonNode events) {
    List<Ingestion> result = new ArrayList<>(events.size());
    for (int i = 0; i < events.size(); i++) {
      JsonNode event = events.get(i);
      String type = event.path("type").asText();
      try {
        switch (type) {
          case "initiate-run":
            result.add(decodeStart(event.path("pipelineMeta")));
            break;
          case "finish-run":
            result.add(decodeFinish(event));
            break;
          case "initiate-step":
            result.add(decodeStep(event, false));
            break;
          case "finish-step":
            result.add(decodeStep(event, true));
            break;
          default:
            throw new ValidationException("Unknown event type: " + type);
        }
      } catch (ValidationException e) {
        throw new ValidationException("Invalid event " + i + ": " + e.getMessage(), e);
      }
    }
    return result;
  }

  static List<Ingestion> decodeOperations(JsonNode pipeline, JsonNode steps) {
    List<Ingestion> result = new ArrayList<>(steps.size() + 1);
    JsonNode meta = pipeline.path("meta");
    String operation = pipeline.path("operation").asText();
    if (operation.equals("start")) {
      result.add(decodeStart(meta));
    } else if (operation.equals("finish")) {
      ObjectNode finish = JsonCodec.MAPPER.createObjectNode();
      finish.set("pipelineMeta", meta);
      finish.set("status", pipeline.get("status"));
      result.add(decodeFinish(finish));
    }
    String runId = meta.path("runId").asText();
    for (JsonNode step : steps) {
      String stepOperation = step.path("operation").asText();
      if (!stepOperation.equals("start") && !stepOperation.equals("finish")) continue;
      ObjectNode body = JsonCodec.MAPPER.createObjectNode().put("runId", runId);
      body.set("step", step.get("step"));
      result.add(decodeStep(body, stepOperation.equals("finish")));
    }
    return result;
  }

  IngestResult store(Ingestion ingestion) {
    try {
      ingestion.write.to(storage.stepConsumer()).execute();
      return new IngestResult(ingestion.successCode, null);
    } catch (IOException | RuntimeException e) {
      LOG.warn("{}: {}", ingestion.failure, e.getMessage(), e);
      return IngestResult.failed(ingestion.failure);
    }
  }

  IngestResult handleDecodeError(ValidationException e) {
    LOG.debug("Rejected ingestion request: {}", e.getMessage());
    return IngestResult.invalid(e.getMessage());
  }

  static boolean hasText(JsonNode object, String field) {
    JsonNode value = object.get(field);
    return value != null && value.isTextual() && !value.asText().isEmpty();
  }

  @Override public String toString() {
    return "Collector{storage=" + storage + "}";
  }
}
