/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.extension;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import pipelens.Step;
import pipelens.StepMeta;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;

/**
 * Records OpenAI-compatible chat completion responses on steps and totals their token usage.
 *
 * <p>Ex.
 * <pre>{@code
 * pipeline.step("summarize", step -> {
 *   JsonNode response = client.chatCompletion(request);
 *   LlmTrack.track(step, response);
 *   return response.path("choices").path(0).path("message").path("content").asText();
 * });
 * Map<String, LlmUsage> usageByModel = LlmTrack.totalUsage(pipeline.root());
 * }</pre>
 */
public final class LlmTrack {
  public static final String RECORD_KEY_PREFIX = "__LLM_RESPONSE_";

  static final String[] RESPONSE_FIELDS = {
    "id", "object", "created", "model", "choices", "usage", "system_fingerprint"
  };

  /**
   * Records {@code response} on {@code step} under {@link #RECORD_KEY_PREFIX} plus its ID. Only the
   * fields of a chat completion are kept, so provider extensions and request echoes are dropped.
   *
   * @param response a {@link JsonNode} or any value Jackson converts to a JSON object
   * @throws ValidationException if the response is not an object with a textual {@code id}
   */
  public static void track(Step step, Object response) {
    if (step == null) throw new NullPointerException("step == null");
    if (response == null) throw new NullPointerException("response == null");
    JsonNode node = JsonCodec.toJsonNode(response);
    if (!node.isObject() || !node.path("id").isTextual()) {
      throw new ValidationException("Expected a chat completion with an id");
    }
    step.record(RECORD_KEY_PREFIX + node.get("id").asText(), sanitize(node));
  }

  static ObjectNode sanitize(JsonNode response) {
    ObjectNode result = JsonCodec.MAPPER.createObjectNode();
    for (String field : RESPONSE_FIELDS) {
      JsonNode value = response.get(field);
      if (value != null && !value.isNull()) result.set(field, value);
    }
    return result;
  }

  /** Sums usage of every response tracked in this step and its descendants, by model. */
  public static Map<String, LlmUsage> totalUsage(Step step) {
    if (step == null) throw new NullPointerException("step == null");
    return totalUsage(step.flatten());
  }

  /**
   * Sums usage over flattened steps, such as those of a stored run. Responses without a model are
   * skipped, and a model whose responses carry no usage totals zero. Models are in the order first
   * seen.
   */
  public static Map<String, LlmUsage> totalUsage(List<StepMeta> steps) {
    if (steps == null) throw new NullPointerException("steps == null");
    Map<String, LlmUsage> result = new LinkedHashMap<>();
    for (StepMeta step : steps) {
      for (Map.Entry<String, JsonNode> record : step.records().entrySet()) {
        if (!record.getKey().startsWith(RECORD_KEY_PREFIX)) continue;
        JsonNode model = record.getValue().path("model");
        if (!model.isTextual() || model.asText().isEmpty()) continue;
        JsonNode usage = record.getValue().path("usage");
        LlmUsage tokens = LlmUsage.create(usage.path("prompt_tokens").asLong(0),
          usage.path("completion_tokens").asLong(0), usage.path("total_tokens").asLong(0));
        result.merge(model.asText(), tokens, LlmUsage::plus);
      }
    }
    return Collections.unmodifiableMap(result);
  }

  LlmTrack() {
  }
}
