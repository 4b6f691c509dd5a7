/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.extension;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import pipelens.Pipeline;
import pipelens.StepMeta;
import pipelens.TimeMeta;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class LlmTrackTest {
  Pipeline pipeline = Pipeline.newBuilder("chat").build();

  static JsonNode completion(String id, String model, int prompt, int completion) {
    return JsonCodec.readTree(("{\"id\":\"" + id + "\",\"object\":\"chat.completion\","
      + "\"created\":1700000000,\"model\":\"" + model + "\",\"choices\":[{\"index\":0,"
      + "\"message\":{\"role\":\"assistant\",\"content\":\"hi\"},\"finish_reason\":\"stop\"}],"
      + "\"usage\":{\"prompt_tokens\":" + prompt + ",\"completion_tokens\":" + completion
      + ",\"total_tokens\":" + (prompt + completion) + "},\"provider\":\"acme\"}").getBytes(UTF_8));
  }

  @Test void track_recordsSanitizedResponseUnderId() throws Exception {
    pipeline.run(root -> root.step("ask", step -> {
      LlmTrack.track(step, completion("cmpl-1", "gpt-4o", 10, 5));
      return null;
    }));

    StepMeta ask = pipeline.flatten().get(1);
    JsonNode recorded = ask.records().get("__LLM_RESPONSE_cmpl-1");
    assertThat(recorded).isNotNull();
    assertThat(recorded.fieldNames()).toIterable()
      .containsExactly("id", "object", "created", "model", "choices", "usage");
    assertThat(recorded.path("usage").path("total_tokens").asInt()).isEqualTo(15);
  }

  @Test void track_acceptsMaps() throws Exception {
    pipeline.run(root -> {
      LlmTrack.track(root, Map.of("id", "cmpl-2", "model", "small"));
      return null;
    });

    assertThat(pipeline.root().records()).containsKey("__LLM_RESPONSE_cmpl-2");
  }

  @Test void track_requiresId() {
    assertThatThrownBy(() -> LlmTrack.track(pipeline.root(), Map.of("model", "small")))
      .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> LlmTrack.track(pipeline.root(), "text"))
      .isInstanceOf(ValidationException.class);
  }

  @Test void totalUsage_sumsByModelAcrossTree() throws Exception {
    pipeline.run(root -> {
      LlmTrack.track(root, completion("a", "gpt-4o", 10, 5));
      root.step("draft", step -> {
        LlmTrack.track(step, completion("b", "gpt-4o", 20, 10));
        LlmTrack.track(step, completion("c", "mini", 3, 1));
        step.record("notes", "not a response");
        return null;
      });
      return null;
    });

    assertThat(LlmTrack.totalUsage(pipeline.root())).containsExactly(
      entry("gpt-4o", LlmUsage.create(30, 15, 45)),
      entry("mini", LlmUsage.create(3, 1, 4)));
  }

  @Test void totalUsage_readsStoredSteps() {
    StepMeta step = StepMeta.newBuilder().name("ask").key("chat.ask")
      .time(TimeMeta.finished(1L, 2L))
      .putRecord("__LLM_RESPONSE_x", JsonCodec.toJsonNode(Map.of("id", "x", "model", "m")))
      .putRecord("__LLM_RESPONSE_y", JsonCodec.toJsonNode(Map.of("id", "y")))
      .build();

    assertThat(LlmTrack.totalUsage(List.of(step)))
      .containsExactly(entry("m", LlmUsage.EMPTY));
  }

  @Test void totalUsage_emptyWithoutResponses() {
    assertThat(LlmTrack.totalUsage(pipeline.root())).isEmpty();
  }
}
