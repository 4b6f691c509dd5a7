/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.codec;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import org.junit.jupiter.api.Test;
import pipelens.PipelineMeta;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;
import pipelens.TimeMeta;
import pipelens.ValidationException;
import pipelens.storage.PipelineSettings;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCodecTest {
  StepMeta root = StepMeta.newBuilder()
    .name("etl").key("etl")
    .time(TimeMeta.finished(1000L, 1500L))
    .putRecord("rows", IntNode.valueOf(3))
    .build();
  StepMeta child = StepMeta.newBuilder()
    .name("load").key("etl.load")
    .time(TimeMeta.started(1100L))
    .error("timeout")
    .build();

  @Test void stepMeta_writesExpectedFields() {
    assertThat(new String(JsonCodec.writeStepMeta(root), UTF_8)).isEqualTo(
      "{\"name\":\"etl\",\"key\":\"etl\",\"time\":{\"startTs\":1000,\"endTs\":1500,"
        + "\"timeUsageMs\":500},\"records\":{\"rows\":3}}");
  }

  @Test void stepMeta_unfinishedOmitsEndAndUsage() {
    String json = new String(JsonCodec.writeStepMeta(child), UTF_8);

    assertThat(json).contains("\"time\":{\"startTs\":1100}").contains("\"error\":\"timeout\"");
    assertThat(JsonCodec.readStepMeta(json.getBytes(UTF_8))).isEqualTo(child);
  }

  @Test void stepMeta_acceptsLegacyRecordField() {
    StepMeta decoded = JsonCodec.readStepMeta(("{\"name\":\"a\",\"key\":\"a\","
      + "\"time\":{\"startTs\":1},\"record\":{\"x\":\"y\"}}").getBytes(UTF_8));

    assertThat(decoded.records()).containsEntry("x", TextNode.valueOf("y"));
  }

  @Test void stepMeta_missingKeyNamesField() {
    assertThatThrownBy(() -> JsonCodec.readStepMeta(
      "{\"name\":\"a\",\"time\":{\"startTs\":1}}".getBytes(UTF_8)))
      .isInstanceOf(ValidationException.class)
      .hasMessage("key is missing from input");
  }

  @Test void stepMeta_endBeforeStartIsInvalid() {
    assertThatThrownBy(() -> JsonCodec.readStepMeta(
      "{\"name\":\"a\",\"key\":\"a\",\"time\":{\"startTs\":10,\"endTs\":5}}".getBytes(UTF_8)))
      .isInstanceOf(ValidationException.class)
      .hasMessage("endTs < startTs: 5 < 10");
  }

  @Test void pipelineMeta_readsWhatItWrites() {
    PipelineMeta meta = PipelineMeta.create("r1", root, List.of(root, child));

    assertThat(JsonCodec.readPipelineMeta(JsonCodec.writePipelineMeta(meta))).isEqualTo(meta);
  }

  @Test void pipelineMeta_validatesRequiredFields() {
    assertThatThrownBy(() -> JsonCodec.readPipelineMeta(
      "{\"logVersion\":1,\"name\":\"etl\",\"time\":{\"startTs\":1},\"steps\":[]}"
        .getBytes(UTF_8)))
      .isInstanceOf(ValidationException.class)
      .hasMessage("runId is missing from input");

    assertThatThrownBy(() -> JsonCodec.readPipelineMeta(
      "{\"logVersion\":1,\"runId\":\"r1\",\"name\":\"etl\",\"steps\":[]}".getBytes(UTF_8)))
      .hasMessage("startTs is missing from input");

    assertThatThrownBy(() -> JsonCodec.readPipelineMeta(
      "{\"logVersion\":1,\"runId\":\"r1\",\"name\":\"etl\",\"time\":{\"startTs\":1}}"
        .getBytes(UTF_8)))
      .hasMessage("steps is missing from input");
  }

  @Test void runMeta_usesLowerCaseStatus() {
    RunMeta run = RunMeta.newBuilder().runId("r1").pipeline("etl").startTime(1L)
      .endTime(5L).duration(4L).status(RunStatus.FAILED).build();

    assertThat(new String(JsonCodec.writeRunMeta(run), UTF_8)).isEqualTo(
      "{\"runId\":\"r1\",\"pipeline\":\"etl\",\"startTime\":1,\"endTime\":5,\"duration\":4,"
        + "\"status\":\"failed\"}");
    assertThat(JsonCodec.readRunMetaList(JsonCodec.writeRunMetaList(List.of(run))))
      .containsExactly(run);
  }

  @Test void settings_acceptsDataRetentionDaysAndKeepsUnknownFields() {
    PipelineSettings settings = JsonCodec.readSettings(
      ("{\"dataRetentionDays\":7,\"theme\":\"dark\",\"presetColumns\":"
        + "[{\"name\":\"Rows\",\"path\":\"records.rows\"}]}").getBytes(UTF_8));

    assertThat(settings.retentionDays()).isEqualTo(7);
    assertThat(settings.presetColumns()).containsExactly(
      PipelineSettings.PresetColumn.create("Rows", "records.rows", null));
    assertThat(settings.extra()).containsEntry("theme", TextNode.valueOf("dark"));
    assertThat(JsonCodec.readSettings(JsonCodec.writeSettings(settings))).isEqualTo(settings);
  }

  @Test void settings_rejectsNonPositiveRetention() {
    assertThatThrownBy(() -> JsonCodec.readSettings("{\"retentionDays\":0}".getBytes(UTF_8)))
      .isInstanceOf(ValidationException.class);
  }

  @Test void readTree_malformed() {
    assertThatThrownBy(() -> JsonCodec.readTree("{".getBytes(UTF_8)))
      .isInstanceOf(ValidationException.class)
      .hasMessageStartingWith("Malformed JSON");
  }

  @Test void toJsonNode_convertsBeansAndNull() {
    assertThat(JsonCodec.toJsonNode(null).isNull()).isTrue();
    assertThat(JsonCodec.toJsonNode(List.of(1, 2)).toString()).isEqualTo("[1,2]");
    assertThat(JsonCodec.toJsonNode(new Object()).isTextual()).isTrue();
  }
}
