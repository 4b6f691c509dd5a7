/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.JsonNode;
import pipelens.internal.Nullable;

/** A lifecycle notification published on the {@link StepEventBus} of a step tree. */
public final class StepEvent {
  public enum Kind {
    STEP_START("step-start"),
    STEP_SUCCESS("step-success"),
    STEP_ERROR("step-error"),
    STEP_RECORD("step-record"),
    STEP_COMPLETE("step-complete");

    final String value;

    Kind(String value) {
      this.value = value;
    }

    /** The serialized form, such as "step-start". */
    public String value() {
      return value;
    }
  }

  static StepEvent create(Kind kind, Step step) {
    return new StepEvent(kind, step, null, null);
  }

  static StepEvent record(Step step, String recordKey, JsonNode recordValue) {
    return new StepEvent(Kind.STEP_RECORD, step, recordKey, recordValue);
  }

  final Kind kind;
  final Step step;
  @Nullable final String recordKey;
  @Nullable final JsonNode recordValue;

  StepEvent(Kind kind, Step step, @Nullable String recordKey, @Nullable JsonNode recordValue) {
    this.kind = kind;
    this.step = step;
    this.recordKey = recordKey;
    this.recordValue = recordValue;
  }

  public Kind kind() {
    return kind;
  }

  /** The step that emitted this event, which may be any descendant of the subscribed root. */
  public Step step() {
    return step;
  }

  /** Present on {@link Kind#STEP_RECORD} */
  @Nullable public String recordKey() {
    return recordKey;
  }

  /** Present on {@link Kind#STEP_RECORD} */
  @Nullable public JsonNode recordValue() {
    return recordValue;
  }

  @Override public String toString() {
    return "StepEvent{kind=" + kind.value + ", step=" + step.key() + "}";
  }
}
