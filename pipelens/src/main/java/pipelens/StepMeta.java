/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import pipelens.internal.Nullable;

/**
 * The persisted form of a {@link Step}: one row or document per (run ID, step key).
 *
 * <p>Records and the result are opaque JSON values. They are kept as {@link JsonNode} so that
 * storage and transport can write them without knowing the application's types.
 */
// @Immutable
public final class StepMeta {

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  final String name, key;
  final TimeMeta time;
  final Map<String, JsonNode> records;
  @Nullable final JsonNode result;
  @Nullable final String error;

  StepMeta(Builder builder) {
    name = builder.name;
    key = builder.key;
    time = builder.time;
    records = builder.records.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(builder.records));
    result = builder.result;
    error = builder.error;
  }

  /** Human-assigned name, shared by instances of the same logical step across runs. */
  public String name() {
    return name;
  }

  /** Dotted path from the root, unique within a run. */
  public String key() {
    return key;
  }

  public TimeMeta time() {
    return time;
  }

  /** Values recorded during execution, in insertion order. */
  public Map<String, JsonNode> records() {
    return records;
  }

  @Nullable public JsonNode result() {
    return result;
  }

  @Nullable public String error() {
    return error;
  }

  /** True when the step ended with a non-empty error message. */
  public boolean hasError() {
    return error != null && !error.isEmpty();
  }

  public static final class Builder {
    String name, key;
    TimeMeta time;
    final Map<String, JsonNode> records = new LinkedHashMap<>();
    JsonNode result;
    String error;

    Builder() {
    }

    Builder(StepMeta source) {
      name = source.name;
      key = source.key;
      time = source.time;
      records.putAll(source.records);
      result = source.result;
      error = source.error;
    }

    public Builder name(String name) {
      if (name == null) throw new NullPointerException("name == null");
      this.name = name;
      return this;
    }

    public Builder key(String key) {
      if (key == null) throw new NullPointerException("key == null");
      this.key = key;
      return this;
    }

    public Builder time(TimeMeta time) {
      if (time == null) throw new NullPointerException("time == null");
      this.time = time;
      return this;
    }

    public Builder putRecord(String key, JsonNode value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      records.put(key, value);
      return this;
    }

    public Builder records(Map<String, JsonNode> records) {
      if (records == null) throw new NullPointerException("records == null");
      this.records.clear();
      for (Map.Entry<String, JsonNode> entry : records.entrySet()) {
        putRecord(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder result(@Nullable JsonNode result) {
      this.result = result;
      return this;
    }

    public Builder error(@Nullable String error) {
      this.error = error;
      return this;
    }

    public StepMeta build() {
      String missing = "";
      if (name == null) missing += " name";
      if (key == null) missing += " key";
      if (time == null) missing += " time";
      if (!missing.isEmpty()) throw new IllegalStateException("Missing :" + missing);
      return new StepMeta(this);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof StepMeta)) return false;
    StepMeta that = (StepMeta) o;
    return name.equals(that.name)
      && key.equals(that.key)
      && time.equals(that.time)
      && records.equals(that.records)
      && (result == null ? that.result == null : result.equals(that.result))
      && (error == null ? that.error == null : error.equals(that.error));
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= name.hashCode();
    h *= 1000003;
    h ^= key.hashCode();
    h *= 1000003;
    h ^= time.hashCode();
    h *= 1000003;
    h ^= records.hashCode();
    h *= 1000003;
    h ^= (result == null) ? 0 : result.hashCode();
    h *= 1000003;
    h ^= (error == null) ? 0 : error.hashCode();
    return h;
  }

  @Override public String toString() {
    return "StepMeta{name=" + name + ", key=" + key + ", time=" + time + ", records=" + records
      + ", result=" + result + ", error=" + error + "}";
  }
}
