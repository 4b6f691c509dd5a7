/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import pipelens.internal.Nullable;

/**
 * Per-pipeline settings. Fields this library doesn't interpret, such as those written by a
 * dashboard, are kept in {@link #extra()} and written back unchanged.
 */
// @Immutable
public final class PipelineSettings {
  public static final PipelineSettings EMPTY = newBuilder().build();

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Nullable final Integer retentionDays;
  final List<PresetColumn> presetColumns;
  final Map<String, JsonNode> extra;

  PipelineSettings(Builder builder) {
    retentionDays = builder.retentionDays;
    presetColumns = Collections.unmodifiableList(new ArrayList<>(builder.presetColumns));
    extra = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extra));
  }

  /** Days to keep runs before {@link StorageComponent#purgeOldData} deletes them. */
  @Nullable public Integer retentionDays() {
    return retentionDays;
  }

  public List<PresetColumn> presetColumns() {
    return presetColumns;
  }

  public Map<String, JsonNode> extra() {
    return extra;
  }

  public static final class Builder {
    Integer retentionDays;
    final List<PresetColumn> presetColumns = new ArrayList<>();
    final Map<String, JsonNode> extra = new LinkedHashMap<>();

    Builder() {
    }

    Builder(PipelineSettings source) {
      retentionDays = source.retentionDays;
      presetColumns.addAll(source.presetColumns);
      extra.putAll(source.extra);
    }

    public Builder retentionDays(@Nullable Integer retentionDays) {
      if (retentionDays != null && retentionDays <= 0) {
        throw new IllegalArgumentException("retentionDays <= 0");
      }
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder addPresetColumn(PresetColumn presetColumn) {
      if (presetColumn == null) throw new NullPointerException("presetColumn == null");
      presetColumns.add(presetColumn);
      return this;
    }

    public Builder putExtra(String name, JsonNode value) {
      if (name == null) throw new NullPointerException("name == null");
      if (value == null) throw new NullPointerException("value == null");
      extra.put(name, value);
      return this;
    }

    public PipelineSettings build() {
      return new PipelineSettings(this);
    }
  }

  /** A column a dashboard projects from step records, by JSON path. */
  // @Immutable
  public static final class PresetColumn {
    public static PresetColumn create(String name, String path, @Nullable String pipeline) {
      if (name == null) throw new NullPointerException("name == null");
      if (path == null) throw new NullPointerException("path == null");
      return new PresetColumn(name, path, pipeline);
    }

    final String name, path;
    @Nullable final String pipeline;

    PresetColumn(String name, String path, @Nullable String pipeline) {
      this.name = name;
      this.path = path;
      this.pipeline = pipeline;
    }

    public String name() {
      return name;
    }

    public String path() {
      return path;
    }

    @Nullable public String pipeline() {
      return pipeline;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof PresetColumn)) return false;
      PresetColumn that = (PresetColumn) o;
      return name.equals(that.name) && path.equals(that.path)
        && (pipeline == null ? that.pipeline == null : pipeline.equals(that.pipeline));
    }

    @Override public int hashCode() {
      int h = 1;
      h *= 1000003;
      h ^= name.hashCode();
      h *= 1000003;
      h ^= path.hashCode();
      h *= 1000003;
      h ^= (pipeline == null) ? 0 : pipeline.hashCode();
      return h;
    }

    @Override public String toString() {
      return "PresetColumn{name=" + name + ", path=" + path + ", pipeline=" + pipeline + "}";
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof PipelineSettings)) return false;
    PipelineSettings that = (PipelineSettings) o;
    return (retentionDays == null ? that.retentionDays == null
      : retentionDays.equals(that.retentionDays))
      && presetColumns.equals(that.presetColumns)
      && extra.equals(that.extra);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (retentionDays == null) ? 0 : retentionDays.hashCode();
    h *= 1000003;
    h ^= presetColumns.hashCode();
    h *= 1000003;
    h ^= extra.hashCode();
    return h;
  }

  @Override public String toString() {
    return "PipelineSettings{retentionDays=" + retentionDays + ", presetColumns=" + presetColumns
      + ", extra=" + extra.keySet() + "}";
  }
}
