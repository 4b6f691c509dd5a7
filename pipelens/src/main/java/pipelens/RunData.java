/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A run's summary and its steps, as returned by {@link pipelens.storage.StepStore#getRunData}. */
// @Immutable
public final class RunData {
  public static RunData create(RunMeta meta, List<StepMeta> steps) {
    if (meta == null) throw new NullPointerException("meta == null");
    if (steps == null) throw new NullPointerException("steps == null");
    return new RunData(meta, steps);
  }

  final RunMeta meta;
  final List<StepMeta> steps;

  RunData(RunMeta meta, List<StepMeta> steps) {
    this.meta = meta;
    this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
  }

  public RunMeta meta() {
    return meta;
  }

  public List<StepMeta> steps() {
    return steps;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RunData)) return false;
    RunData that = (RunData) o;
    return meta.equals(that.meta) && steps.equals(that.steps);
  }

  @Override public int hashCode() {
    return (1000003 ^ meta.hashCode()) * 1000003 ^ steps.hashCode();
  }

  @Override public String toString() {
    return "RunData{meta=" + meta + ", steps=" + steps + "}";
  }
}
