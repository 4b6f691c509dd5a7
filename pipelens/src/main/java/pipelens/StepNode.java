/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Nested snapshot of a step and its children, as returned by {@link Step#toTree()}. */
// @Immutable
public final class StepNode {
  public static StepNode create(StepMeta meta, List<StepNode> substeps) {
    if (meta == null) throw new NullPointerException("meta == null");
    if (substeps == null) throw new NullPointerException("substeps == null");
    return new StepNode(meta, substeps);
  }

  final StepMeta meta;
  final List<StepNode> substeps;

  StepNode(StepMeta meta, List<StepNode> substeps) {
    this.meta = meta;
    this.substeps = Collections.unmodifiableList(new ArrayList<>(substeps));
  }

  public StepMeta meta() {
    return meta;
  }

  /** Children in creation order. */
  public List<StepNode> substeps() {
    return substeps;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof StepNode)) return false;
    StepNode that = (StepNode) o;
    return meta.equals(that.meta) && substeps.equals(that.substeps);
  }

  @Override public int hashCode() {
    return (1000003 ^ meta.hashCode()) * 1000003 ^ substeps.hashCode();
  }

  @Override public String toString() {
    return "StepNode{meta=" + meta + ", substeps=" + substeps + "}";
  }
}
