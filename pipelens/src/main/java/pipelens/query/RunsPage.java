/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import pipelens.RunMeta;

/** One page of a pipeline's runs, newest first. */
// @Immutable
public final class RunsPage {
  public static RunsPage create(List<RunMeta> runs, Pagination pagination) {
    if (runs == null) throw new NullPointerException("runs == null");
    if (pagination == null) throw new NullPointerException("pagination == null");
    return new RunsPage(runs, pagination);
  }

  final List<RunMeta> runs;
  final Pagination pagination;

  RunsPage(List<RunMeta> runs, Pagination pagination) {
    this.runs = Collections.unmodifiableList(new ArrayList<>(runs));
    this.pagination = pagination;
  }

  public List<RunMeta> runs() {
    return runs;
  }

  public Pagination pagination() {
    return pagination;
  }

  @Override public String toString() {
    return "RunsPage{runs=" + runs.size() + ", pagination=" + pagination + "}";
  }
}
