/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.extension;

/** Token counts of one or more chat completions, as reported in their {@code usage} field. */
// @Immutable
public final class LlmUsage {
  public static final LlmUsage EMPTY = new LlmUsage(0, 0, 0);

  public static LlmUsage create(long promptTokens, long completionTokens, long totalTokens) {
    return new LlmUsage(promptTokens, completionTokens, totalTokens);
  }

  final long promptTokens, completionTokens, totalTokens;

  LlmUsage(long promptTokens, long completionTokens, long totalTokens) {
    this.promptTokens = promptTokens;
    this.completionTokens = completionTokens;
    this.totalTokens = totalTokens;
  }

  public long promptTokens() {
    return promptTokens;
  }

  public long completionTokens() {
    return completionTokens;
  }

  public long totalTokens() {
    return totalTokens;
  }

  public LlmUsage plus(LlmUsage that) {
    if (that == null) throw new NullPointerException("that == null");
    return new LlmUsage(promptTokens + that.promptTokens,
      completionTokens + that.completionTokens, totalTokens + that.totalTokens);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LlmUsage)) return false;
    LlmUsage that = (LlmUsage) o;
    return promptTokens == that.promptTokens
      && completionTokens == that.completionTokens
      && totalTokens == that.totalTokens;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= Long.hashCode(promptTokens);
    h *= 1000003;
    h ^= Long.hashCode(completionTokens);
    h *= 1000003;
    h ^= Long.hashCode(totalTokens);
    return h;
  }

  @Override public String toString() {
    return "LlmUsage{promptTokens=" + promptTokens + ", completionTokens=" + completionTokens
      + ", totalTokens=" + totalTokens + "}";
  }
}
