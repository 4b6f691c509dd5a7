/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import pipelens.RunMeta;
import pipelens.RunStatus;
import pipelens.internal.Nullable;

/**
 * Invoking this request retrieves runs of a pipeline matching the filters below, newest start time
 * first. Filters apply before {@link #offset()} and {@link #limit()}.
 */
// @Immutable
public final class RunQuery {
  public static final RunQuery ALL = newBuilder().build();

  static final Comparator<RunMeta> NEWEST_FIRST =
    Comparator.comparingLong(RunMeta::startTime).reversed().thenComparing(RunMeta::runId);

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Nullable final RunStatus status;
  @Nullable final Long startDate, endDate;
  @Nullable final Integer limit;
  final int offset;

  RunQuery(Builder builder) {
    status = builder.status;
    startDate = builder.startDate;
    endDate = builder.endDate;
    limit = builder.limit;
    offset = builder.offset;
  }

  /** When present, only runs with this status match. */
  @Nullable public RunStatus status() {
    return status;
  }

  /** When present, only runs starting at or after this epoch millis match. */
  @Nullable public Long startDate() {
    return startDate;
  }

  /** When present, only runs starting at or before this epoch millis match. */
  @Nullable public Long endDate() {
    return endDate;
  }

  /** Maximum count of runs to return, or null for all. */
  @Nullable public Integer limit() {
    return limit;
  }

  /** Count of matching runs to skip. */
  public int offset() {
    return offset;
  }

  /** Tests the filters, ignoring limit and offset. */
  public boolean test(RunMeta run) {
    if (status != null && run.status() != status) return false;
    if (startDate != null && run.startTime() < startDate) return false;
    if (endDate != null && run.startTime() > endDate) return false;
    return true;
  }

  /** Filters, sorts and pages runs for backends that cannot do so natively. */
  public List<RunMeta> apply(Collection<RunMeta> runs) {
    List<RunMeta> result = new ArrayList<>();
    for (RunMeta run : runs) {
      if (test(run)) result.add(run);
    }
    result.sort(NEWEST_FIRST);
    int from = Math.min(offset, result.size());
    int to = limit == null ? result.size() : (int) Math.min((long) from + limit, result.size());
    return new ArrayList<>(result.subList(from, to));
  }

  public static final class Builder {
    RunStatus status;
    Long startDate, endDate;
    Integer limit;
    int offset;

    Builder() {
    }

    Builder(RunQuery source) {
      status = source.status;
      startDate = source.startDate;
      endDate = source.endDate;
      limit = source.limit;
      offset = source.offset;
    }

    public Builder status(@Nullable RunStatus status) {
      this.status = status;
      return this;
    }

    public Builder startDate(@Nullable Long startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder endDate(@Nullable Long endDate) {
      this.endDate = endDate;
      return this;
    }

    public Builder limit(@Nullable Integer limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public RunQuery build() {
      if (limit != null && limit < 0) throw new IllegalArgumentException("limit < 0");
      if (offset < 0) throw new IllegalArgumentException("offset < 0");
      if (startDate != null && endDate != null && endDate < startDate) {
        throw new IllegalArgumentException("endDate < startDate");
      }
      return new RunQuery(this);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof RunQuery)) return false;
    RunQuery that = (RunQuery) o;
    return status == that.status
      && (startDate == null ? that.startDate == null : startDate.equals(that.startDate))
      && (endDate == null ? that.endDate == null : endDate.equals(that.endDate))
      && (limit == null ? that.limit == null : limit.equals(that.limit))
      && offset == that.offset;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (status == null) ? 0 : status.hashCode();
    h *= 1000003;
    h ^= (startDate == null) ? 0 : startDate.hashCode();
    h *= 1000003;
    h ^= (endDate == null) ? 0 : endDate.hashCode();
    h *= 1000003;
    h ^= (limit == null) ? 0 : limit.hashCode();
    h *= 1000003;
    h ^= offset;
    return h;
  }

  @Override public String toString() {
    return "RunQuery{status=" + status + ", startDate=" + startDate + ", endDate=" + endDate
      + ", limit=" + limit + ", offset=" + offset + "}";
  }
}
