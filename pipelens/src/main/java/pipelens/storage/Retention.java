/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.util.concurrent.TimeUnit;
import pipelens.ValidationException;
import pipelens.internal.Nullable;

/**
 * Resolves how long runs of a pipeline are kept. The window is the explicit override when given,
 * else the pipeline's saved {@link PipelineSettings#retentionDays()}, else {@link
 * #DEFAULT_RETENTION_DAYS}.
 */
public final class Retention {
  public static final int DEFAULT_RETENTION_DAYS = 14;
  static final long DAY_MILLIS = TimeUnit.DAYS.toMillis(1);

  public static int resolveDays(@Nullable Integer overrideDays, PipelineSettings settings) {
    if (overrideDays != null) return checkDays(overrideDays);
    Integer saved = settings.retentionDays();
    if (saved != null) return checkDays(saved);
    return DEFAULT_RETENTION_DAYS;
  }

  /** Runs starting before the returned epoch millis are expired. */
  public static long cutoff(long now, int retentionDays) {
    return now - checkDays(retentionDays) * DAY_MILLIS;
  }

  static int checkDays(int days) {
    if (days <= 0) throw new ValidationException("retentionDays must be positive: " + days);
    return days;
  }

  Retention() {
  }
}
