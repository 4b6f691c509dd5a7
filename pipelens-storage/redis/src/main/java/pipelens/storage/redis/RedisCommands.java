/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import pipelens.internal.Nullable;

/** The redis and RedisTimeSeries commands used by {@link RedisStorage}. */
interface RedisCommands extends Closeable {
  String ping() throws IOException;

  @Nullable String get(String key) throws IOException;

  void set(String key, String value) throws IOException;

  void del(String... keys) throws IOException;

  boolean exists(String key) throws IOException;

  /** Keys matching the glob pattern, iterated with SCAN. */
  Set<String> scan(String pattern) throws IOException;

  void hset(String key, Map<String, String> hash) throws IOException;

  @Nullable String hget(String key, String field) throws IOException;

  Map<String, String> hgetAll(String key) throws IOException;

  void hdel(String key, String... fields) throws IOException;

  void sadd(String key, String... members) throws IOException;

  void srem(String key, String... members) throws IOException;

  Set<String> smembers(String key) throws IOException;

  /** Creates a series which keeps the last value written at a timestamp. */
  void tsCreate(String key, long retentionMillis) throws IOException;

  void tsAdd(String key, long timestamp, double value) throws IOException;

  /** Samples with timestamps in {@code [from, to]}, ascending. */
  List<Sample> tsRange(String key, long from, long to) throws IOException;

  /** Deletes samples with timestamps in {@code [from, to]}. */
  void tsDel(String key, long from, long to) throws IOException;

  final class Sample {
    final long timestamp;
    final double value;

    Sample(long timestamp, double value) {
      this.timestamp = timestamp;
      this.value = value;
    }

    @Override public String toString() {
      return "Sample{timestamp=" + timestamp + ", value=" + value + "}";
    }
  }
}
