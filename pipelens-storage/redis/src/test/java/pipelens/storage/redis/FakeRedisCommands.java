/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;
import pipelens.StorageException;

/**
 * Keeps keys in memory, failing like redis does for the timeseries commands used: creating an
 * existing series or reading a missing one.
 */
final class FakeRedisCommands implements RedisCommands {
  final Map<String, String> strings = new LinkedHashMap<>();
  final Map<String, Map<String, String>> hashes = new LinkedHashMap<>();
  final Map<String, Set<String>> sets = new LinkedHashMap<>();
  final Map<String, NavigableMap<Long, Double>> series = new LinkedHashMap<>();
  final Map<String, Long> retention = new LinkedHashMap<>();
  boolean down;

  @Override public synchronized String ping() throws StorageException {
    checkUp();
    return "PONG";
  }

  @Override public synchronized String get(String key) throws StorageException {
    checkUp();
    return strings.get(key);
  }

  @Override public synchronized void set(String key, String value) throws StorageException {
    checkUp();
    strings.put(key, value);
  }

  @Override public synchronized void del(String... keys) throws StorageException {
    checkUp();
    for (String key : keys) {
      strings.remove(key);
      hashes.remove(key);
      sets.remove(key);
      series.remove(key);
      retention.remove(key);
    }
  }

  @Override public synchronized boolean exists(String key) throws StorageException {
    checkUp();
    return allKeys().contains(key);
  }

  @Override public synchronized Set<String> scan(String pattern) throws StorageException {
    checkUp();
    Pattern regex = Pattern.compile(
      ("\\Q" + pattern + "\\E").replace("*", "\\E.*\\Q").replace("?", "\\E.\\Q"));
    Set<String> result = new LinkedHashSet<>();
    for (String key : allKeys()) {
      if (regex.matcher(key).matches()) result.add(key);
    }
    return result;
  }

  @Override public synchronized void hset(String key, Map<String, String> hash)
    throws StorageException {
    checkUp();
    hashes.computeIfAbsent(key, k -> new LinkedHashMap<>()).putAll(hash);
  }

  @Override public synchronized String hget(String key, String field) throws StorageException {
    checkUp();
    Map<String, String> hash = hashes.get(key);
    return hash != null ? hash.get(field) : null;
  }

  @Override public synchronized Map<String, String> hgetAll(String key) throws StorageException {
    checkUp();
    Map<String, String> hash = hashes.get(key);
    return hash != null ? new LinkedHashMap<>(hash) : new LinkedHashMap<>();
  }

  @Override public synchronized void hdel(String key, String... fields) throws StorageException {
    checkUp();
    Map<String, String> hash = hashes.get(key);
    if (hash == null) return;
    for (String field : fields) hash.remove(field);
    if (hash.isEmpty()) hashes.remove(key);
  }

  @Override public synchronized void sadd(String key, String... members)
    throws StorageException {
    checkUp();
    Set<String> set = sets.computeIfAbsent(key, k -> new LinkedHashSet<>());
    for (String member : members) set.add(member);
  }

  @Override public synchronized void srem(String key, String... members)
    throws StorageException {
    checkUp();
    Set<String> set = sets.get(key);
    if (set == null) return;
    for (String member : members) set.remove(member);
    if (set.isEmpty()) sets.remove(key);
  }

  @Override public synchronized Set<String> smembers(String key) throws StorageException {
    checkUp();
    Set<String> set = sets.get(key);
    return set != null ? new LinkedHashSet<>(set) : new LinkedHashSet<>();
  }

  @Override public synchronized void tsCreate(String key, long retentionMillis)
    throws StorageException {
    checkUp();
    if (series.containsKey(key)) throw new StorageException("ERR TSDB: key already exists");
    series.put(key, new TreeMap<>());
    retention.put(key, retentionMillis);
  }

  @Override public synchronized void tsAdd(String key, long timestamp, double value)
    throws StorageException {
    checkUp();
    // like redis, adding to a missing key creates it with default settings
    series.computeIfAbsent(key, k -> new TreeMap<>()).put(timestamp, value);
  }

  @Override public synchronized List<Sample> tsRange(String key, long from, long to)
    throws StorageException {
    checkUp();
    NavigableMap<Long, Double> samples = series.get(key);
    if (samples == null) throw new StorageException("ERR TSDB: the key does not exist");
    List<Sample> result = new ArrayList<>();
    for (Map.Entry<Long, Double> entry : samples.subMap(from, true, to, true).entrySet()) {
      result.add(new Sample(entry.getKey(), entry.getValue()));
    }
    return result;
  }

  @Override public synchronized void tsDel(String key, long from, long to)
    throws StorageException {
    checkUp();
    NavigableMap<Long, Double> samples = series.get(key);
    if (samples == null) throw new StorageException("ERR TSDB: the key does not exist");
    samples.subMap(from, true, to, true).clear();
  }

  @Override public void close() {
  }

  Set<String> allKeys() {
    Set<String> result = new LinkedHashSet<>();
    result.addAll(strings.keySet());
    result.addAll(hashes.keySet());
    result.addAll(sets.keySet());
    result.addAll(series.keySet());
    return result;
  }

  void checkUp() throws StorageException {
    if (down) throw new StorageException("Redis PING failed: Connection refused");
  }
}
