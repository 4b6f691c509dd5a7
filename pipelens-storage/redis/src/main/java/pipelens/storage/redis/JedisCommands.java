/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.redis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import pipelens.StorageException;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.timeseries.DuplicatePolicy;
import redis.clients.jedis.timeseries.TSCreateParams;
import redis.clients.jedis.timeseries.TSElement;

/** Sends commands through Jedis, reporting failures as {@link StorageException}. */
final class JedisCommands implements RedisCommands {
  final UnifiedJedis jedis;

  JedisCommands(UnifiedJedis jedis) {
    this.jedis = jedis;
  }

  interface Command<V> {
    V run();
  }

  <V> V send(String name, Command<V> command) throws StorageException {
    try {
      return command.run();
    } catch (JedisException e) {
      throw new StorageException("Redis " + name + " failed: " + e.getMessage(), e);
    }
  }

  @Override public String ping() throws StorageException {
    return send("PING", jedis::ping);
  }

  @Override public String get(String key) throws StorageException {
    return send("GET", () -> jedis.get(key));
  }

  @Override public void set(String key, String value) throws StorageException {
    send("SET", () -> jedis.set(key, value));
  }

  @Override public void del(String... keys) throws StorageException {
    if (keys.length == 0) return;
    send("DEL", () -> jedis.del(keys));
  }

  @Override public boolean exists(String key) throws StorageException {
    return send("EXISTS", () -> jedis.exists(key));
  }

  @Override public Set<String> scan(String pattern) throws StorageException {
    return send("SCAN", () -> {
      Set<String> result = new LinkedHashSet<>();
      ScanParams params = new ScanParams().match(pattern).count(1000);
      String cursor = ScanParams.SCAN_POINTER_START;
      do {
        ScanResult<String> page = jedis.scan(cursor, params);
        result.addAll(page.getResult());
        cursor = page.getCursor();
      } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
      return result;
    });
  }

  @Override public void hset(String key, Map<String, String> hash) throws StorageException {
    send("HSET", () -> jedis.hset(key, hash));
  }

  @Override public String hget(String key, String field) throws StorageException {
    return send("HGET", () -> jedis.hget(key, field));
  }

  @Override public Map<String, String> hgetAll(String key) throws StorageException {
    return send("HGETALL", () -> jedis.hgetAll(key));
  }

  @Override public void hdel(String key, String... fields) throws StorageException {
    if (fields.length == 0) return;
    send("HDEL", () -> jedis.hdel(key, fields));
  }

  @Override public void sadd(String key, String... members) throws StorageException {
    send("SADD", () -> jedis.sadd(key, members));
  }

  @Override public void srem(String key, String... members) throws StorageException {
    if (members.length == 0) return;
    send("SREM", () -> jedis.srem(key, members));
  }

  @Override public Set<String> smembers(String key) throws StorageException {
    return send("SMEMBERS", () -> jedis.smembers(key));
  }

  @Override public void tsCreate(String key, long retentionMillis) throws StorageException {
    send("TS.CREATE", () -> jedis.tsCreate(key, TSCreateParams.createParams()
      .retention(retentionMillis)
      .duplicatePolicy(DuplicatePolicy.LAST)));
  }

  @Override public void tsAdd(String key, long timestamp, double value) throws StorageException {
    send("TS.ADD", () -> jedis.tsAdd(key, timestamp, value));
  }

  @Override public List<Sample> tsRange(String key, long from, long to) throws StorageException {
    return send("TS.RANGE", () -> {
      List<TSElement> elements = jedis.tsRange(key, from, to);
      List<Sample> result = new ArrayList<>(elements.size());
      for (TSElement element : elements) {
        result.add(new Sample(element.getTimestamp(), element.getValue()));
      }
      return result;
    });
  }

  @Override public void tsDel(String key, long from, long to) throws StorageException {
    send("TS.DEL", () -> jedis.tsDel(key, from, to));
  }

  @Override public void close() {
    jedis.close();
  }

  @Override public String toString() {
    return "JedisCommands{}";
  }
}
