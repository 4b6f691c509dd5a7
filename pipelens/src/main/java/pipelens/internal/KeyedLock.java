/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.internal;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes read-modify-write cycles that target the same key, such as a file path or a redis
 * key. A writer for key K blocks until the current writer for K finishes. Writers of different
 * keys proceed in parallel.
 *
 * <p>This is process-local: it does not exclude another process that shares the same directory or
 * redis database.
 */
public final class KeyedLock {
  public interface Action<V> {
    V run() throws IOException;
  }

  final Map<String, Entry> locks = new LinkedHashMap<>();

  public <V> V withLock(String key, Action<V> action) throws IOException {
    if (key == null) throw new NullPointerException("key == null");
    if (action == null) throw new NullPointerException("action == null");
    Entry entry = acquire(key);
    entry.lock.lock();
    try {
      return action.run();
    } finally {
      entry.lock.unlock();
      release(key, entry);
    }
  }

  /** Count of keys that currently have a holder or waiter. */
  public synchronized int activeKeys() {
    return locks.size();
  }

  synchronized Entry acquire(String key) {
    Entry entry = locks.get(key);
    if (entry == null) locks.put(key, entry = new Entry());
    entry.references++;
    return entry;
  }

  synchronized void release(String key, Entry entry) {
    // drop idle entries so a long-running process doesn't accumulate one lock per step name
    if (--entry.references == 0) locks.remove(key);
  }

  static final class Entry {
    final ReentrantLock lock = new ReentrantLock();
    int references;
  }
}
