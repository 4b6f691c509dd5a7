/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches lifecycle events for one step tree. The root creates the bus and every descendant
 * shares it, so a listener subscribed on the root observes the whole tree.
 */
public final class StepEventBus {
  static final Logger LOG = LoggerFactory.getLogger(StepEventBus.class);

  final Map<StepEvent.Kind, List<StepListener>> listeners =
    new EnumMap<>(StepEvent.Kind.class);

  StepEventBus() {
    for (StepEvent.Kind kind : StepEvent.Kind.values()) {
      listeners.put(kind, new CopyOnWriteArrayList<>());
    }
  }

  public void subscribe(StepEvent.Kind kind, StepListener listener) {
    if (kind == null) throw new NullPointerException("kind == null");
    if (listener == null) throw new NullPointerException("listener == null");
    listeners.get(kind).add(listener);
  }

  /** Returns true if the listener was subscribed to the kind. */
  public boolean unsubscribe(StepEvent.Kind kind, StepListener listener) {
    if (kind == null) throw new NullPointerException("kind == null");
    return listeners.get(kind).remove(listener);
  }

  void emit(StepEvent event) {
    for (StepListener listener : listeners.get(event.kind)) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        LOG.warn("listener {} failed handling {}", listener, event, e);
      }
    }
  }
}
