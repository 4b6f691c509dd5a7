/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.codec.JsonCodec;
import pipelens.internal.Nullable;

/**
 * A named, timed unit of work inside a pipeline run. Steps form a tree: {@link #step(String,
 * StepFunction)} runs a function as a child of this step, timing it and capturing its result or
 * error.
 *
 * <p>Ex.
 * <pre>{@code
 * Pipeline pipeline = Pipeline.newBuilder("ingest").build();
 * pipeline.run(ingest -> {
 *   List<Row> rows = ingest.step("load", load -> loadRows());
 *   ingest.record("rowCount", rows.size());
 *   return ingest.step("transform", t -> transform(rows));
 * });
 * }</pre>
 *
 * <h3>Keys</h3>
 * A step's key is its parent's key, a dot, then its name with dots replaced by underscores. When a
 * sibling already has that key, a suffix {@code ___N} is added, where N counts the earlier
 * siblings with the same base key.
 *
 * <h3>Threads</h3>
 * Children may run concurrently, for example via {@link #stepAsync}. Records, children and timing
 * are safe to read from any thread, and {@link #flatten()} or {@link #toTree()} may be called while
 * the tree is running.
 */
public final class Step {
  static final Logger LOG = LoggerFactory.getLogger(Step.class);

  /** Creates a root step with its own event bus. */
  public static Step newRoot(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return new Step(name, sanitize(name), null, new StepEventBus());
  }

  static String sanitize(String name) {
    return name.replace('.', '_');
  }

  final String name, key;
  @Nullable final Step parent;
  final StepEventBus bus;
  final List<Step> children = new ArrayList<>(); // guarded by this
  final Set<String> childKeys = new HashSet<>(); // guarded by this
  final Map<String, Integer> duplicateCounts = new LinkedHashMap<>(); // guarded by this
  final Map<String, JsonNode> records = new LinkedHashMap<>(); // guarded by records
  boolean started; // guarded by this

  volatile long startTs;
  @Nullable volatile Long endTs;
  @Nullable volatile JsonNode result;
  @Nullable volatile String error;

  Step(String name, String key, @Nullable Step parent, StepEventBus bus) {
    this.name = name;
    this.key = key;
    this.parent = parent;
    this.bus = bus;
  }

  public String name() {
    return name;
  }

  public String key() {
    return key;
  }

  public boolean isRoot() {
    return parent == null;
  }

  @Nullable public Step parent() {
    return parent;
  }

  /** The bus shared by every step in this tree. */
  public StepEventBus eventBus() {
    return bus;
  }

  /** Snapshot of timing. End time and usage are null while running. */
  public TimeMeta time() {
    long startTs = this.startTs;
    Long endTs = this.endTs;
    return endTs == null ? TimeMeta.started(startTs) : TimeMeta.finished(startTs, endTs);
  }

  /** Snapshot of values recorded so far, in insertion order. */
  public Map<String, JsonNode> records() {
    synchronized (records) {
      return Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }
  }

  @Nullable public JsonNode result() {
    return result;
  }

  @Nullable public String error() {
    return error;
  }

  /** Snapshot of children in creation order. */
  public List<Step> children() {
    synchronized (this) {
      return Collections.unmodifiableList(new ArrayList<>(children));
    }
  }

  /**
   * Runs {@code fn} as a new child of this step. The result is stored on the child and returned.
   * If {@code fn} throws, its message is stored as the child's error and the same exception is
   * rethrown.
   */
  public <T> T step(String name, StepFunction<T> fn) throws Exception {
    if (fn == null) throw new NullPointerException("fn == null");
    return newChild(name).run(fn);
  }

  /**
   * Like {@link #step(String, StepFunction)}, but runs the child on {@code executor}. The child is
   * created, and so keyed, before this returns. Use this to run siblings concurrently.
   */
  public <T> CompletableFuture<T> stepAsync(String name, StepFunction<T> fn, Executor executor) {
    if (fn == null) throw new NullPointerException("fn == null");
    if (executor == null) throw new NullPointerException("executor == null");
    Step child = newChild(name);
    CompletableFuture<T> result = new CompletableFuture<>();
    executor.execute(() -> {
      try {
        result.complete(child.run(fn));
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    });
    return result;
  }

  /**
   * Stores a value under {@code key} in this step's records and emits a record event. Once the step
   * has finished, its records are fixed: later values are dropped with a warning.
   */
  public void record(String key, @Nullable Object value) {
    if (key == null) throw new NullPointerException("key == null");
    JsonNode node = JsonCodec.toJsonNode(value);
    synchronized (records) {
      if (endTs != null) {
        LOG.warn("Dropping record {} on finished step {}", key, this.key);
        return;
      }
      records.put(key, node);
    }
    bus.emit(StepEvent.record(this, key, node));
  }

  /** Subscribes to events from this step's whole tree. */
  public void on(StepEvent.Kind kind, StepListener listener) {
    bus.subscribe(kind, listener);
  }

  /** Snapshot of this step in its persisted form. */
  public StepMeta meta() {
    StepMeta.Builder result = StepMeta.newBuilder()
      .name(name)
      .key(key)
      .time(time())
      .records(records())
      .result(this.result)
      .error(this.error);
    return result.build();
  }

  /** This step, then each child's flattening in creation order. */
  public List<StepMeta> flatten() {
    List<StepMeta> result = new ArrayList<>();
    flattenInto(result);
    return result;
  }

  void flattenInto(List<StepMeta> result) {
    result.add(meta());
    for (Step child : children()) child.flattenInto(result);
  }

  /** Nested snapshot mirroring the live tree. */
  public StepNode toTree() {
    List<Step> children = children();
    List<StepNode> substeps = new ArrayList<>(children.size());
    for (Step child : children) substeps.add(child.toTree());
    return StepNode.create(meta(), substeps);
  }

  Step newChild(String name) {
    if (name == null) throw new NullPointerException("name == null");
    String baseKey = key + "." + sanitize(name);
    Step child;
    synchronized (this) {
      String childKey = baseKey;
      if (childKeys.contains(baseKey)) {
        int count = duplicateCounts.getOrDefault(baseKey, 0);
        do {
          childKey = baseKey + "___" + ++count;
        } while (childKeys.contains(childKey));
        duplicateCounts.put(baseKey, count);
        LOG.warn("Step key {} already exists under {}; using {}", baseKey, key, childKey);
      }
      childKeys.add(childKey);
      child = new Step(name, childKey, this, bus);
      children.add(child);
    }
    return child;
  }

  /** Executes the body of this step. A step runs at most once. */
  <T> T run(StepFunction<T> fn) throws Exception {
    synchronized (this) {
      if (started) throw new IllegalStateException("Step " + key + " already ran");
      started = true;
    }
    startTs = System.currentTimeMillis();
    bus.emit(StepEvent.create(StepEvent.Kind.STEP_START, this));
    try {
      T value = fn.apply(this);
      if (value != null) result = JsonCodec.toJsonNode(value);
      bus.emit(StepEvent.create(StepEvent.Kind.STEP_SUCCESS, this));
      return value;
    } catch (Throwable t) {
      error = messageOf(t);
      bus.emit(StepEvent.create(StepEvent.Kind.STEP_ERROR, this));
      throw t;
    } finally {
      endTs = Math.max(System.currentTimeMillis(), startTs);
      bus.emit(StepEvent.create(StepEvent.Kind.STEP_COMPLETE, this));
    }
  }

  static String messageOf(Throwable t) {
    String message = t.getMessage();
    return message != null && !message.isEmpty() ? message : t.toString();
  }

  @Override public String toString() {
    return "Step{key=" + key + "}";
  }
}
