/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * A single storage or network operation which can be used once, either {@link #execute()
 * synchronously} or {@link #enqueue(Callback) asynchronously}.
 *
 * <p>Implementations validate input when the call is created, so that {@code
 * stepStore.getRunData(null)} fails immediately instead of on {@link #execute()}.
 *
 * <p>Ex.
 * <pre>{@code
 * // input errors propagate here
 * Call<RunData> getRun = storage.stepStore().getRunData(runId);
 * // this performs the I/O
 * RunData run = getRun.execute();
 * }</pre>
 *
 * <p>A call cannot be invoked twice. Use {@linkplain #clone()} to repeat one.
 *
 * @param <V> the success type, never null except when {@code V} is {@linkplain Void}.
 */
public abstract class Call<V> implements Cloneable {
  /** Returns a completed call which has the supplied value. */
  public static <V> Call<V> create(V v) {
    return new Constant<>(v);
  }

  public static <T> Call<List<T>> emptyList() {
    return Call.create(Collections.emptyList());
  }

  public interface Mapper<V1, V2> {
    V2 map(V1 input);
  }

  /**
   * Maps the result of this call into a different shape. For example, a query service maps raw
   * timeseries entries into a page with statistics.
   *
   * <p>"this" instance should be discarded in favor of the result of this method.
   */
  public final <R> Call<R> map(Mapper<V, R> mapper) {
    return new Mapping<>(mapper, this);
  }

  public interface FlatMapper<V1, V2> {
    Call<V2> map(V1 input);
  }

  /**
   * Chains another call onto the result of this one. For example, a purge first reads the
   * pipeline's settings and then deletes runs older than the resolved retention window.
   *
   * <pre>{@code
   * purge = settings.getSettings(name).flatMap(s -> deleteRunsStartedBefore(name, cutoff(s)));
   * }</pre>
   *
   * Cancelation propagates to the mapped call.
   */
  public final <R> Call<R> flatMap(FlatMapper<V, R> flatMapper) {
    return new FlatMapping<>(flatMapper, this);
  }

  // Taken from RxJava throwIfFatal
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /**
   * Invokes the operation, returning a success value or propagating an error to the caller.
   *
   * @return a success value. Null is unexpected, except when {@code V} is {@linkplain Void}.
   * @throws IllegalStateException if this call was already executed or enqueued
   */
  public abstract V execute() throws IOException;

  /** Invokes the operation asynchronously, signaling the {@code callback} when complete. */
  public abstract void enqueue(Callback<V> callback);

  /** Requests to cancel this call. Blocking storage operations may ignore this. */
  public abstract void cancel();

  /** Returns true if {@linkplain #cancel()} was called. */
  public abstract boolean isCanceled();

  /** Returns a copy of this object, so you can make an identical follow-up request. */
  @Override public abstract Call<V> clone();

  static class Constant<V> extends Base<V> { // not final for mock testing
    final V v;

    Constant(V v) {
      this.v = v;
    }

    @Override protected V doExecute() {
      return v;
    }

    @Override protected void doEnqueue(Callback<V> callback) {
      callback.onSuccess(v);
    }

    @Override public Call<V> clone() {
      return new Constant<>(v);
    }

    @Override public String toString() {
      return "ConstantCall{value=" + v + "}";
    }
  }

  static final class Mapping<R, V> extends Base<R> {
    final Mapper<V, R> mapper;
    final Call<V> delegate;

    Mapping(Mapper<V, R> mapper, Call<V> delegate) {
      this.mapper = mapper;
      this.delegate = delegate;
    }

    @Override protected R doExecute() throws IOException {
      return mapper.map(delegate.execute());
    }

    @Override protected void doEnqueue(Callback<R> callback) {
      delegate.enqueue(new Callback<V>() {
        @Override public void onSuccess(V value) {
          R mapped;
          try {
            mapped = mapper.map(value);
          } catch (Throwable t) {
            propagateIfFatal(t);
            callback.onError(t);
            return;
          }
          callback.onSuccess(mapped);
        }

        @Override public void onError(Throwable t) {
          callback.onError(t);
        }
      });
    }

    @Override protected void doCancel() {
      delegate.cancel();
    }

    @Override public String toString() {
      return "Mapping{call=" + delegate + ", mapper=" + mapper + "}";
    }

    @Override public Call<R> clone() {
      return new Mapping<>(mapper, delegate.clone());
    }
  }

  static final class FlatMapping<R, V> extends Base<R> {
    final FlatMapper<V, R> flatMapper;
    final Call<V> delegate;
    volatile Call<R> mapped;

    FlatMapping(FlatMapper<V, R> flatMapper, Call<V> delegate) {
      this.flatMapper = flatMapper;
      this.delegate = delegate;
    }

    @Override protected R doExecute() throws IOException {
      return (mapped = flatMapper.map(delegate.execute())).execute();
    }

    @Override protected void doEnqueue(Callback<R> callback) {
      delegate.enqueue(new Callback<V>() {
        @Override public void onSuccess(V value) {
          Call<R> next;
          try {
            next = flatMapper.map(value);
          } catch (Throwable t) {
            propagateIfFatal(t);
            callback.onError(t);
            return;
          }
          (mapped = next).enqueue(callback);
        }

        @Override public void onError(Throwable t) {
          callback.onError(t);
        }
      });
    }

    @Override protected void doCancel() {
      delegate.cancel();
      Call<R> mapped = this.mapped;
      if (mapped != null) mapped.cancel();
    }

    @Override public String toString() {
      return "FlatMapping{call=" + delegate + ", flatMapper=" + flatMapper + "}";
    }

    @Override public Call<R> clone() {
      return new FlatMapping<>(flatMapper, delegate.clone());
    }
  }

  /** Guards against double execution and tracks cancelation. */
  public static abstract class Base<V> extends Call<V> {
    volatile boolean canceled;
    boolean executed;

    protected Base() {
    }

    @Override public final V execute() throws IOException {
      markExecuted();
      if (isCanceled()) throw new IOException("Canceled");
      return doExecute();
    }

    protected abstract V doExecute() throws IOException;

    @Override public final void enqueue(Callback<V> callback) {
      markExecuted();
      if (isCanceled()) {
        callback.onError(new IOException("Canceled"));
      } else {
        doEnqueue(callback);
      }
    }

    /**
     * Defaults to running {@link #doExecute()} on the calling thread. Override when the operation
     * has a natively asynchronous form.
     */
    protected void doEnqueue(Callback<V> callback) {
      V result;
      try {
        result = doExecute();
      } catch (Throwable t) {
        propagateIfFatal(t);
        callback.onError(t);
        return;
      }
      callback.onSuccess(result);
    }

    synchronized void markExecuted() {
      if (executed) throw new IllegalStateException("Already Executed");
      executed = true;
    }

    @Override public final void cancel() {
      canceled = true;
      doCancel();
    }

    protected void doCancel() {
    }

    @Override public final boolean isCanceled() {
      return canceled;
    }
  }
}
