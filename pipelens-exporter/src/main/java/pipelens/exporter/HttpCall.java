/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.exporter;

import java.io.IOException;
import okhttp3.Response;
import okhttp3.ResponseBody;
import pipelens.Call;
import pipelens.Callback;

/** Posts one request to the collector, succeeding on any 2xx response. */
final class HttpCall extends Call<Void> {
  final okhttp3.Call call;

  HttpCall(okhttp3.Call call) {
    this.call = call;
  }

  @Override public Void execute() throws IOException {
    Response response;
    try {
      response = call.execute();
    } catch (IOException e) {
      throw failed(call, e);
    }
    return parseResponse(response);
  }

  @Override public void enqueue(Callback<Void> delegate) {
    call.enqueue(new CallbackAdapter(delegate));
  }

  @Override public void cancel() {
    call.cancel();
  }

  @Override public boolean isCanceled() {
    return call.isCanceled();
  }

  @Override public HttpCall clone() {
    return new HttpCall(call.clone());
  }

  @Override public String toString() {
    return "HttpCall{" + call.request().url() + "}";
  }

  static final class CallbackAdapter implements okhttp3.Callback {
    final Callback<Void> delegate;

    CallbackAdapter(Callback<Void> delegate) {
      this.delegate = delegate;
    }

    @Override public void onFailure(okhttp3.Call call, IOException e) {
      delegate.onError(failed(call, e));
    }

    /** Note: this runs on the {@link okhttp3.OkHttpClient#dispatcher() dispatcher} thread! */
    @Override public void onResponse(okhttp3.Call call, Response response) {
      try {
        delegate.onSuccess(parseResponse(response));
      } catch (Throwable e) {
        propagateIfFatal(e);
        delegate.onError(e);
      }
    }
  }

  static TransportException failed(okhttp3.Call call, IOException e) {
    if (e instanceof TransportException) return (TransportException) e;
    return new TransportException(
      "request to " + call.request().url() + " failed: " + e.getMessage(), e);
  }

  static Void parseResponse(Response response) throws IOException {
    try (ResponseBody body = response.body()) {
      if (response.isSuccessful()) return null;
      String content = body != null ? body.string() : "";
      throw new TransportException("response for " + response.request().url() + " failed: "
        + response.code() + (content.isEmpty() ? "" : " " + content), response.code());
    }
  }
}
