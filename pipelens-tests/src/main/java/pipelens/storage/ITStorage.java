/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage;

import java.io.IOException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.TestInstance;
import org.opentest4j.TestAbortedException;
import pipelens.CheckResult;
import pipelens.PipelineMeta;
import pipelens.RunStatus;
import pipelens.StepMeta;

/** Base class for all {@link StorageComponent} integration tests. */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class ITStorage<T extends StorageComponent> {
  protected T storage;

  @BeforeAll void initializeStorage(TestInfo testInfo) throws IOException {
    @SuppressWarnings("unchecked")
    T storage = (T) newStorageBuilder(testInfo).build();
    this.storage = storage;
    checkStorage();
    storage.connect();
  }

  protected void checkStorage() {
    CheckResult check = storage.check();
    if (!check.ok()) {
      throw new TestAbortedException("Could not connect to storage, skipping test: "
        + check.error().getMessage(), check.error());
    }
  }

  @AfterAll void closeStorage() throws Exception {
    storage.close();
  }

  @AfterEach void clearStorage() throws Exception {
    clear();
  }

  /** Returns a new {@link StorageComponent.Builder} for connecting to the backend for the test. */
  protected abstract StorageComponent.Builder newStorageBuilder(TestInfo testInfo);

  /** Clears store between tests. */
  protected abstract void clear() throws Exception;

  protected StepConsumer consumer() {
    return storage.stepConsumer();
  }

  protected StepStore store() {
    return storage.stepStore();
  }

  protected SettingsStore settings() {
    return storage.settingsStore();
  }

  /** Writes a finished run the way an auto-saving pipeline does. */
  protected final void accept(PipelineMeta run) throws IOException {
    consumer().initiateRun(run).execute();
    for (StepMeta step : run.steps()) {
      consumer().finishStep(run.runId(), step).execute();
    }
    consumer().finishRun(run, run.status()).execute();
  }

  protected final void accept(PipelineMeta run, RunStatus status) throws IOException {
    consumer().initiateRun(run).execute();
    consumer().finishRun(run, status).execute();
  }
}
