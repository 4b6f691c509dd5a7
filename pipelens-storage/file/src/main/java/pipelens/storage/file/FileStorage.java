/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.Call;
import pipelens.CheckResult;
import pipelens.RunMeta;
import pipelens.StorageException;
import pipelens.codec.JsonCodec;
import pipelens.internal.KeyedLock;
import pipelens.internal.SupplierCall;
import pipelens.storage.SettingsStore;
import pipelens.storage.StepConsumer;
import pipelens.storage.StepStore;
import pipelens.storage.StepTimeseriesEntry;
import pipelens.storage.StorageComponent;

/**
 * Stores runs as JSON documents in a directory tree. See {@link FileLayout} for where each document
 * lives.
 *
 * <p>Read-modify-write of shared documents, such as a pipeline's run summaries, is serialized per
 * file within this process. Two processes must not write the same directory.
 */
public final class FileStorage extends StorageComponent {
  static final Logger LOG = LoggerFactory.getLogger(FileStorage.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder extends StorageComponent.Builder {
    Path basePath = Paths.get("pipelens-data");

    /** Directory holding all documents. Defaults to "pipelens-data" in the working directory. */
    public Builder basePath(Path basePath) {
      if (basePath == null) throw new NullPointerException("basePath == null");
      this.basePath = basePath;
      return this;
    }

    public Builder basePath(String basePath) {
      if (basePath == null) throw new NullPointerException("basePath == null");
      return basePath(Paths.get(basePath));
    }

    @Override public FileStorage build() {
      return new FileStorage(this);
    }

    Builder() {
    }
  }

  final FileLayout layout;
  final KeyedLock lock = new KeyedLock();
  final FileStepConsumer stepConsumer;
  final FileStepStore stepStore;
  final FileSettingsStore settingsStore;
  volatile boolean connected;

  FileStorage(Builder builder) {
    layout = new FileLayout(builder.basePath.toAbsolutePath());
    stepConsumer = new FileStepConsumer(this);
    stepStore = new FileStepStore(this);
    settingsStore = new FileSettingsStore(this);
  }

  public Path basePath() {
    return layout.basePath;
  }

  @Override public void connect() throws IOException {
    if (connected) return;
    try {
      Files.createDirectories(layout.pipelinesDir());
    } catch (IOException e) {
      throw new StorageException("Could not create " + layout.basePath, e);
    }
    connected = true;
    LOG.info("Storing runs under {}", layout.basePath);
  }

  @Override public StepConsumer stepConsumer() {
    return stepConsumer;
  }

  @Override public StepStore stepStore() {
    return stepStore;
  }

  @Override public SettingsStore settingsStore() {
    return settingsStore;
  }

  @Override public CheckResult check() {
    try {
      connect();
      if (!Files.isWritable(layout.basePath)) {
        return CheckResult.failed(new StorageException(layout.basePath + " is not writable"));
      }
    } catch (IOException | RuntimeException e) {
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override protected Call<Integer> deleteRunsStartedBefore(String pipeline, long cutoff) {
    return SupplierCall.of("deleteRunsStartedBefore", () -> doDelete(pipeline, cutoff));
  }

  int doDelete(String pipeline, long cutoff) throws IOException {
    Path index = layout.pipelineRuns(pipeline);
    Set<String> deleted = lock.withLock(index.toString(), () -> {
      List<RunMeta> runs = FileStepStore.readRuns(index);
      List<RunMeta> kept = new ArrayList<>(runs.size());
      Set<String> result = new HashSet<>();
      for (RunMeta run : runs) {
        if (run.startTime() < cutoff) {
          result.add(run.runId());
        } else {
          kept.add(run);
        }
      }
      if (!result.isEmpty()) FileLayout.write(index, JsonCodec.writeRunMetaList(kept));
      return result;
    });
    if (deleted.isEmpty()) return 0;

    for (String runId : deleted) {
      Path runDir = layout.runDir(runId);
      lock.withLock(runDir.toString(), () -> {
        FileLayout.deleteRecursively(runDir);
        return null;
      });
    }
    for (Path series : FileLayout.listJson(layout.timeseriesDir(pipeline))) {
      lock.withLock(series.toString(), () -> {
        List<StepTimeseriesEntry> entries = FileStepStore.readTimeseries(series);
        boolean changed = entries.removeIf(entry -> deleted.contains(entry.runId()));
        if (entries.isEmpty()) {
          Files.deleteIfExists(series);
        } else if (changed) {
          FileLayout.write(series, JsonCodec.writeTimeseries(entries));
        }
        return null;
      });
    }
    return deleted.size();
  }

  /** Deletes every document. Visible for testing */
  public void clear() throws IOException {
    FileLayout.deleteRecursively(layout.basePath);
    connected = false;
  }

  @Override public void close() {
    // no resources held open between calls
  }

  @Override public String toString() {
    return "FileStorage{basePath=" + layout.basePath + "}";
  }
}
